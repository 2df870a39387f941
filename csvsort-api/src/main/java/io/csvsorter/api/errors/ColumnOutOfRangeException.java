/*
 * Copyright (c) csvsort
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.csvsorter.api.errors;

/// Thrown when a positional column specifier is not within the width of the header.
public class ColumnOutOfRangeException extends CsvSortException {
    private final int columnIndex;
    private final int headerWidth;

    public ColumnOutOfRangeException(int columnIndex, int headerWidth) {
        super(String.format("Column index is out of range: \"%d\" (header has %d columns)", columnIndex, headerWidth));
        this.columnIndex = columnIndex;
        this.headerWidth = headerWidth;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public int getHeaderWidth() {
        return headerWidth;
    }
}
