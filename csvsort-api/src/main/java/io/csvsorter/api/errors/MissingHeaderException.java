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

/// Thrown when a named column specifier is used on a file without a header.
public class MissingHeaderException extends CsvSortException {
    private final String columnName;

    public MissingHeaderException(String columnName) {
        super("A header is needed to find the index of this column name: \"" + columnName + "\"");
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
