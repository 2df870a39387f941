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

import java.util.List;

/// Thrown when a named column specifier does not appear in the header.
public class ColumnNotFoundException extends CsvSortException {
    private final String columnName;
    private final List<String> header;

    public ColumnNotFoundException(String columnName, List<String> header) {
        super("Column name is not found in header: \"" + columnName + "\" (header: " + header + ")");
        this.columnName = columnName;
        this.header = List.copyOf(header);
    }

    public String getColumnName() {
        return columnName;
    }

    public List<String> getHeader() {
        return header;
    }
}
