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

import java.nio.file.Path;

/// Thrown when a row has fewer fields than the sort key columns require.
public class MalformedRowException extends CsvSortException {
    /// The file the row was read from, or null when unknown
    private final Path path;

    /// The physical record number of the row, or -1 when unknown
    private final long rowNumber;

    private final int arity;
    private final int requiredArity;

    /// @param path the file containing the row, may be null
    /// @param rowNumber the physical record number of the row, or -1
    /// @param arity the number of fields the row has
    /// @param requiredArity the number of fields the sort key needs
    public MalformedRowException(Path path, long rowNumber, int arity, int requiredArity) {
        super(formatMessage(path, rowNumber, arity, requiredArity));
        this.path = path;
        this.rowNumber = rowNumber;
        this.arity = arity;
        this.requiredArity = requiredArity;
    }

    public Path getPath() {
        return path;
    }

    public long getRowNumber() {
        return rowNumber;
    }

    public int getArity() {
        return arity;
    }

    public int getRequiredArity() {
        return requiredArity;
    }

    private static String formatMessage(Path path, long rowNumber, int arity, int requiredArity) {
        StringBuilder sb = new StringBuilder("Row has ").append(arity).append(" field(s) but the sort key needs ")
            .append(requiredArity);
        if (rowNumber >= 0) {
            sb.append(" at row ").append(rowNumber);
        }
        if (path != null) {
            sb.append(" of ").append(path);
        }
        return sb.toString();
    }
}
