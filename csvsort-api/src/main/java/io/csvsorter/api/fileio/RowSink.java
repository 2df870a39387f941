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

package io.csvsorter.api.fileio;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/// A way to store a sequence of rows in a file.
/// This should be closed at the end of the writer lifecycle so that buffered rows are flushed.
public interface RowSink extends Closeable {

    /// @return the file this sink writes to
    Path getPath();

    /// Append one row
    /// @param row the row to write
    /// @throws IOException if the row cannot be written
    void write(Row row) throws IOException;

    /// Append every row of the given sequence, in order
    /// @param rows the rows to write
    /// @throws IOException if a row cannot be written
    default void writeAll(Iterable<Row> rows) throws IOException {
        for (Row row : rows) {
            write(row);
        }
    }

    /// @return the number of rows written so far
    long getRowCount();
}
