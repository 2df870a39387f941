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
import java.nio.file.Path;

/// A lazy, finite, forward-only sequence of rows read from a file.
///
/// The same abstraction is used for the original input and for every chunk and merge file.
/// A source can be iterated only once; to read the rows again, open the file again.
/// Read failures during iteration surface as [java.io.UncheckedIOException].
public interface RowSource extends Iterable<Row>, Closeable {

    /// @return the file this source reads from
    Path getPath();

    /// The physical record number of the row most recently returned by the iterator,
    /// counting from 1 and including any header row. Zero before the first row.
    /// @return the current record number
    long getRowNumber();
}
