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

/// Thrown when reading or writing the input, a chunk, a merge file or the output fails.
public class CsvSortIOException extends CsvSortException {
    private final SortPhase phase;
    private final Path path;

    /// @param phase the stage that failed
    /// @param path the file being read or written
    /// @param cause the underlying I/O failure
    public CsvSortIOException(SortPhase phase, Path path, Throwable cause) {
        super("I/O failure during " + phase + " on " + path + ": " + cause.getMessage(), cause);
        this.phase = phase;
        this.path = path;
    }

    public SortPhase getPhase() {
        return phase;
    }

    public Path getPath() {
        return path;
    }
}
