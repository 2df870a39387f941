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

package io.csvsorter.sort;

import io.csvsorter.api.errors.CsvSortIOException;
import io.csvsorter.api.errors.SortPhase;
import io.csvsorter.api.fileio.Row;
import io.csvsorter.api.fileio.RowSource;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/// One independently advancing stream of sorted rows within a merge.
///
/// The cursor holds exactly one row, the current head of its stream, and reads the next
/// row only when [#advance()] is called. The ordinal is the position of this stream
/// within its merge group and breaks ties between equal keys.
class RowCursor implements Closeable {
    private final RowSource source;
    private final Iterator<Row> rows;
    private final int ordinal;
    private Row current;

    /// Wrap a source. The cursor starts before the first row; call [#advance()] to load it.
    RowCursor(RowSource source, int ordinal) {
        this.source = source;
        this.rows = source.iterator();
        this.ordinal = ordinal;
    }

    /// @return the current head row
    /// @throws NoSuchElementException if the stream is exhausted
    Row peek() {
        if (current == null) {
            throw new NoSuchElementException("Cursor over " + source.getPath() + " is exhausted");
        }
        return current;
    }

    /// Move to the next row of the stream
    /// @return true if there is a new current row, false if the stream is exhausted
    boolean advance() {
        try {
            current = rows.hasNext() ? rows.next() : null;
        } catch (UncheckedIOException e) {
            throw new CsvSortIOException(SortPhase.MERGE, source.getPath(), e.getCause());
        }
        return current != null;
    }

    boolean isExhausted() {
        return current == null;
    }

    int ordinal() {
        return ordinal;
    }

    Path getPath() {
        return source.getPath();
    }

    @Override
    public void close() throws IOException {
        source.close();
    }
}
