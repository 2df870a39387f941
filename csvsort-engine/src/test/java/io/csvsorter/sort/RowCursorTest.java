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

import io.csvsorter.api.fileio.Row;
import io.csvsorter.readers.CsvRowReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowCursorTest {

    @TempDir
    Path tempDir;

    @Test
    void startsBeforeFirstRowAndWalksToTheEnd() throws IOException {
        Path file = TestFiles.writeRows(tempDir.resolve("rows.csv"), List.of(Row.of("a"), Row.of("b")));

        try (RowCursor cursor = new RowCursor(CsvRowReader.open(file, TestFiles.CHUNK_DIALECT), 3)) {
            assertThat(cursor.isExhausted()).isTrue();
            assertThat(cursor.ordinal()).isEqualTo(3);
            assertThat(cursor.getPath()).isEqualTo(file);

            assertThat(cursor.advance()).isTrue();
            assertThat(cursor.peek()).isEqualTo(Row.of("a"));
            assertThat(cursor.peek()).isEqualTo(Row.of("a"));
            assertThat(cursor.advance()).isTrue();
            assertThat(cursor.peek()).isEqualTo(Row.of("b"));

            assertThat(cursor.advance()).isFalse();
            assertThat(cursor.isExhausted()).isTrue();
            assertThatThrownBy(cursor::peek).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    void emptyStreamIsExhaustedImmediately() throws IOException {
        Path file = TestFiles.writeRows(tempDir.resolve("empty.csv"), List.of());

        try (RowCursor cursor = new RowCursor(CsvRowReader.open(file, TestFiles.CHUNK_DIALECT), 0)) {
            assertThat(cursor.advance()).isFalse();
            assertThat(cursor.isExhausted()).isTrue();
        }
    }
}
