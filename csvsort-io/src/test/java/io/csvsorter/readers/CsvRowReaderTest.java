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

package io.csvsorter.readers;

import io.csvsorter.api.fileio.Row;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.api.format.QuotingPolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvRowReaderTest {

    @TempDir
    Path tempDir;

    private Path file(String content) throws IOException {
        Path file = tempDir.resolve("input.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static List<Row> drain(CsvRowReader reader) {
        List<Row> rows = new ArrayList<>();
        reader.forEach(rows::add);
        return rows;
    }

    @Test
    void readsRowsInOrder() throws IOException {
        try (CsvRowReader reader = CsvRowReader.open(file("a,1\nb,2\n"), CsvDialect.defaults())) {
            assertThat(drain(reader)).containsExactly(Row.of("a", "1"), Row.of("b", "2"));
            assertThat(reader.getRowNumber()).isEqualTo(2);
        }
    }

    @Test
    void readRowTakesTheHeaderBeforeIteration() throws IOException {
        try (CsvRowReader reader = CsvRowReader.open(file("id,name\n1,x\n"), CsvDialect.defaults())) {
            assertThat(reader.readRow()).isEqualTo(Row.of("id", "name"));
            assertThat(reader.getRowNumber()).isEqualTo(1);
            assertThat(drain(reader)).containsExactly(Row.of("1", "x"));
            assertThat(reader.readRow()).isNull();
        }
    }

    @Test
    void readRowOnEmptyFileIsNull() throws IOException {
        try (CsvRowReader reader = CsvRowReader.open(file(""), CsvDialect.defaults())) {
            assertThat(reader.readRow()).isNull();
            assertThat(drain(reader)).isEmpty();
        }
    }

    @Test
    void iteratesOnlyOnce() throws IOException {
        try (CsvRowReader reader = CsvRowReader.open(file("a\n"), CsvDialect.defaults())) {
            Iterator<Row> first = reader.iterator();
            assertThat(first.next()).isEqualTo(Row.of("a"));
            assertThat(first.hasNext()).isFalse();
            assertThatThrownBy(reader::iterator).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void skipsBlankLinesAndKeepsQuotedLineBreaks() throws IOException {
        String content = "a,\"line one\nline two\"\n\nb,\"say \"\"hi\"\"\"\n";
        try (CsvRowReader reader = CsvRowReader.open(file(content), CsvDialect.defaults())) {
            assertThat(drain(reader)).containsExactly(
                Row.of("a", "line one\nline two"),
                Row.of("b", "say \"hi\""));
        }
    }

    @Test
    void honoursDelimiterAndEncoding() throws IOException {
        Path file = tempDir.resolve("tabs.tsv");
        Files.writeString(file, "naïve\tcafé\n", StandardCharsets.ISO_8859_1);
        CsvDialect dialect = CsvDialect.defaults().withDelimiter('\t').withEncoding(StandardCharsets.ISO_8859_1);

        try (CsvRowReader reader = CsvRowReader.open(file, dialect)) {
            assertThat(drain(reader)).containsExactly(Row.of("naïve", "café"));
        }
    }

    @Test
    void backslashesAreTextWhateverTheQuotingPolicy() throws IOException {
        CsvDialect dialect = CsvDialect.defaults().withQuotingPolicy(QuotingPolicy.NONE);
        try (CsvRowReader reader = CsvRowReader.open(file("b,C:\\temp\\new\na,x\\y\n"), dialect)) {
            assertThat(drain(reader)).containsExactly(Row.of("b", "C:\\temp\\new"), Row.of("a", "x\\y"));
        }
    }

    @Test
    void keepsRowsOfDifferentWidths() throws IOException {
        try (CsvRowReader reader = CsvRowReader.open(file("a,b,c\nd\n"), CsvDialect.defaults())) {
            assertThat(drain(reader)).containsExactly(Row.of("a", "b", "c"), Row.of("d"));
        }
    }

    @Test
    void missingFileFailsToOpen() {
        assertThatThrownBy(() -> CsvRowReader.open(tempDir.resolve("missing.csv"), CsvDialect.defaults()))
            .isInstanceOf(NoSuchFileException.class);
    }
}
