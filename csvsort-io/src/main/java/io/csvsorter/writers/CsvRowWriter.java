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

package io.csvsorter.writers;

import io.csvsorter.api.fileio.Row;
import io.csvsorter.api.fileio.RowSink;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.csv.CsvFormats;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// RowSink implementation writing delimited text through a commons-csv [CSVPrinter].
/// Opening a writer creates the file, or truncates it if it already exists.
public class CsvRowWriter implements RowSink {
    private final Path path;
    private final CSVPrinter printer;
    private long rowCount;

    private CsvRowWriter(Path path, CSVPrinter printer) {
        this.path = path;
        this.printer = printer;
    }

    /// Open a file for writing
    /// @param path the file to write
    /// @param dialect the delimiter, quoting policy and encoding to write with
    /// @return an open writer
    /// @throws IOException if the file cannot be created
    public static CsvRowWriter open(Path path, CsvDialect dialect) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(dialect, "dialect cannot be null");
        Writer writer = Files.newBufferedWriter(path, dialect.encoding());
        try {
            return new CsvRowWriter(path, CsvFormats.forWriting(dialect).print(writer));
        } catch (IOException | RuntimeException e) {
            writer.close();
            throw e;
        }
    }

    @Override
    public void write(Row row) throws IOException {
        if (row == null) {
            throw new IllegalArgumentException("Row cannot be null");
        }
        printer.printRecord(row.fields());
        rowCount++;
    }

    @Override
    public long getRowCount() {
        return rowCount;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        printer.close(true);
    }

    @Override
    public String toString() {
        return "CsvRowWriter{" + path + ", rows=" + rowCount + "}";
    }
}
