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
import io.csvsorter.api.fileio.RowSource;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.csv.CsvFormats;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/// A forward-only reader of delimited rows, backed by a commons-csv [CSVParser].
///
/// Rows are parsed lazily, one record at a time, so a reader over a file of any size
/// holds only the current record in memory. Blank lines are skipped.
public class CsvRowReader implements RowSource {
    private final Path path;
    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private long rowNumber;
    private boolean iterated;

    private CsvRowReader(Path path, CSVParser parser) {
        this.path = path;
        this.parser = parser;
        this.records = parser.iterator();
    }

    /// Open a file for reading
    /// @param path the file to read
    /// @param dialect the delimiter and encoding of the file; the quoting policy only affects writing
    /// @return an open reader positioned before the first row
    /// @throws IOException if the file cannot be opened
    public static CsvRowReader open(Path path, CsvDialect dialect) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(dialect, "dialect cannot be null");
        Reader reader = Files.newBufferedReader(path, dialect.encoding());
        try {
            return new CsvRowReader(path, CsvFormats.forReading(dialect).parse(reader));
        } catch (IOException | RuntimeException e) {
            reader.close();
            throw e;
        }
    }

    /// Read the next row directly, ahead of iteration. Used to take a header off the top of a file.
    /// @return the next row, or null when the file has no more rows
    public Row readRow() {
        if (!records.hasNext()) {
            return null;
        }
        return toRow(records.next());
    }

    @Override
    public Iterator<Row> iterator() {
        if (iterated) {
            throw new IllegalStateException("Rows of " + path + " can only be iterated once; reopen the file to read again");
        }
        iterated = true;
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return records.hasNext();
            }

            @Override
            public Row next() {
                if (!records.hasNext()) {
                    throw new NoSuchElementException("No more rows in " + path);
                }
                return toRow(records.next());
            }
        };
    }

    private Row toRow(CSVRecord record) {
        rowNumber = record.getRecordNumber();
        List<String> fields = new ArrayList<>(record.size());
        for (int i = 0; i < record.size(); i++) {
            fields.add(record.get(i));
        }
        return Row.of(fields);
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public long getRowNumber() {
        return rowNumber;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    @Override
    public String toString() {
        return "CsvRowReader{" + path + ", row=" + rowNumber + "}";
    }
}
