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
import io.csvsorter.api.errors.MalformedRowException;
import io.csvsorter.api.errors.SortPhase;
import io.csvsorter.api.fileio.Row;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.readers.CsvRowReader;
import io.csvsorter.writers.CsvRowWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Sorts one chunk file in memory and rewrites it in place.
/// The sort is stable: rows with equal keys keep their relative order.
public class ChunkSorter {
    private static final Logger logger = LogManager.getLogger(ChunkSorter.class);

    private final SortKey sortKey;
    private final CsvDialect chunkDialect;

    /// @param sortKey the ordering to apply
    /// @param chunkDialect the format of chunk files
    public ChunkSorter(SortKey sortKey, CsvDialect chunkDialect) {
        this.sortKey = sortKey;
        this.chunkDialect = chunkDialect;
    }

    /// Replace the contents of a chunk file with its rows in ascending key order
    /// @param chunkFile the chunk to sort
    /// @throws CsvSortIOException if the chunk cannot be read or rewritten
    public void sort(Path chunkFile) {
        List<Row> rows = new ArrayList<>();
        try (CsvRowReader reader = CsvRowReader.open(chunkFile, chunkDialect)) {
            for (Row row : reader) {
                rows.add(row);
            }
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.SORT_CHUNK, chunkFile, e);
        } catch (UncheckedIOException e) {
            throw new CsvSortIOException(SortPhase.SORT_CHUNK, chunkFile, e.getCause());
        }

        try {
            rows.sort(sortKey);
        } catch (MalformedRowException e) {
            throw new MalformedRowException(chunkFile, -1, e.getArity(), e.getRequiredArity());
        }

        try (CsvRowWriter writer = CsvRowWriter.open(chunkFile, chunkDialect)) {
            writer.writeAll(rows);
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.SORT_CHUNK, chunkFile, e);
        }
        logger.debug("Sorted {} rows in {}", rows.size(), chunkFile);
    }
}
