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
import io.csvsorter.api.fileio.RowSink;
import io.csvsorter.api.fileio.RowSource;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.writers.CsvRowWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// Partitions a row source into chunk files of bounded size, in input order.
///
/// The size limit is a soft cap checked after each row: a chunk is sealed as soon as its
/// estimated size exceeds the limit, so it may overshoot by one row. The next chunk file is
/// only created when another row arrives, so an empty source yields no chunks at all.
public class ChunkSplitter {
    private static final Logger logger = LogManager.getLogger(ChunkSplitter.class);

    private final SortWorkspace workspace;
    private final long maxChunkBytes;
    private final RowSizeEstimator sizeEstimator;
    private final CsvDialect chunkDialect;

    /// @param workspace where chunk files are created
    /// @param maxChunkBytes the soft size limit of one chunk
    /// @param chunkDialect the format chunk files are written in
    public ChunkSplitter(SortWorkspace workspace, long maxChunkBytes, CsvDialect chunkDialect) {
        if (maxChunkBytes < 0) {
            throw new IllegalArgumentException("Max chunk size cannot be negative: " + maxChunkBytes);
        }
        this.workspace = workspace;
        this.maxChunkBytes = maxChunkBytes;
        this.chunkDialect = chunkDialect;
        this.sizeEstimator = new RowSizeEstimator(chunkDialect.encoding());
    }

    /// Consume the source once and write its rows into chunk files.
    /// @param source the rows to partition
    /// @param sortKey used to reject rows too narrow to be sorted
    /// @return the chunk files, in input order
    /// @throws MalformedRowException if a row is narrower than the sort key requires
    /// @throws CsvSortIOException if reading the source or writing a chunk fails
    public List<Path> split(RowSource source, SortKey sortKey) {
        List<Path> chunkFiles = new ArrayList<>();
        RowSink writer = null;
        long currentSize = 0;
        long rowCount = 0;
        try {
            for (Row row : source) {
                if (row.size() < sortKey.requiredArity()) {
                    throw new MalformedRowException(source.getPath(), source.getRowNumber(), row.size(),
                        sortKey.requiredArity());
                }
                if (writer == null) {
                    Path chunkFile = workspace.newSplitFile();
                    writer = openChunk(chunkFile);
                    chunkFiles.add(chunkFile);
                }
                write(writer, row);
                rowCount++;
                currentSize += sizeEstimator.estimate(row);
                if (currentSize > maxChunkBytes) {
                    seal(writer, currentSize);
                    writer = null;
                    currentSize = 0;
                }
            }
            if (writer != null) {
                seal(writer, currentSize);
                writer = null;
            }
        } catch (UncheckedIOException e) {
            throw new CsvSortIOException(SortPhase.SPLIT, source.getPath(), e.getCause());
        } finally {
            if (writer != null) {
                closeQuietly(writer);
            }
        }
        logger.info("Split {} rows into {} chunk(s)", rowCount, chunkFiles.size());
        return chunkFiles;
    }

    private RowSink openChunk(Path chunkFile) {
        try {
            return CsvRowWriter.open(chunkFile, chunkDialect);
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.SPLIT, chunkFile, e);
        }
    }

    private void write(RowSink writer, Row row) {
        try {
            writer.write(row);
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.SPLIT, writer.getPath(), e);
        }
    }

    private void seal(RowSink writer, long estimatedSize) {
        try {
            writer.close();
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.SPLIT, writer.getPath(), e);
        }
        logger.debug("Sealed chunk {} with {} rows (~{} bytes)", writer.getPath(), writer.getRowCount(), estimatedSize);
    }

    private void closeQuietly(RowSink writer) {
        try {
            writer.close();
        } catch (IOException e) {
            logger.warn("Error closing chunk " + writer.getPath(), e);
        }
    }
}
