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

import io.csvsorter.api.errors.CsvSortException;
import io.csvsorter.api.errors.CsvSortIOException;
import io.csvsorter.api.errors.SortPhase;
import io.csvsorter.api.fileio.Row;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.readers.CsvRowReader;
import io.csvsorter.writers.CsvRowWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/// Sorts a delimited file that is too large to hold in memory using an external merge sort.
///
/// The run proceeds in phases, one after another on the calling thread:
///
/// 1. Create a private [SortWorkspace].
/// 2. Open the input and, if configured, set the header row aside.
/// 3. Resolve the sort columns against the header. Resolution failures are raised here,
///    before any chunk file exists.
/// 4. Split the input into chunk files ([ChunkSplitter]), sort each chunk in memory
///    ([ChunkSorter]), then merge the chunks into one sorted file ([ChunkMerger]).
/// 5. Write the header and the merged rows to the destination with the configured dialect.
///
/// The input is fully read and closed before the destination is touched, so sorting a file
/// onto itself is safe. The destination is written to a staging file beside it and moved into
/// place at the end; a failed run leaves the destination as it was. The workspace is removed on
/// every exit path.
public class ExternalCsvSorter {
    private static final Logger logger = LogManager.getLogger(ExternalCsvSorter.class);

    private final CsvSortOptions options;

    /// @param options the settings for each run
    public ExternalCsvSorter(CsvSortOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Options cannot be null");
        }
        this.options = options;
    }

    /// Sort a file
    /// @param input the file to sort
    /// @return a summary of the run
    /// @throws CsvSortException if column resolution fails, a row is malformed or any file
    ///     operation fails
    public SortResult sort(Path input) {
        Path destination = options.getOutputPath().orElse(input);
        CsvDialect chunkDialect = CsvDialect.internal(options.getDialect().encoding());
        long startNanos = System.nanoTime();

        logger.info("Sorting {} by columns {} into {}", input, options.getColumns(), destination);
        try (SortWorkspace workspace = SortWorkspace.create(options.getTempDirectory(),
            options.isDeleteWorkspaceOnExit())) {

            Row header;
            SortKey sortKey;
            List<Path> chunkFiles;
            try (CsvRowReader reader = openInput(input)) {
                header = options.hasHeader() ? readHeader(reader) : null;
                sortKey = ColumnResolver.resolve(options.getColumns(), header);
                logger.debug("Resolved columns {} to {}", options.getColumns(), sortKey);

                ChunkSplitter splitter = new ChunkSplitter(workspace, options.getMaxChunkSizeBytes(), chunkDialect);
                chunkFiles = splitter.split(reader, sortKey);
            } catch (IOException e) {
                throw new CsvSortIOException(SortPhase.OPEN_INPUT, input, e);
            }

            ChunkSorter sorter = new ChunkSorter(sortKey, chunkDialect);
            for (Path chunkFile : chunkFiles) {
                sorter.sort(chunkFile);
            }
            logger.info("Sorted {} chunk(s)", chunkFiles.size());

            ChunkMerger merger = new ChunkMerger(workspace, sortKey, options.getMergeFanIn(), chunkDialect);
            Optional<Path> merged = merger.merge(chunkFiles);

            long rowCount = writeOutput(destination, header, merged, chunkDialect);
            logger.info("Sorted {} rows into {} in {} ms ({} chunk(s), {} merge(s))", rowCount, destination,
                (System.nanoTime() - startNanos) / 1_000_000, chunkFiles.size(), merger.getMergeCount());
            return new SortResult(destination, rowCount, chunkFiles.size(), merger.getMergeCount());
        }
    }

    private CsvRowReader openInput(Path input) {
        try {
            return CsvRowReader.open(input, options.getDialect());
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.OPEN_INPUT, input, e);
        }
    }

    private Row readHeader(CsvRowReader reader) {
        try {
            Row header = reader.readRow();
            if (header == null) {
                logger.debug("Input {} is empty; there is no header to set aside", reader.getPath());
            }
            return header;
        } catch (UncheckedIOException e) {
            throw new CsvSortIOException(SortPhase.OPEN_INPUT, reader.getPath(), e.getCause());
        }
    }

    /// Write the header and merged rows to a staging file next to the destination, then move
    /// it over the destination.
    private long writeOutput(Path destination, Row header, Optional<Path> merged, CsvDialect chunkDialect) {
        Path staging;
        try {
            staging = createStagingFile(destination);
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.WRITE_OUTPUT, destination, e);
        }

        boolean moved = false;
        try {
            long rowCount = 0;
            try (CsvRowWriter writer = CsvRowWriter.open(staging, options.getDialect())) {
                if (header != null) {
                    writer.write(header);
                }
                if (merged.isPresent()) {
                    rowCount = copyRows(merged.get(), writer, chunkDialect);
                }
            }
            moveIntoPlace(staging, destination);
            moved = true;
            return rowCount;
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.WRITE_OUTPUT, destination, e);
        } finally {
            if (!moved) {
                try {
                    Files.deleteIfExists(staging);
                } catch (IOException e) {
                    logger.warn("Could not delete staging file: " + staging, e);
                }
            }
        }
    }

    /// Create an empty file beside the destination with the permissions the destination should
    /// end up with: those of the existing destination, or the defaults for a new file.
    private Path createStagingFile(Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path staging;
        while (true) {
            staging = parent.resolve("." + destination.getFileName() + "." + Long.toUnsignedString(
                ThreadLocalRandom.current().nextLong(), 36) + ".tmp");
            try {
                Files.createFile(staging);
                break;
            } catch (FileAlreadyExistsException e) {
                logger.debug("Staging file {} already exists; picking another name", staging);
            }
        }
        if (Files.exists(destination)
            && Files.getFileStore(staging).supportsFileAttributeView(PosixFileAttributeView.class)) {
            try {
                Files.setPosixFilePermissions(staging, Files.getPosixFilePermissions(destination));
            } catch (IOException | RuntimeException e) {
                Files.deleteIfExists(staging);
                throw e;
            }
        }
        return staging;
    }

    private long copyRows(Path sortedFile, CsvRowWriter writer, CsvDialect chunkDialect) throws IOException {
        long rowCount = 0;
        try (CsvRowReader reader = CsvRowReader.open(sortedFile, chunkDialect)) {
            for (Row row : reader) {
                writer.write(row);
                rowCount++;
            }
        } catch (UncheckedIOException e) {
            throw new CsvSortIOException(SortPhase.WRITE_OUTPUT, sortedFile, e.getCause());
        }
        return rowCount;
    }

    private void moveIntoPlace(Path staging, Path destination) throws IOException {
        try {
            Files.move(staging, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}; falling back to a plain move", destination);
            Files.move(staging, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
