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
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.readers.CsvRowReader;
import io.csvsorter.writers.CsvRowWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;

/// Combines sorted files into one sorted file with a streaming k-way merge.
///
/// Files are merged in groups of at most `fanIn`, pass after pass, until one file remains.
/// Within a pass, groups are taken from the front of the list in order and each group's result
/// keeps that group's place in the next pass; a file left over at the end of a pass is carried
/// over unchanged. Every group therefore covers a contiguous stretch of the original input, and
/// breaking key ties by stream position keeps the whole result stable.
///
/// Each input is read one row at a time through a [RowCursor], and the priority queue never
/// holds more than `fanIn` cursors, so memory use is independent of file size. Inputs are
/// deleted as soon as their merge is sealed.
public class ChunkMerger {
    private static final Logger logger = LogManager.getLogger(ChunkMerger.class);

    /// Default number of files combined by one merge
    public static final int DEFAULT_FAN_IN = 2;

    private final SortWorkspace workspace;
    private final SortKey sortKey;
    private final int fanIn;
    private final CsvDialect chunkDialect;
    private int mergeCount;
    private int passCount;

    /// @param workspace where merge output files are created
    /// @param sortKey the ordering every input is already sorted by
    /// @param fanIn how many files one merge combines, at least 2
    /// @param chunkDialect the format of chunk and merge files
    public ChunkMerger(SortWorkspace workspace, SortKey sortKey, int fanIn, CsvDialect chunkDialect) {
        if (fanIn < 2) {
            throw new IllegalArgumentException("Merge fan-in must be at least 2, got " + fanIn);
        }
        this.workspace = workspace;
        this.sortKey = sortKey;
        this.fanIn = fanIn;
        this.chunkDialect = chunkDialect;
    }

    /// Merge sorted files into one
    /// @param sortedFiles the sorted inputs, in input order
    /// @return the single sorted result, or empty when there were no inputs
    /// @throws CsvSortIOException if reading, writing or deleting a file fails
    public Optional<Path> merge(List<Path> sortedFiles) {
        if (sortedFiles.isEmpty()) {
            return Optional.empty();
        }
        List<Path> current = new ArrayList<>(sortedFiles);
        while (current.size() > 1) {
            passCount++;
            logger.info("Merging {} splits (pass {})", current.size(), passCount);
            List<Path> next = new ArrayList<>();
            for (int start = 0; start < current.size(); start += fanIn) {
                List<Path> group = current.subList(start, Math.min(start + fanIn, current.size()));
                next.add(group.size() == 1 ? group.get(0) : mergeGroup(group));
            }
            current = next;
        }
        return Optional.of(current.get(0));
    }

    /// @return the number of group merges performed so far
    public int getMergeCount() {
        return mergeCount;
    }

    /// @return the number of merge passes performed so far
    public int getPassCount() {
        return passCount;
    }

    private Path mergeGroup(List<Path> group) {
        Path outputFile = workspace.newMergeFile();
        Comparator<RowCursor> headOrder = (a, b) -> {
            int cmp = sortKey.compare(a.peek(), b.peek());
            return cmp != 0 ? cmp : Integer.compare(a.ordinal(), b.ordinal());
        };
        PriorityQueue<RowCursor> heads = new PriorityQueue<>(group.size(), headOrder);
        List<RowCursor> cursors = new ArrayList<>(group.size());
        long merged = 0;
        try (CsvRowWriter output = CsvRowWriter.open(outputFile, chunkDialect)) {
            for (int i = 0; i < group.size(); i++) {
                RowCursor cursor = new RowCursor(openInput(group.get(i)), i);
                cursors.add(cursor);
                if (cursor.advance()) {
                    heads.offer(cursor);
                }
            }
            while (!heads.isEmpty()) {
                RowCursor cursor = heads.poll();
                output.write(cursor.peek());
                merged++;
                if (cursor.advance()) {
                    heads.offer(cursor);
                }
            }
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.MERGE, outputFile, e);
        } catch (MalformedRowException e) {
            throw new MalformedRowException(outputFile, -1, e.getArity(), e.getRequiredArity());
        } finally {
            for (RowCursor cursor : cursors) {
                try {
                    cursor.close();
                } catch (IOException e) {
                    logger.warn("Error closing merge input " + cursor.getPath(), e);
                }
            }
        }

        for (Path input : group) {
            try {
                Files.deleteIfExists(input);
            } catch (IOException e) {
                throw new CsvSortIOException(SortPhase.MERGE, input, e);
            }
        }
        mergeCount++;
        logger.debug("Merged {} files into {} ({} rows)", group.size(), outputFile, merged);
        return outputFile;
    }

    private CsvRowReader openInput(Path input) {
        try {
            return CsvRowReader.open(input, chunkDialect);
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.MERGE, input, e);
        }
    }
}
