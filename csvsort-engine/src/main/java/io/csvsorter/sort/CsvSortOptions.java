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

import io.csvsorter.api.format.CsvDialect;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/// Immutable settings for one sort run. Build with [#builder()].
///
/// | option                  | default                      |
/// |-------------------------|------------------------------|
/// | columns                 | required, at least one       |
/// | outputPath              | overwrite the input          |
/// | maxChunkSizeMB          | 100                          |
/// | hasHeader               | true                         |
/// | dialect                 | comma, minimal quoting, UTF-8 |
/// | mergeFanIn              | 2                            |
/// | tempDirectory           | `java.io.tmpdir`             |
/// | deleteWorkspaceOnExit   | false                        |
public final class CsvSortOptions {
    public static final double DEFAULT_MAX_CHUNK_SIZE_MB = 100;
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final List<ColumnSpec> columns;
    private final Path outputPath;
    private final long maxChunkSizeBytes;
    private final boolean hasHeader;
    private final CsvDialect dialect;
    private final int mergeFanIn;
    private final Path tempDirectory;
    private final boolean deleteWorkspaceOnExit;

    private CsvSortOptions(Builder builder) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.outputPath = builder.outputPath;
        this.maxChunkSizeBytes = builder.maxChunkSizeBytes;
        this.hasHeader = builder.hasHeader;
        this.dialect = builder.dialect;
        this.mergeFanIn = builder.mergeFanIn;
        this.tempDirectory = builder.tempDirectory;
        this.deleteWorkspaceOnExit = builder.deleteWorkspaceOnExit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    /// @return the destination, or empty to overwrite the input
    public Optional<Path> getOutputPath() {
        return Optional.ofNullable(outputPath);
    }

    public long getMaxChunkSizeBytes() {
        return maxChunkSizeBytes;
    }

    public boolean hasHeader() {
        return hasHeader;
    }

    public CsvDialect getDialect() {
        return dialect;
    }

    public int getMergeFanIn() {
        return mergeFanIn;
    }

    public Path getTempDirectory() {
        return tempDirectory;
    }

    public boolean isDeleteWorkspaceOnExit() {
        return deleteWorkspaceOnExit;
    }

    @Override
    public String toString() {
        return "CsvSortOptions{" +
               "columns=" + columns +
               ", outputPath=" + outputPath +
               ", maxChunkSizeBytes=" + maxChunkSizeBytes +
               ", hasHeader=" + hasHeader +
               ", dialect=" + dialect +
               ", mergeFanIn=" + mergeFanIn +
               ", tempDirectory=" + tempDirectory +
               '}';
    }

    /// Builder for [CsvSortOptions]; values are validated by [#build()].
    public static final class Builder {
        private final List<ColumnSpec> columns = new ArrayList<>();
        private Path outputPath;
        private long maxChunkSizeBytes = toBytes(DEFAULT_MAX_CHUNK_SIZE_MB);
        private boolean hasHeader = true;
        private CsvDialect dialect = CsvDialect.defaults();
        private int mergeFanIn = ChunkMerger.DEFAULT_FAN_IN;
        private Path tempDirectory = Paths.get(System.getProperty("java.io.tmpdir"));
        private boolean deleteWorkspaceOnExit;

        private Builder() {
        }

        /// Append a sort column; the first one added is the primary key
        public Builder column(ColumnSpec column) {
            if (column == null) {
                throw new IllegalArgumentException("Column cannot be null");
            }
            columns.add(column);
            return this;
        }

        public Builder column(int index) {
            return column(ColumnSpec.index(index));
        }

        public Builder column(String name) {
            return column(ColumnSpec.name(name));
        }

        /// Replace the sort columns
        public Builder columns(List<ColumnSpec> columns) {
            this.columns.clear();
            columns.forEach(this::column);
            return this;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        /// @param megabytes soft limit on the size of one chunk, in MiB; fractions allowed
        public Builder maxChunkSizeMB(double megabytes) {
            if (Double.isNaN(megabytes) || megabytes < 0) {
                throw new IllegalArgumentException("Max chunk size cannot be negative: " + megabytes);
            }
            this.maxChunkSizeBytes = toBytes(megabytes);
            return this;
        }

        public Builder maxChunkSizeBytes(long bytes) {
            this.maxChunkSizeBytes = bytes;
            return this;
        }

        public Builder hasHeader(boolean hasHeader) {
            this.hasHeader = hasHeader;
            return this;
        }

        public Builder dialect(CsvDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder mergeFanIn(int mergeFanIn) {
            this.mergeFanIn = mergeFanIn;
            return this;
        }

        public Builder tempDirectory(Path tempDirectory) {
            this.tempDirectory = tempDirectory;
            return this;
        }

        public Builder deleteWorkspaceOnExit(boolean deleteWorkspaceOnExit) {
            this.deleteWorkspaceOnExit = deleteWorkspaceOnExit;
            return this;
        }

        public CsvSortOptions build() {
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("At least one sort column is required");
            }
            if (maxChunkSizeBytes < 0) {
                throw new IllegalArgumentException("Max chunk size cannot be negative: " + maxChunkSizeBytes);
            }
            if (dialect == null) {
                throw new IllegalArgumentException("Dialect cannot be null");
            }
            if (mergeFanIn < 2) {
                throw new IllegalArgumentException("Merge fan-in must be at least 2, got " + mergeFanIn);
            }
            if (tempDirectory == null) {
                throw new IllegalArgumentException("Temp directory cannot be null");
            }
            return new CsvSortOptions(this);
        }

        private static long toBytes(double megabytes) {
            return (long) (megabytes * BYTES_PER_MB);
        }
    }
}
