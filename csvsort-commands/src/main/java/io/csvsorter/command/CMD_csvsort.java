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

package io.csvsorter.command;

import io.csvsorter.api.errors.CsvSortException;
import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.command.common.CsvDialectOption;
import io.csvsorter.command.common.InputFileOption;
import io.csvsorter.command.common.OutputFileOption;
import io.csvsorter.command.common.VerbosityOption;
import io.csvsorter.command.config.SortConfigFile;
import io.csvsorter.sort.ColumnSpec;
import io.csvsorter.sort.CsvSortOptions;
import io.csvsorter.sort.ExternalCsvSorter;
import io.csvsorter.sort.SortResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/// Command to sort a delimited file on disk rather than in memory
///
/// The file is split into chunks of bounded size, each chunk is sorted in memory, and the
/// sorted chunks are merged back into one file. Peak memory is governed by `--size`.
/// Rows with equal keys keep their original order.
///
/// ```
/// csvsort -c 2 -c name --size 50 data.csv -o sorted.csv
/// ```
@CommandLine.Command(name = "csvsort",
    mixinStandardHelpOptions = true,
    header = "Sort large delimited files on disk rather than in memory",
    description = "Sort a delimited file by one or more columns using an external merge sort")
public class CMD_csvsort implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_csvsort.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FILE_MISSING = 1;
    static final int EXIT_ERROR = 2;

    /// Picocli type converter for column specifiers
    public static class ColumnSpecConverter implements CommandLine.ITypeConverter<ColumnSpec> {
        @Override
        public ColumnSpec convert(String value) {
            return ColumnSpec.parse(value);
        }
    }

    @CommandLine.Mixin
    private InputFileOption inputFileOption = new InputFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Option(names = {"-c", "--column"},
        description = "Column to sort on, as a zero-based index or a header name. Repeat for secondary keys.",
        converter = ColumnSpecConverter.class)
    private List<ColumnSpec> columns = new ArrayList<>();

    @CommandLine.Option(names = {"-s", "--size"},
        description = "Maximum size of each split file in MB (default: 100)")
    private Double maxChunkSizeMB;

    @CommandLine.Option(names = {"-n", "--no-header"},
        description = "The file has no header row")
    private Boolean noHeader;

    @CommandLine.Option(names = {"--fan-in"},
        description = "Number of sorted files combined by each merge (default: 2)")
    private Integer fanIn;

    @CommandLine.Option(names = {"-t", "--temp-dir"},
        description = "Directory for temporary split files (default: system temp)")
    private Path tempDir;

    @CommandLine.Option(names = {"--config"},
        description = "YAML file with sort settings; command line options take precedence")
    private Path configFile;

    @CommandLine.Mixin
    private CsvDialectOption dialectOption = new CsvDialectOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    /// Run CMD_csvsort
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_csvsort()).setCaseInsensitiveEnumValuesAllowed(true).execute(args));
    }

    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_ERROR;
        }
        verbosityOption.applyLogLevel();

        try {
            inputFileOption.validate();
        } catch (IllegalStateException e) {
            logger.error("Error: " + e.getMessage());
            return EXIT_FILE_MISSING;
        }
        Path input = inputFileOption.getInputPath();

        CsvSortOptions options;
        try {
            options = buildOptions();
        } catch (IllegalArgumentException | UncheckedIOException e) {
            logger.error("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Error reading options: " + e.getMessage(), e);
            return EXIT_ERROR;
        }

        try {
            SortResult result = new ExternalCsvSorter(options).sort(input);
            logger.info("Wrote {} sorted rows to {}", result.rowCount(), result.output());
            return EXIT_SUCCESS;
        } catch (CsvSortException e) {
            logger.error("Error sorting " + input + ": " + e.getMessage(), e);
            return EXIT_ERROR;
        } catch (RuntimeException e) {
            logger.error("Unexpected error sorting " + input, e);
            return EXIT_ERROR;
        }
    }

    /// Combine config file values, if any, with the command line options
    CsvSortOptions buildOptions() {
        CsvSortOptions.Builder builder = CsvSortOptions.builder();
        CsvDialect dialect = CsvDialect.defaults();
        if (configFile != null) {
            SortConfigFile config = SortConfigFile.file(configFile);
            config.applyTo(builder);
            dialect = config.applyTo(dialect);
        }
        builder.dialect(dialectOption.applyTo(dialect));

        if (!columns.isEmpty()) {
            builder.columns(columns);
        }
        if (outputFileOption.isSpecified()) {
            builder.outputPath(outputFileOption.getNormalizedOutputPath());
        }
        if (maxChunkSizeMB != null) {
            builder.maxChunkSizeMB(maxChunkSizeMB);
        }
        if (noHeader != null && noHeader) {
            builder.hasHeader(false);
        }
        if (fanIn != null) {
            builder.mergeFanIn(fanIn);
        }
        if (tempDir != null) {
            builder.tempDirectory(tempDir.normalize());
        }
        builder.deleteWorkspaceOnExit(true);
        return builder.build();
    }
}
