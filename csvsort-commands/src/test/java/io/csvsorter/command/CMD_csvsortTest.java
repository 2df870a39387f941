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

import io.csvsorter.api.format.QuotingPolicy;
import io.csvsorter.sort.ColumnSpec;
import io.csvsorter.sort.CsvSortOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CMD_csvsort")
class CMD_csvsortTest {

    @TempDir
    Path tempDir;

    private Path work() {
        return tempDir.resolve("work");
    }

    private Path csv(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static int execute(String... args) {
        return new CommandLine(new CMD_csvsort()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
    }

    private static CMD_csvsort parse(String... args) {
        CMD_csvsort command = new CMD_csvsort();
        new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return command;
    }

    @Nested
    @DisplayName("Running")
    class Running {

        @Test
        @DisplayName("sorts by a header name into an output file")
        void sortsByName() throws IOException {
            Path input = csv("people.csv", "name,age\ncarol,41\nalice,30\nbob,25\n");
            Path output = tempDir.resolve("sorted.csv");

            int exitCode = execute("-c", "name", "-o", output.toString(), "-t", work().toString(), input.toString());

            assertThat(exitCode).isEqualTo(CMD_csvsort.EXIT_SUCCESS);
            assertThat(Files.readAllLines(output)).containsExactly("name,age", "alice,30", "bob,25", "carol,41");
            assertThat(Files.readString(input)).isEqualTo("name,age\ncarol,41\nalice,30\nbob,25\n");
        }

        @Test
        @DisplayName("overwrites the input when no output is given")
        void sortsInPlace() throws IOException {
            Path input = csv("data.csv", "b,2\na,1\n");

            int exitCode = execute("-c", "0", "-n", "-t", work().toString(), input.toString());

            assertThat(exitCode).isEqualTo(CMD_csvsort.EXIT_SUCCESS);
            assertThat(Files.readString(input)).isEqualTo("a,1\nb,2\n");
        }

        @Test
        @DisplayName("applies delimiter and quoting options")
        void dialectOptions() throws IOException {
            Path input = csv("data.tsv", "k\tv\nz\t1\ny\t2\n");
            Path output = tempDir.resolve("data-sorted.tsv");

            int exitCode = execute("-c", "k", "-d", "tab", "--quoting", "all", "-o", output.toString(),
                "-t", work().toString(), input.toString());

            assertThat(exitCode).isEqualTo(CMD_csvsort.EXIT_SUCCESS);
            assertThat(Files.readString(output)).isEqualTo("\"k\"\t\"v\"\n\"y\"\t\"2\"\n\"z\"\t\"1\"\n");
        }

        @Test
        @DisplayName("leaves no temporary files behind")
        void cleansUp() throws IOException {
            StringBuilder content = new StringBuilder("k\n");
            for (int i = 100; i > 0; i--) {
                content.append(i).append('\n');
            }
            Path input = csv("many.csv", content.toString());

            int exitCode = execute("-c", "k", "-s", "0.0001", "--fan-in", "3", "-t", work().toString(),
                "-q", input.toString());

            assertThat(exitCode).isEqualTo(CMD_csvsort.EXIT_SUCCESS);
            try (Stream<Path> entries = Files.list(work())) {
                assertThat(entries).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Exit codes")
    class ExitCodes {

        @Test
        @DisplayName("missing input file exits with 1")
        void missingInput() {
            int exitCode = execute("-c", "0", tempDir.resolve("missing.csv").toString());
            assertThat(exitCode).isEqualTo(CMD_csvsort.EXIT_FILE_MISSING);
        }

        @Test
        @DisplayName("unknown column exits with 2 and keeps the input")
        void unknownColumn() throws IOException {
            Path input = csv("data.csv", "id,name\n2,b\n1,a\n");

            int exitCode = execute("-c", "city", "-t", work().toString(), input.toString());

            assertThat(exitCode).isEqualTo(CMD_csvsort.EXIT_ERROR);
            assertThat(Files.readString(input)).isEqualTo("id,name\n2,b\n1,a\n");
        }

        @Test
        @DisplayName("no column at all exits with 2")
        void noColumn() throws IOException {
            Path input = csv("data.csv", "id\n1\n");
            assertThat(execute("-t", work().toString(), input.toString())).isEqualTo(CMD_csvsort.EXIT_ERROR);
        }

        @Test
        @DisplayName("verbose and quiet together exit with 2")
        void verboseAndQuiet() throws IOException {
            Path input = csv("data.csv", "id\n1\n");
            assertThat(execute("-c", "0", "-v", "-q", input.toString())).isEqualTo(CMD_csvsort.EXIT_ERROR);
        }

        @Test
        @DisplayName("a config file with non-text keys exits with 2")
        void configWithNumericKeys() throws IOException {
            Path input = csv("data.csv", "id\n1\n");
            Path config = csv("bad.yaml", "1: x\n");
            assertThat(execute("-c", "0", "--config", config.toString(), "-t", work().toString(), input.toString()))
                .isEqualTo(CMD_csvsort.EXIT_ERROR);
        }

        @Test
        @DisplayName("a config file that is not valid YAML exits with 2")
        void configNotYaml() throws IOException {
            Path input = csv("data.csv", "id\n1\n");
            Path config = csv("broken.yaml", "columns: [1, 2\n");
            assertThat(execute("-c", "0", "--config", config.toString(), "-t", work().toString(), input.toString()))
                .isEqualTo(CMD_csvsort.EXIT_ERROR);
        }

        @Test
        @DisplayName("a backslash delimiter without quoting exits with 2")
        void backslashDelimiterWithoutQuoting() throws IOException {
            Path input = csv("data.csv", "id\n1\n");
            assertThat(execute("-c", "0", "-d", "\\", "--quoting", "none", "-t", work().toString(),
                input.toString())).isEqualTo(CMD_csvsort.EXIT_ERROR);
            assertThat(Files.readString(input)).isEqualTo("id\n1\n");
        }

        @Test
        @DisplayName("a short row exits with 2")
        void malformedRow() throws IOException {
            Path input = csv("data.csv", "a,b\nc\n");
            assertThat(execute("-c", "1", "-n", "-t", work().toString(), input.toString()))
                .isEqualTo(CMD_csvsort.EXIT_ERROR);
        }
    }

    @Nested
    @DisplayName("Options")
    class Options {

        @Test
        @DisplayName("command line values override the config file")
        void configFileOverridden() throws IOException {
            Path config = csv("sort.yaml", String.join("\n",
                "columns: [1, name]",
                "maxChunkSizeMB: 2",
                "hasHeader: true",
                "delimiter: ';'",
                "quoting: all",
                "fanIn: 5",
                ""));

            CsvSortOptions options = parse("--config", config.toString(), "-c", "0", "--fan-in", "3",
                "--quoting", "minimal", "input.csv").buildOptions();

            assertThat(options.getColumns()).containsExactly(ColumnSpec.index(0));
            assertThat(options.getMergeFanIn()).isEqualTo(3);
            assertThat(options.getMaxChunkSizeBytes()).isEqualTo(2L * 1024 * 1024);
            assertThat(options.getDialect().delimiter()).isEqualTo(';');
            assertThat(options.getDialect().quotingPolicy()).isEqualTo(QuotingPolicy.MINIMAL);
            assertThat(options.isDeleteWorkspaceOnExit()).isTrue();
        }

        @Test
        @DisplayName("config file supplies values the command line omits")
        void configFileUsed() throws IOException {
            Path config = csv("sort.yaml", "columns: [2, name]\nhasHeader: false\n");

            CsvSortOptions options = parse("--config", config.toString(), "input.csv").buildOptions();

            assertThat(options.getColumns()).containsExactly(ColumnSpec.index(2), ColumnSpec.name("name"));
            assertThat(options.hasHeader()).isFalse();
        }

        @Test
        @DisplayName("column arguments parse as index or name in the order given")
        void columnOrder() {
            CsvSortOptions options = parse("-c", "name", "-c", "3", "--column", "007", "input.csv").buildOptions();

            assertThat(options.getColumns())
                .containsExactly(ColumnSpec.name("name"), ColumnSpec.index(3), ColumnSpec.index(7));
            assertThat(options.hasHeader()).isTrue();
            assertThat(options.getOutputPath()).isEmpty();
        }
    }
}
