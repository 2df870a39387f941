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

package io.csvsorter.command.common;

import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.api.format.QuotingPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CsvDialectOption")
class CsvDialectOptionTest {

    @CommandLine.Command(name = "test")
    static class TestCommand implements Runnable {
        @CommandLine.Mixin
        CsvDialectOption dialectOption = new CsvDialectOption();

        @Override
        public void run() {
        }
    }

    private static CsvDialectOption parse(String... args) {
        TestCommand command = new TestCommand();
        new CommandLine(command).setCaseInsensitiveEnumValuesAllowed(true).parseArgs(args);
        return command.dialectOption;
    }

    @ParameterizedTest
    @ValueSource(strings = {"\\t", "tab", "TAB"})
    @DisplayName("should accept spellings of tab")
    void shouldParseTab(String value) {
        assertThat(CsvDialectOption.parseDelimiter(value)).isEqualTo('\t');
    }

    @Test
    @DisplayName("should reject empty and multi-character delimiters")
    void shouldRejectBadDelimiters() {
        assertThatThrownBy(() -> CsvDialectOption.parseDelimiter(""))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CsvDialectOption.parseDelimiter(";;"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("single character");
    }

    @Test
    @DisplayName("should leave the base dialect alone when no option is given")
    void shouldKeepBase() {
        CsvDialect base = CsvDialect.defaults().withDelimiter('|');
        assertThat(parse().applyTo(base)).isEqualTo(base);
    }

    @Test
    @DisplayName("should overlay given options")
    void shouldOverlayOptions() {
        CsvDialect dialect = parse("-d", ";", "--quoting", "non_numeric", "-e", "ISO-8859-1")
            .applyTo(CsvDialect.defaults());

        assertThat(dialect.delimiter()).isEqualTo(';');
        assertThat(dialect.quotingPolicy()).isEqualTo(QuotingPolicy.NON_NUMERIC);
        assertThat(dialect.encoding()).isEqualTo(StandardCharsets.ISO_8859_1);
    }
}
