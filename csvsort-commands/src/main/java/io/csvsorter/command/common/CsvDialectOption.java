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
import picocli.CommandLine;

import java.nio.charset.Charset;

/**
 * Shared delimiter, quoting and encoding options.
 * Each option is left null when not given, so values from a config file can show through.
 */
public class CsvDialectOption {

    /**
     * Picocli type converter for single-character delimiters.
     * Accepts {@code \t} and {@code tab} for a tab character.
     */
    public static class DelimiterConverter implements CommandLine.ITypeConverter<Character> {

        @Override
        public Character convert(String value) {
            return parseDelimiter(value);
        }
    }

    @CommandLine.Option(
        names = {"-d", "--delimiter"},
        description = "Field delimiter (default: \",\"; use \\t or 'tab' for tabs)",
        converter = DelimiterConverter.class
    )
    private Character delimiter;

    @CommandLine.Option(
        names = {"--quoting"},
        description = "Output quoting policy: ${COMPLETION-CANDIDATES} (default: MINIMAL)"
    )
    private QuotingPolicy quotingPolicy;

    @CommandLine.Option(
        names = {"-e", "--encoding"},
        description = "Encoding of the input and output files (default: utf-8)"
    )
    private Charset encoding;

    /**
     * Parse a delimiter as typed by a user.
     *
     * @param value a single character, {@code \t} or {@code tab}
     * @return the delimiter character
     * @throws IllegalArgumentException if the value is not a single character
     */
    public static char parseDelimiter(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Delimiter cannot be empty");
        }
        if (value.equals("\\t") || value.equalsIgnoreCase("tab")) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new IllegalArgumentException("Delimiter must be a single character: '" + value + "'");
        }
        return value.charAt(0);
    }

    public Character getDelimiter() {
        return delimiter;
    }

    public QuotingPolicy getQuotingPolicy() {
        return quotingPolicy;
    }

    public Charset getEncoding() {
        return encoding;
    }

    /**
     * Overlay the options that were given onto a base dialect.
     *
     * @param base the dialect to start from
     * @return the base dialect with any given options replacing its values
     */
    public CsvDialect applyTo(CsvDialect base) {
        CsvDialect dialect = base;
        if (delimiter != null) {
            dialect = dialect.withDelimiter(delimiter);
        }
        if (quotingPolicy != null) {
            dialect = dialect.withQuotingPolicy(quotingPolicy);
        }
        if (encoding != null) {
            dialect = dialect.withEncoding(encoding);
        }
        return dialect;
    }
}
