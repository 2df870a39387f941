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

package io.csvsorter.api.format;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Formatting settings for reading or writing a delimited file.
 *
 * @param delimiter     the field separator character
 * @param quotingPolicy which fields get quoted on output
 * @param encoding      the text encoding of the file
 */
public record CsvDialect(char delimiter, QuotingPolicy quotingPolicy, Charset encoding) {

    /** The default field separator. */
    public static final char DEFAULT_DELIMITER = ',';

    /** The escape character written before special characters when quoting is {@code NONE}. */
    public static final char ESCAPE_CHARACTER = '\\';

    /** The record separator used for every file written. */
    public static final String RECORD_SEPARATOR = "\n";

    /**
     * Compact constructor with validation.
     */
    public CsvDialect {
        if (quotingPolicy == null) {
            throw new IllegalArgumentException("Quoting policy cannot be null");
        }
        if (encoding == null) {
            throw new IllegalArgumentException("Encoding cannot be null");
        }
        if (delimiter == '"' || delimiter == '\r' || delimiter == '\n') {
            throw new IllegalArgumentException("Invalid delimiter: '" + delimiter + "'");
        }
        if (delimiter == ESCAPE_CHARACTER && quotingPolicy == QuotingPolicy.NONE) {
            throw new IllegalArgumentException("A backslash delimiter cannot be used without quoting, "
                                               + "since backslash is the escape character");
        }
    }

    /**
     * Comma separated, minimal quoting, UTF-8.
     */
    public static CsvDialect defaults() {
        return new CsvDialect(DEFAULT_DELIMITER, QuotingPolicy.MINIMAL, StandardCharsets.UTF_8);
    }

    /**
     * The fixed format of chunk and merge files. Only the encoding follows the run's settings.
     *
     * @param encoding the encoding of the run
     */
    public static CsvDialect internal(Charset encoding) {
        return new CsvDialect(DEFAULT_DELIMITER, QuotingPolicy.MINIMAL, encoding);
    }

    public CsvDialect withDelimiter(char delimiter) {
        return new CsvDialect(delimiter, quotingPolicy, encoding);
    }

    public CsvDialect withQuotingPolicy(QuotingPolicy quotingPolicy) {
        return new CsvDialect(delimiter, quotingPolicy, encoding);
    }

    public CsvDialect withEncoding(Charset encoding) {
        return new CsvDialect(delimiter, quotingPolicy, encoding);
    }
}
