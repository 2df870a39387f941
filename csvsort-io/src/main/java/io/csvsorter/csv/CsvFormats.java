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

package io.csvsorter.csv;

import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.api.format.QuotingPolicy;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.QuoteMode;

/// Maps a [CsvDialect] onto commons-csv [CSVFormat]s.
///
/// Reading and writing use different formats. A file is always parsed with the delimiter and
/// standard double quotes only, so backslashes in the input are plain text. The quoting policy,
/// and the backslash escape that `NONE` needs, only apply when rows are printed.
public final class CsvFormats {

    private CsvFormats() {
    }

    /// Build the commons-csv format for parsing a file in a dialect
    /// @param dialect the dialect of the file; only its delimiter is used
    /// @return a format that reads that dialect
    public static CSVFormat forReading(CsvDialect dialect) {
        return CSVFormat.DEFAULT.builder()
            .setDelimiter(dialect.delimiter())
            .setQuote('"')
            .setIgnoreEmptyLines(true)
            .build();
    }

    /// Build the commons-csv format for printing rows in a dialect
    /// @param dialect the dialect to write
    /// @return a format that writes that dialect
    public static CSVFormat forWriting(CsvDialect dialect) {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
            .setDelimiter(dialect.delimiter())
            .setQuote('"')
            .setRecordSeparator(CsvDialect.RECORD_SEPARATOR)
            .setQuoteMode(quoteMode(dialect.quotingPolicy()));
        if (dialect.quotingPolicy() == QuotingPolicy.NONE) {
            builder.setEscape(CsvDialect.ESCAPE_CHARACTER);
        }
        return builder.build();
    }

    static QuoteMode quoteMode(QuotingPolicy policy) {
        switch (policy) {
            case ALL:
                return QuoteMode.ALL;
            case NON_NUMERIC:
                return QuoteMode.NON_NUMERIC;
            case NONE:
                return QuoteMode.NONE;
            case MINIMAL:
            default:
                return QuoteMode.MINIMAL;
        }
    }
}
