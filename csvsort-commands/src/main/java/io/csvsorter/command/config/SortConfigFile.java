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

package io.csvsorter.command.config;

import io.csvsorter.api.format.CsvDialect;
import io.csvsorter.api.format.QuotingPolicy;
import io.csvsorter.command.common.CsvDialectOption;
import io.csvsorter.sort.ColumnSpec;
import io.csvsorter.sort.CsvSortOptions;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Sort settings read from a YAML file.
///
/// ```yaml
/// columns: [2, name]     # integers are positions, strings are header names
/// output: sorted.csv
/// maxChunkSizeMB: 50
/// hasHeader: true
/// delimiter: ";"
/// quoting: minimal
/// encoding: utf-8
/// fanIn: 4
/// tempDir: /var/tmp
/// ```
///
/// Every key is optional. Keys that are absent leave the corresponding setting untouched.
public class SortConfigFile {
    private static final Set<String> KEYS = Set.of(
        "columns", "output", "maxChunkSizeMB", "hasHeader", "delimiter", "quoting", "encoding", "fanIn", "tempDir");

    private final Map<String, Object> values;

    private SortConfigFile(Map<String, Object> values) {
        this.values = values;
    }

    /// Read a config file
    /// @param configPath the YAML file
    /// @return the parsed config
    /// @throws IllegalArgumentException if the file has unknown keys or values of the wrong type
    /// @throws UncheckedIOException if the file cannot be read
    @SuppressWarnings("unchecked")
    public static SortConfigFile file(Path configPath) {
        LoadSettings loadSettings = LoadSettings.builder().build();
        Load yaml = new Load(loadSettings);
        try (BufferedReader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            Object loaded = yaml.loadFromReader(reader);
            if (loaded == null) {
                return new SortConfigFile(Map.of());
            }
            if (!(loaded instanceof Map)) {
                throw new IllegalArgumentException("Config file " + configPath + " must contain a mapping");
            }
            for (Object key : ((Map<?, ?>) loaded).keySet()) {
                if (!(key instanceof String) || !KEYS.contains(key)) {
                    throw new IllegalArgumentException("Unknown key '" + key + "' in config file " + configPath
                                                       + "; expected one of " + KEYS);
                }
            }
            return new SortConfigFile((Map<String, Object>) loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("while reading config file " + configPath, e);
        }
    }

    /// @return the sort columns, empty when not configured
    public List<ColumnSpec> columns() {
        Object raw = values.get("columns");
        if (raw == null) {
            return List.of();
        }
        List<?> items = raw instanceof List ? (List<?>) raw : List.of(raw);
        List<ColumnSpec> columns = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item instanceof Integer) {
                columns.add(ColumnSpec.index((Integer) item));
            } else if (item instanceof String) {
                columns.add(ColumnSpec.name((String) item));
            } else {
                throw new IllegalArgumentException("Column must be an integer or a string: " + item);
            }
        }
        return columns;
    }

    /// Overlay the configured delimiter, quoting and encoding onto a base dialect
    /// @param base the dialect to start from
    /// @return the resulting dialect
    public CsvDialect applyTo(CsvDialect base) {
        CsvDialect dialect = base;
        if (values.containsKey("delimiter")) {
            dialect = dialect.withDelimiter(CsvDialectOption.parseDelimiter(string("delimiter")));
        }
        if (values.containsKey("quoting")) {
            dialect = dialect.withQuotingPolicy(QuotingPolicy.valueOf(string("quoting").toUpperCase(Locale.ROOT)));
        }
        if (values.containsKey("encoding")) {
            dialect = dialect.withEncoding(Charset.forName(string("encoding")));
        }
        return dialect;
    }

    /// Overlay every configured setting except the dialect onto an options builder
    /// @param builder the builder to update
    /// @return the same builder
    public CsvSortOptions.Builder applyTo(CsvSortOptions.Builder builder) {
        List<ColumnSpec> columns = columns();
        if (!columns.isEmpty()) {
            builder.columns(columns);
        }
        if (values.containsKey("output")) {
            builder.outputPath(Path.of(string("output")));
        }
        if (values.containsKey("maxChunkSizeMB")) {
            builder.maxChunkSizeMB(number("maxChunkSizeMB").doubleValue());
        }
        if (values.containsKey("hasHeader")) {
            Object hasHeader = values.get("hasHeader");
            if (!(hasHeader instanceof Boolean)) {
                throw new IllegalArgumentException("hasHeader must be true or false: " + hasHeader);
            }
            builder.hasHeader((Boolean) hasHeader);
        }
        if (values.containsKey("fanIn")) {
            builder.mergeFanIn(number("fanIn").intValue());
        }
        if (values.containsKey("tempDir")) {
            builder.tempDirectory(Path.of(string("tempDir")));
        }
        return builder;
    }

    private String string(String key) {
        Object value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException(key + " cannot be empty");
        }
        return value.toString();
    }

    private Number number(String key) {
        Object value = values.get(key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(key + " must be a number: " + value);
        }
        return (Number) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(values, ((SortConfigFile) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "SortConfigFile" + values;
    }
}
