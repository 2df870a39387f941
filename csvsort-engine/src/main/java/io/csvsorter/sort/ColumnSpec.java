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

import java.util.Objects;

/// A user-supplied column specifier: either a zero-based position or a header name.
public final class ColumnSpec {
    private final Integer index;
    private final String name;

    private ColumnSpec(Integer index, String name) {
        this.index = index;
        this.name = name;
    }

    /// @param index zero-based column position
    /// @return a positional specifier
    public static ColumnSpec index(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index cannot be negative: " + index);
        }
        return new ColumnSpec(index, null);
    }

    /// @param name a header name
    /// @return a named specifier
    public static ColumnSpec name(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Column name cannot be null");
        }
        return new ColumnSpec(null, name);
    }

    /// Parse a specifier as typed on a command line. A value made only of digits is a
    /// position, anything else is a header name.
    /// @param value the specifier text
    /// @return the parsed specifier
    public static ColumnSpec parse(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Column specifier cannot be empty");
        }
        if (value.chars().allMatch(c -> c >= '0' && c <= '9')) {
            try {
                return index(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Column index is too large: " + value, e);
            }
        }
        return name(value);
    }

    public boolean isIndex() {
        return index != null;
    }

    /// @return the column position
    /// @throws IllegalStateException for a named specifier
    public int getIndex() {
        if (index == null) {
            throw new IllegalStateException("Column specifier '" + name + "' is a name, not an index");
        }
        return index;
    }

    /// @return the header name
    /// @throws IllegalStateException for a positional specifier
    public String getName() {
        if (name == null) {
            throw new IllegalStateException("Column specifier " + index + " is an index, not a name");
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ColumnSpec that = (ColumnSpec) o;
        return Objects.equals(index, that.index) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, name);
    }

    @Override
    public String toString() {
        return isIndex() ? String.valueOf(index) : '"' + name + '"';
    }
}
