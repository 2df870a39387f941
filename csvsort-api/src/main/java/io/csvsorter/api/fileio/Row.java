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

package io.csvsorter.api.fileio;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// An ordered sequence of text fields read from, or destined for, a delimited file.
///
/// Rows have no identity beyond their field values. A `null` field is stored as the
/// empty string, since delimited text has no way to tell the two apart.
public final class Row {
    private final List<String> fields;

    private Row(List<String> fields) {
        this.fields = Collections.unmodifiableList(fields);
    }

    /// Create a row from field values
    /// @param fields the field values, in column order
    /// @return a new row
    public static Row of(String... fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        return of(Arrays.asList(fields));
    }

    /// Create a row from field values
    /// @param fields the field values, in column order
    /// @return a new row
    public static Row of(List<String> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        List<String> copy = new ArrayList<>(fields.size());
        for (String field : fields) {
            copy.add(field == null ? "" : field);
        }
        return new Row(copy);
    }

    /// @return the number of fields in this row
    public int size() {
        return fields.size();
    }

    /// @param index zero-based column position
    /// @return the field value at that position
    /// @throws IndexOutOfBoundsException if the row is narrower than `index + 1`
    public String get(int index) {
        return fields.get(index);
    }

    /// @return an unmodifiable view of the field values
    public List<String> fields() {
        return fields;
    }

    /// @param name a field value to look for
    /// @return the position of the first field equal to `name`, or -1
    public int indexOf(String name) {
        return fields.indexOf(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return fields.equals(((Row) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
