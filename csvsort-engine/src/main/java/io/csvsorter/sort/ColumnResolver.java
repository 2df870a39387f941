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

import io.csvsorter.api.errors.ColumnNotFoundException;
import io.csvsorter.api.errors.ColumnOutOfRangeException;
import io.csvsorter.api.errors.MissingHeaderException;
import io.csvsorter.api.fileio.Row;

import java.util.List;

/// Turns column specifiers into a validated [SortKey].
///
/// - A position is trusted as-is when there is no header, and must be narrower than the header otherwise.
/// - A name needs a header and resolves to its first position in it.
///
/// The order of the specifiers is the order of sort precedence.
public final class ColumnResolver {

    private ColumnResolver() {
    }

    /// @param specs the column specifiers, primary key first
    /// @param header the header row, or null when the file has none
    /// @return the resolved sort key
    /// @throws ColumnOutOfRangeException if a position is not within the header
    /// @throws ColumnNotFoundException if a name is not in the header
    /// @throws MissingHeaderException if a name is given and there is no header
    public static SortKey resolve(List<ColumnSpec> specs, Row header) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("At least one sort column is required");
        }
        int[] columns = new int[specs.size()];
        for (int i = 0; i < specs.size(); i++) {
            columns[i] = resolve(specs.get(i), header);
        }
        return new SortKey(columns);
    }

    private static int resolve(ColumnSpec spec, Row header) {
        if (spec.isIndex()) {
            int index = spec.getIndex();
            if (header != null && index >= header.size()) {
                throw new ColumnOutOfRangeException(index, header.size());
            }
            return index;
        }
        String name = spec.getName();
        if (header == null) {
            throw new MissingHeaderException(name);
        }
        int index = header.indexOf(name);
        if (index < 0) {
            throw new ColumnNotFoundException(name, header.fields());
        }
        return index;
    }
}
