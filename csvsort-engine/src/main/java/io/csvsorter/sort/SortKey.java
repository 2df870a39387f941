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

import io.csvsorter.api.errors.MalformedRowException;
import io.csvsorter.api.fileio.Row;

import java.util.Arrays;
import java.util.Comparator;

/// An ordered list of column positions defining sort precedence.
///
/// Rows are compared by the values at these positions, in order, as case-sensitive text
/// with no numeric coercion. The chunk sorter and the merger both use this comparator, so the
/// ordering of every sorted file agrees.
public final class SortKey implements Comparator<Row> {
    private final int[] columns;
    private final int requiredArity;

    /// @param columns zero-based column positions, primary key first
    public SortKey(int... columns) {
        if (columns == null || columns.length == 0) {
            throw new IllegalArgumentException("A sort key needs at least one column");
        }
        int max = -1;
        for (int column : columns) {
            if (column < 0) {
                throw new IllegalArgumentException("Column index cannot be negative: " + column);
            }
            max = Math.max(max, column);
        }
        this.columns = columns.clone();
        this.requiredArity = max + 1;
    }

    /// @return a copy of the column positions
    public int[] columns() {
        return columns.clone();
    }

    /// @return the minimum number of fields a row needs for its key to be read
    public int requiredArity() {
        return requiredArity;
    }

    @Override
    public int compare(Row left, Row right) {
        checkArity(left);
        checkArity(right);
        for (int column : columns) {
            int cmp = left.get(column).compareTo(right.get(column));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private void checkArity(Row row) {
        if (row.size() < requiredArity) {
            throw new MalformedRowException(null, -1, row.size(), requiredArity);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(columns, ((SortKey) o).columns);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(columns);
    }

    @Override
    public String toString() {
        return "SortKey" + Arrays.toString(columns);
    }
}
