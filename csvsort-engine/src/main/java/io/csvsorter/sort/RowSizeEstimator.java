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

import io.csvsorter.api.fileio.Row;

import java.nio.charset.Charset;

/// Deterministic size accounting for chunk boundaries.
///
/// A row costs the encoded length of each field plus one separator byte per field, plus
/// [#ROW_OVERHEAD_BYTES]. This approximates what the row occupies once written, and is the
/// same for every run over the same data.
public final class RowSizeEstimator {
    /// Fixed per-row cost added to the field bytes
    public static final int ROW_OVERHEAD_BYTES = 16;

    private final Charset charset;

    /// @param charset the encoding used to measure field lengths
    public RowSizeEstimator(Charset charset) {
        if (charset == null) {
            throw new IllegalArgumentException("charset cannot be null");
        }
        this.charset = charset;
    }

    /// @param row the row to measure
    /// @return the estimated size of the row in bytes
    public long estimate(Row row) {
        long size = ROW_OVERHEAD_BYTES;
        for (String field : row.fields()) {
            size += field.getBytes(charset).length + 1;
        }
        return size;
    }
}
