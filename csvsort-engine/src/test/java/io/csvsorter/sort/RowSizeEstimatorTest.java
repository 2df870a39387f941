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
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RowSizeEstimatorTest {

    @Test
    void sumsEncodedFieldLengthsPlusOverhead() {
        RowSizeEstimator estimator = new RowSizeEstimator(StandardCharsets.UTF_8);

        assertEquals(RowSizeEstimator.ROW_OVERHEAD_BYTES + (3 + 1) + (0 + 1),
            estimator.estimate(Row.of("abc", "")));
    }

    @Test
    void measuresInTheConfiguredEncoding() {
        Row row = Row.of("été");

        assertEquals(RowSizeEstimator.ROW_OVERHEAD_BYTES + 5 + 1,
            new RowSizeEstimator(StandardCharsets.UTF_8).estimate(row));
        assertEquals(RowSizeEstimator.ROW_OVERHEAD_BYTES + 3 + 1,
            new RowSizeEstimator(StandardCharsets.ISO_8859_1).estimate(row));
    }

    @Test
    void isDeterministic() {
        RowSizeEstimator estimator = new RowSizeEstimator(StandardCharsets.UTF_8);
        Row row = Row.of("x", "yy", "zzz");

        assertEquals(estimator.estimate(row), estimator.estimate(Row.of("x", "yy", "zzz")));
    }
}
