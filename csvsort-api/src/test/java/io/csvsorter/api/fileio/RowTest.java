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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RowTest {

    @Test
    void nullFieldsBecomeEmptyStrings() {
        Row row = Row.of("a", null, "c");
        assertThat(row.fields()).containsExactly("a", "", "c");
        assertThat(row).isEqualTo(Row.of("a", "", "c"));
    }

    @Test
    void copiesItsInput() {
        List<String> fields = new ArrayList<>(Arrays.asList("x", "y"));
        Row row = Row.of(fields);
        fields.set(0, "changed");

        assertThat(row.get(0)).isEqualTo("x");
        assertThatThrownBy(() -> row.fields().add("z")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void indexOfFindsFirstMatch() {
        Row header = Row.of("id", "name", "id");
        assertThat(header.indexOf("id")).isZero();
        assertThat(header.indexOf("name")).isEqualTo(1);
        assertThat(header.indexOf("missing")).isEqualTo(-1);
        assertThat(header.size()).isEqualTo(3);
    }

    @Test
    void emptyRowIsAllowed() {
        assertThat(Row.of().size()).isZero();
        assertThat(Row.of(List.of())).isEqualTo(Row.of());
    }

    @Test
    void rejectsNullArrays() {
        assertThatThrownBy(() -> Row.of((String[]) null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Row.of((List<String>) null)).isInstanceOf(IllegalArgumentException.class);
    }
}
