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

import java.nio.file.Path;

/**
 * Summary of a completed sort run.
 *
 * @param output     the destination file
 * @param rowCount   the number of data rows written, excluding the header
 * @param chunkCount the number of chunk files the input was split into
 * @param mergeCount the number of group merges performed
 */
public record SortResult(Path output, long rowCount, int chunkCount, int mergeCount) {
}
