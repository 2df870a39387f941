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

package io.csvsorter.api.errors;

/// The stage of a sort run, used to give I/O failures some context.
public enum SortPhase {
    /// Opening the input and reading the header
    OPEN_INPUT,
    /// Partitioning the input into chunk files
    SPLIT,
    /// Sorting one chunk file in memory
    SORT_CHUNK,
    /// Combining sorted files
    MERGE,
    /// Writing the destination file
    WRITE_OUTPUT,
    /// Creating or removing the temporary directory
    WORKSPACE
}
