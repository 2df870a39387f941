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

/// Base type for every failure raised while sorting a delimited file.
/// All failures are fatal to the current run; nothing is retried.
public class CsvSortException extends RuntimeException {

    /// @param message the error message
    public CsvSortException(String message) {
        super(message);
    }

    /// @param message the error message
    /// @param cause the underlying failure
    public CsvSortException(String message, Throwable cause) {
        super(message, cause);
    }
}
