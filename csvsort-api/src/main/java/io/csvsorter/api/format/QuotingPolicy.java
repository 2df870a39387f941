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

package io.csvsorter.api.format;

/// Which fields get quoted when rows are written out.
public enum QuotingPolicy {
    /// Quote only fields containing the delimiter, a quote character or a line break
    MINIMAL,
    /// Quote every field
    ALL,
    /// Quote every field that is not a number. Fields are text, so in practice this quotes all fields.
    NON_NUMERIC,
    /// Never quote; special characters are escaped with a backslash
    NONE
}
