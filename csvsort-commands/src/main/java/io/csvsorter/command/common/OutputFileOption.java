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

package io.csvsorter.command.common;

import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Shared optional output file option. When absent, the sorted rows replace the input file.
 */
public class OutputFileOption {

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "The output file path (default: overwrite the input file)"
    )
    private Path outputPath;

    /**
     * Gets the normalized output file path, or null when the input is to be overwritten.
     */
    public Path getNormalizedOutputPath() {
        return outputPath != null ? outputPath.normalize() : null;
    }

    /**
     * Checks if an output file was given.
     */
    public boolean isSpecified() {
        return outputPath != null;
    }
}
