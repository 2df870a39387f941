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

import java.nio.file.Files;
import java.nio.file.Path;

/// The positional file to sort. When no output file is given it is also the destination.
public class InputFileOption {

    /// A file named on the command line
    ///
    /// @param path the file path, never null
    public record InputFile(Path path) {

        public InputFile {
            if (path == null) {
                throw new IllegalArgumentException("Input path cannot be null");
            }
        }

        /// @return true if the path names an existing regular file
        public boolean exists() {
            return Files.isRegularFile(path);
        }

        /// @throws IllegalStateException if the file does not exist or is not a regular file
        public void validate() {
            if (!exists()) {
                throw new IllegalStateException("Input file does not exist: " + path);
            }
        }

        @Override
        public String toString() {
            return path.toString();
        }
    }

    /// Picocli type converter for [InputFile]
    public static class InputFileConverter implements CommandLine.ITypeConverter<InputFile> {

        @Override
        public InputFile convert(String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new IllegalArgumentException("Input file path cannot be empty");
            }
            return new InputFile(Path.of(value));
        }
    }

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "INPUT",
        description = "The delimited file to sort",
        converter = InputFileConverter.class
    )
    private InputFile inputFile;

    /// @return the input path, or null before the command line is parsed
    public Path getInputPath() {
        return inputFile != null ? inputFile.path() : null;
    }

    /// @throws IllegalStateException if no input was given or it is not an existing file
    public void validate() {
        if (inputFile == null) {
            throw new IllegalStateException("Input file is required");
        }
        inputFile.validate();
    }
}
