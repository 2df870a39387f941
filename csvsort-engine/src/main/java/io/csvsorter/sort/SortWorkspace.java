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

import io.csvsorter.api.errors.CsvSortIOException;
import io.csvsorter.api.errors.SortPhase;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/// The temporary directory owning every chunk and merge file of one sort run.
///
/// Each run gets its own directory, named after the process id plus a random suffix, so
/// concurrent runs never share files. The workspace is handed to each component explicitly.
/// Closing it removes the directory and everything in it.
///
/// When created with `deleteOnExit`, a shutdown hook also removes the directory if the JVM
/// exits before [#close()] runs. The hook is unregistered on a normal close.
public class SortWorkspace implements Closeable {
    private static final Logger logger = LogManager.getLogger(SortWorkspace.class);

    static final String PREFIX = "csvsorter.";

    private final Path directory;
    private final Thread shutdownHook;
    private int splitCount;
    private int mergeCount;
    private boolean closed;

    private SortWorkspace(Path directory, boolean deleteOnExit) {
        this.directory = directory;
        if (deleteOnExit) {
            this.shutdownHook = new Thread(() -> deleteDirectory(directory), "csvsorter-workspace-cleanup");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            this.shutdownHook = null;
        }
    }

    /// Create a fresh workspace
    /// @param parent the directory to create the workspace in
    /// @param deleteOnExit whether to also remove the workspace when the JVM shuts down
    /// @return the new workspace
    /// @throws CsvSortIOException if the directory cannot be created
    public static SortWorkspace create(Path parent, boolean deleteOnExit) {
        try {
            Files.createDirectories(parent);
            Path dir = Files.createTempDirectory(parent, PREFIX + ProcessHandle.current().pid() + ".");
            logger.debug("Created workspace {}", dir);
            return new SortWorkspace(dir, deleteOnExit);
        } catch (IOException e) {
            throw new CsvSortIOException(SortPhase.WORKSPACE, parent, e);
        }
    }

    /// @return the workspace directory
    public Path getDirectory() {
        return directory;
    }

    /// @return a path for the next chunk file; the file itself is not created
    public Path newSplitFile() {
        checkOpen();
        return directory.resolve("split" + splitCount++ + ".csv");
    }

    /// @return a path for the next merge output file; the file itself is not created
    public Path newMergeFile() {
        checkOpen();
        return directory.resolve("merge" + mergeCount++ + ".csv");
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Workspace " + directory + " is already closed");
        }
    }

    /// Remove the workspace directory and all of its contents. Safe to call more than once.
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM is shutting down; leaving workspace removal to the shutdown hook");
                return;
            }
        }
        deleteDirectory(directory);
    }

    private static void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    logger.warn("Could not delete: " + path, e);
                }
            });
            logger.debug("Removed workspace {}", dir);
        } catch (IOException e) {
            logger.warn("Could not remove workspace: " + dir, e);
        }
    }

    @Override
    public String toString() {
        return "SortWorkspace{" + directory + "}";
    }
}
