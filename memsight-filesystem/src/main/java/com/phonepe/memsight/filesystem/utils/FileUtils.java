/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.phonepe.memsight.filesystem.utils;


import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a directory with the required permissions. If the path does not
     * exist and createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @param writeCheck        Whether to check for write permissions on the directory.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is not a usable directory or does not exist and creation was not
     *                                  requested.
     * @throws UncheckedIOException     If the directory could not be created.
     */
    public static Path ensurePath(String path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new UncheckedIOException("Failed to create directory: " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath)
                || !Files.isReadable(absolutePath)
                || (writeCheck && !Files.isWritable(absolutePath))) {
            throw new IllegalArgumentException(
                    "Sanity check for %s failed. Please check it is a directory with the required permissions"
                            .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Replaces the contents of a file atomically. Data goes to a temporary file in the same directory which is then
     * moved over the target, so readers see either the old or the new contents.
     *
     * @param filePath The path of the file to write to.
     * @param data     The byte array data to write.
     */
    public static void writeAtomically(Path filePath, byte[] data) throws IOException {
        final var temp = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        Files.write(temp, data);
        try {
            Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to plain replace", filePath);
            Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * @return true if the file existed
     */
    public static boolean delete(Path filePath) throws IOException {
        return Files.deleteIfExists(filePath);
    }
}
