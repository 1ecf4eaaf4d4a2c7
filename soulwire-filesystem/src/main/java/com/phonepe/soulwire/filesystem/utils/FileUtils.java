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

package com.phonepe.soulwire.filesystem.utils;

import com.phonepe.soulwire.core.errors.StorageException;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a readable and writable directory, creating it if requested.
     *
     * @param path              The directory
     * @param createIfNotExists Whether to create the directory if it does not exist
     * @return The absolute, normalized path
     * @throws IllegalArgumentException If the path is not a usable directory
     */
    public static Path ensureDirectory(Path path, boolean createIfNotExists) {
        final var absolutePath = path.toAbsolutePath().normalize();
        if (!Files.exists(absolutePath)) {
            if (!createIfNotExists) {
                throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
            }
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new StorageException("Failed to create directory " + absolutePath, e);
            }
        }
        if (!Files.isDirectory(absolutePath) || !Files.isReadable(absolutePath) || !Files.isWritable(absolutePath)) {
            throw new IllegalArgumentException(
                    "Sanity check for %s failed. Please check it is a directory with read and write permissions"
                            .formatted(absolutePath));
        }
        return absolutePath;
    }

    /**
     * Appends the given lines to the file, creating it if needed. Each line is terminated with a newline.
     */
    @SneakyThrows
    public static void appendLines(Path filePath, List<String> lines) {
        final var data = new StringBuilder();
        lines.forEach(line -> data.append(line).append('\n'));
        Files.writeString(filePath,
                          data,
                          StandardCharsets.UTF_8,
                          StandardOpenOption.CREATE,
                          StandardOpenOption.WRITE,
                          StandardOpenOption.APPEND);
    }

    /**
     * Replaces the file contents so that readers see either the old or the new data, never a mix. Data goes to a
     * temporary file in the same directory, is synced to disk and then renamed over the target.
     */
    public static void writeAtomically(Path filePath, byte[] data) {
        final var tempFile = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        try {
            try (final var channel = FileChannel.open(tempFile,
                                                      StandardOpenOption.CREATE,
                                                      StandardOpenOption.WRITE,
                                                      StandardOpenOption.TRUNCATE_EXISTING)) {
                final var buffer = ByteBuffer.wrap(data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tempFile, filePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        }
        catch (IOException e) {
            throw new StorageException("Failed to write " + filePath, e);
        }
    }

    /**
     * Moves the file aside to the first free <code>name_N.ext</code> in the same directory. Nothing happens if
     * the file does not exist.
     *
     * @return The path the file was moved to, or null if there was nothing to move
     */
    public static Path rotate(Path filePath) {
        if (!Files.exists(filePath)) {
            return null;
        }
        final var fileName = filePath.getFileName().toString();
        final var dot = fileName.lastIndexOf('.');
        final var base = dot < 0 ? fileName : fileName.substring(0, dot);
        final var extension = dot < 0 ? "" : fileName.substring(dot);
        var index = 1;
        var target = filePath.resolveSibling(base + "_" + index + extension);
        while (Files.exists(target)) {
            index++;
            target = filePath.resolveSibling(base + "_" + index + extension);
        }
        try {
            Files.move(filePath, target);
        }
        catch (IOException e) {
            throw new StorageException("Failed to rotate " + filePath, e);
        }
        log.debug("Rotated {} to {}", filePath, target);
        return target;
    }

    @SneakyThrows
    public static List<String> readLines(Path filePath) {
        if (!Files.exists(filePath)) {
            return List.of();
        }
        return Files.readAllLines(filePath, StandardCharsets.UTF_8);
    }
}
