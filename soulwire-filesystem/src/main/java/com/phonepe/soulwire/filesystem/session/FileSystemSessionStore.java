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

package com.phonepe.soulwire.filesystem.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.phonepe.soulwire.core.errors.StorageException;
import com.phonepe.soulwire.core.session.Session;
import com.phonepe.soulwire.core.utils.JsonUtils;
import com.phonepe.soulwire.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Sessions stored as one directory per session under a base directory. Each directory holds
 * <code>context.jsonl</code>, <code>wire.jsonl</code> and <code>state.json</code>.
 */
@Slf4j
public class FileSystemSessionStore {
    private static final Pattern SESSION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_\\-]+$");

    private final Path baseDir;
    private final ObjectMapper mapper;

    @Builder
    public FileSystemSessionStore(@NonNull Path baseDir, ObjectMapper mapper) {
        this.baseDir = FileUtils.ensureDirectory(baseDir, true);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
    }

    /**
     * Creates a new empty session with a random id
     */
    public Session create(@NonNull Path workDir) {
        final var sessionId = UUID.randomUUID().toString();
        final var sessionDir = FileUtils.ensureDirectory(baseDir.resolve(sessionId), true);
        log.info("Created session {} at {}", sessionId, sessionDir);
        return load(sessionId, sessionDir, workDir);
    }

    /**
     * Opens an existing session
     *
     * @return The session, empty if no such session exists
     */
    public Optional<Session> open(@NonNull String sessionId, @NonNull Path workDir) {
        final var sessionDir = sessionDir(sessionId);
        if (!Files.isDirectory(sessionDir)) {
            log.debug("No session directory for {}", sessionId);
            return Optional.empty();
        }
        return Optional.of(load(sessionId, FileUtils.ensureDirectory(sessionDir, false), workDir));
    }

    public boolean exists(@NonNull String sessionId) {
        return Files.isDirectory(sessionDir(sessionId));
    }

    /**
     * Deletes the session directory with everything in it
     *
     * @return true if the session existed
     */
    public boolean delete(@NonNull String sessionId) {
        final var sessionDir = sessionDir(sessionId);
        if (!Files.isDirectory(sessionDir)) {
            return false;
        }
        try {
            MoreFiles.deleteRecursively(sessionDir, RecursiveDeleteOption.ALLOW_INSECURE);
        }
        catch (IOException e) {
            throw new StorageException("Failed to delete session " + sessionId, e);
        }
        log.info("Deleted session {}", sessionId);
        return true;
    }

    private Path sessionDir(String sessionId) {
        Preconditions.checkArgument(SESSION_ID_PATTERN.matcher(sessionId).matches(),
                                    "Invalid session id: %s", sessionId);
        return baseDir.resolve(sessionId);
    }

    private Session load(String sessionId, Path sessionDir, Path workDir) {
        return new Session(sessionId,
                           workDir.toAbsolutePath().normalize(),
                           new FileSystemContext(sessionDir.resolve(FileSystemContext.FILE_NAME), mapper),
                           new FileSystemWireLog(sessionDir.resolve(FileSystemWireLog.FILE_NAME), mapper),
                           new FileSystemSessionStateStore(sessionDir.resolve(FileSystemSessionStateStore.FILE_NAME),
                                                           mapper));
    }
}
