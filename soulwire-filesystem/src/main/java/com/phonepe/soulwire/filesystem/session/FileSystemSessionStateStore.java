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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.errors.StorageException;
import com.phonepe.soulwire.core.session.SessionState;
import com.phonepe.soulwire.core.session.SessionStateStore;
import com.phonepe.soulwire.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Session state kept in <code>state.json</code>. Saves replace the file atomically. A file that is missing or
 * cannot be understood yields the default state.
 */
@Slf4j
public class FileSystemSessionStateStore implements SessionStateStore {
    public static final String FILE_NAME = "state.json";

    private final Path filePath;
    private final ObjectMapper mapper;

    public FileSystemSessionStateStore(@NonNull Path filePath, @NonNull ObjectMapper mapper) {
        this.filePath = filePath;
        this.mapper = mapper;
    }

    @Override
    public synchronized SessionState load() {
        if (!Files.exists(filePath)) {
            log.debug("No session state at {}. Using defaults", filePath);
            return SessionState.defaults();
        }
        try {
            final var node = mapper.readTree(Files.readAllBytes(filePath));
            if (null == node || !node.isObject()) {
                log.warn("Session state at {} is not a JSON object. Using defaults", filePath);
                return SessionState.defaults();
            }
            final var state = mapper.treeToValue(node, SessionState.class);
            if (state.getVersion() != SessionState.CURRENT_VERSION) {
                log.warn("Unsupported session state version {} at {}. Using defaults", state.getVersion(), filePath);
                return SessionState.defaults();
            }
            final var normalized = state.normalized();
            if (!normalized.equals(state)) {
                log.warn("Session state at {} has missing or null sections. Using defaults for them", filePath);
            }
            return normalized;
        }
        catch (IOException | IllegalArgumentException e) {
            log.warn("Session state at {} is unreadable: {}. Using defaults", filePath, e.getMessage());
            return SessionState.defaults();
        }
    }

    @Override
    public synchronized void save(SessionState state) {
        try {
            FileUtils.writeAtomically(filePath, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state));
        }
        catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize session state", e);
        }
        log.debug("Saved session state to {}", filePath);
    }
}
