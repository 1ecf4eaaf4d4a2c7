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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.context.Context;
import com.phonepe.soulwire.core.errors.StorageException;
import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.StampedLock;

/**
 * Context backed by a jsonl file.
 * Implementation:
 * - Every message is one line, in history order.
 * - Token count updates are stored as <code>{"role":"_usage","token_count":N}</code> lines, the last one wins.
 * - Checkpoints are stored as <code>{"role":"_checkpoint","id":N}</code> lines.
 * - The file is read once at startup and then served from memory. Writes go to the file first and are
 *   committed to memory after.
 * - Clearing or replacing the history moves the current file aside to <code>context_N.jsonl</code>.
 */
@Slf4j
public class FileSystemContext implements Context {
    public static final String FILE_NAME = "context.jsonl";

    static final String USAGE_ROLE = "_usage";
    static final String CHECKPOINT_ROLE = "_checkpoint";

    private final Path filePath;
    private final ObjectMapper mapper;
    private final StampedLock lock = new StampedLock();

    private final List<Message> history = new ArrayList<>();
    private long tokenCount;
    private int checkpoints;

    public FileSystemContext(@NonNull Path filePath, @NonNull ObjectMapper mapper) {
        this.filePath = filePath;
        this.mapper = mapper;
        restore();
    }

    @Override
    public List<Message> history() {
        final var stamp = lock.readLock();
        try {
            return List.copyOf(history);
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public long tokenCount() {
        final var stamp = lock.readLock();
        try {
            return tokenCount;
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public int checkpointCount() {
        final var stamp = lock.readLock();
        try {
            return checkpoints;
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void append(List<Message> messages) {
        final var stamp = lock.writeLock();
        try {
            FileUtils.appendLines(filePath, messages.stream().map(this::toLine).toList());
            history.addAll(messages);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void updateTokenCount(long tokenCount) {
        final var stamp = lock.writeLock();
        try {
            FileUtils.appendLines(filePath, List.of(usageLine(tokenCount)));
            this.tokenCount = tokenCount;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public int checkpoint() {
        final var stamp = lock.writeLock();
        try {
            final var id = checkpoints;
            FileUtils.appendLines(filePath, List.of(checkpointLine(id)));
            checkpoints++;
            return id;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void clear() {
        final var stamp = lock.writeLock();
        try {
            final var rotated = FileUtils.rotate(filePath);
            log.info("Context cleared. Previous history kept at {}", rotated);
            history.clear();
            tokenCount = 0;
            checkpoints = 0;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void replace(List<Message> messages) {
        final var stamp = lock.writeLock();
        try {
            final var rotated = FileUtils.rotate(filePath);
            log.info("Context replaced with {} messages. Previous history kept at {}", messages.size(), rotated);
            final var lines = new ArrayList<String>();
            lines.add(checkpointLine(0));
            messages.forEach(message -> lines.add(toLine(message)));
            lines.add(usageLine(tokenCount));
            FileUtils.appendLines(filePath, lines);
            history.clear();
            history.addAll(messages);
            checkpoints = 1;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    private void restore() {
        final var lines = FileUtils.readLines(filePath);
        var lineNo = 0;
        for (final var line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                final var node = mapper.readTree(line);
                final var role = node.path("role").asText();
                switch (role) {
                    case USAGE_ROLE -> tokenCount = node.path("token_count").asLong();
                    case CHECKPOINT_ROLE -> checkpoints = node.path("id").asInt() + 1;
                    default -> history.add(mapper.treeToValue(node, Message.class));
                }
            }
            catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping unreadable line {} of {}: {}", lineNo, filePath, e.getMessage());
            }
        }
        log.debug("Restored context from {}. Messages: {} Tokens: {} Checkpoints: {}",
                  filePath, history.size(), tokenCount, checkpoints);
    }

    private String toLine(Message message) {
        return write(mapper.valueToTree(message));
    }

    private String usageLine(long tokenCount) {
        return write(mapper.createObjectNode()
                             .put("role", USAGE_ROLE)
                             .put("token_count", tokenCount));
    }

    private String checkpointLine(int id) {
        return write(mapper.createObjectNode()
                             .put("role", CHECKPOINT_ROLE)
                             .put("id", id));
    }

    private String write(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        }
        catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize context entry", e);
        }
    }
}
