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
import com.phonepe.soulwire.core.errors.WireSerializationException;
import com.phonepe.soulwire.core.wire.WireLog;
import com.phonepe.soulwire.core.wire.WireRecord;
import com.phonepe.soulwire.core.wire.stdio.JsonRpc;
import com.phonepe.soulwire.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Wire log stored as <code>wire.jsonl</code>. The first line is a metadata record carrying the protocol version,
 * every other line is one {@link WireRecord}.
 */
@Slf4j
public class FileSystemWireLog implements WireLog {
    public static final String FILE_NAME = "wire.jsonl";
    static final String METADATA_TYPE = "metadata";

    private final Path filePath;
    private final ObjectMapper mapper;

    public FileSystemWireLog(@NonNull Path filePath, @NonNull ObjectMapper mapper) {
        this.filePath = filePath;
        this.mapper = mapper;
        if (!Files.exists(filePath)) {
            final var metadata = mapper.createObjectNode()
                    .put("type", METADATA_TYPE)
                    .put("protocol_version", JsonRpc.PROTOCOL_VERSION);
            FileUtils.appendLines(filePath, List.of(metadata.toString()));
        }
    }

    @Override
    public synchronized void append(WireRecord record) {
        try {
            FileUtils.appendLines(filePath, List.of(mapper.writeValueAsString(record)));
        }
        catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize wire record", e);
        }
    }

    @Override
    public synchronized List<WireRecord> records() {
        final var records = new ArrayList<WireRecord>();
        var lineNo = 0;
        for (final var line : FileUtils.readLines(filePath)) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                final var node = mapper.readTree(line);
                if (METADATA_TYPE.equals(node.path("type").asText())) {
                    continue;
                }
                records.add(mapper.treeToValue(node, WireRecord.class));
            }
            catch (JsonProcessingException | WireSerializationException | IllegalArgumentException e) {
                log.warn("Skipping unreadable line {} of {}: {}", lineNo, filePath, e.getMessage());
            }
        }
        return records;
    }
}
