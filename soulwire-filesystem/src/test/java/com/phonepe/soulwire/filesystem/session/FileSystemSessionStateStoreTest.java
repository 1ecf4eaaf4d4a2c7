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

import com.phonepe.soulwire.core.context.InMemoryContext;
import com.phonepe.soulwire.core.session.Session;
import com.phonepe.soulwire.core.session.SessionState;
import com.phonepe.soulwire.core.utils.JsonUtils;
import com.phonepe.soulwire.core.wire.InMemoryWireLog;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemSessionStateStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileGivesDefaults() {
        final var store = new FileSystemSessionStateStore(tempDir.resolve(FileSystemSessionStateStore.FILE_NAME),
                                                          JsonUtils.createMapper());
        assertEquals(SessionState.defaults(), store.load());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "not json at all",
            "[1, 2, 3]",
            "\"just a string\"",
            "{\"version\": 99, \"approval\": {\"yolo\": true}}",
            "{\"version\": 1, \"approval\": \"wrong shape\"}",
            "{\"version\": 1, \"approval\": null}",
            "{\"version\": 1, \"approval\": {\"yolo\": false, \"auto_approve_actions\": null}}",
            "{\"version\": 1, \"dynamic_subagents\": null, \"additional_dirs\": null}",
    })
    @SneakyThrows
    void testUnusableFileGivesDefaults(String content) {
        final var filePath = tempDir.resolve(FileSystemSessionStateStore.FILE_NAME);
        Files.writeString(filePath, content);
        final var store = new FileSystemSessionStateStore(filePath, JsonUtils.createMapper());
        assertEquals(SessionState.defaults(), store.load());
    }

    @Test
    @SneakyThrows
    void testNullSectionsKeepOtherSettings() {
        final var filePath = tempDir.resolve(FileSystemSessionStateStore.FILE_NAME);
        Files.writeString(filePath, "{\"version\": 1, "
                + "\"approval\": {\"yolo\": true, \"auto_approve_actions\": [\"edit file\", null]}, "
                + "\"additional_dirs\": null}");
        final var store = new FileSystemSessionStateStore(filePath, JsonUtils.createMapper());

        final var state = store.load();
        assertTrue(state.getApproval().isYolo());
        assertEquals(List.of("edit file"), state.getApproval().getAutoApproveActions());
        assertEquals(List.of(), state.getAdditionalDirs());
        assertEquals(List.of(), state.getDynamicSubagents());

        final var session = new Session("s-1", tempDir, new InMemoryContext(), new InMemoryWireLog(), store);
        final var approvalState = session.approvalState();
        assertTrue(approvalState.isYolo());
        assertEquals(Set.of("edit file"), approvalState.autoApproveActions());
    }

    @Test
    @SneakyThrows
    void testSaveAndLoad() {
        final var filePath = tempDir.resolve(FileSystemSessionStateStore.FILE_NAME);
        final var store = new FileSystemSessionStateStore(filePath, JsonUtils.createMapper());
        final var state = SessionState.defaults()
                .withApproval(SessionState.ApprovalSettings.builder()
                                      .yolo(true)
                                      .autoApproveActions(List.of("run command"))
                                      .build())
                .withDynamicSubagents(List.of(SessionState.DynamicSubagent.builder()
                                                      .name("reviewer")
                                                      .systemPrompt("Review the change")
                                                      .build()))
                .withAdditionalDirs(List.of("/tmp/extra"));
        store.save(state);

        final var reopened = new FileSystemSessionStateStore(filePath, JsonUtils.createMapper());
        assertEquals(state, reopened.load());
        final var json = JsonUtils.createMapper().readTree(Files.readString(filePath));
        assertTrue(json.get("approval").get("auto_approve_actions").isArray());
        assertEquals("reviewer", json.get("dynamic_subagents").get(0).get("name").asText());
    }
}
