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

import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.wire.WireRecord;
import com.phonepe.soulwire.core.wire.messages.StepBegin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemSessionStoreTest {

    @TempDir
    Path tempDir;

    private FileSystemSessionStore sessionStore;

    @BeforeEach
    void setUp() {
        sessionStore = FileSystemSessionStore.builder()
                .baseDir(tempDir.resolve("sessions"))
                .build();
    }

    @Test
    void testCreateAndOpen() {
        final var workDir = tempDir.resolve("work");
        final var session = sessionStore.create(workDir);
        assertNotNull(session.getId());
        assertEquals(workDir.toAbsolutePath().normalize(), session.getWorkDir());
        assertTrue(sessionStore.exists(session.getId()));

        session.getContext().append(List.of(Message.user("Hello")));
        session.getWireLog().append(new WireRecord(1.0, new StepBegin(1)));

        final var reopened = sessionStore.open(session.getId(), workDir).orElse(null);
        assertNotNull(reopened);
        assertEquals(List.of(Message.user("Hello")), reopened.getContext().history());
        assertEquals(1, reopened.getWireLog().records().size());

        final var sessionDir = tempDir.resolve("sessions").resolve(session.getId());
        assertTrue(Files.exists(sessionDir.resolve(FileSystemContext.FILE_NAME)));
        assertTrue(Files.exists(sessionDir.resolve(FileSystemWireLog.FILE_NAME)));
    }

    @Test
    void testOpenMissing() {
        assertTrue(sessionStore.open("does-not-exist", tempDir).isEmpty());
        assertFalse(sessionStore.exists("does-not-exist"));
    }

    @Test
    void testDelete() {
        final var session = sessionStore.create(tempDir);
        session.getContext().append(List.of(Message.user("Hello")));
        assertTrue(sessionStore.delete(session.getId()));
        assertFalse(sessionStore.exists(session.getId()));
        assertFalse(sessionStore.delete(session.getId()));
    }

    @Test
    void testInvalidSessionId() {
        assertThrows(IllegalArgumentException.class, () -> sessionStore.open("../escape", tempDir));
        assertThrows(IllegalArgumentException.class, () -> sessionStore.exists("a/b"));
        assertThrows(IllegalArgumentException.class, () -> sessionStore.delete(""));
    }

    @Test
    void testApprovalStateSurvivesReopen() {
        final var session = sessionStore.create(tempDir);
        final var approvalState = session.approvalState();
        approvalState.addAutoApproveAction("edit file");
        approvalState.setYolo(true);

        final var reopened = sessionStore.open(session.getId(), tempDir).orElseThrow();
        final var restored = reopened.approvalState();
        assertTrue(restored.isYolo());
        assertEquals(Set.of("edit file"), restored.autoApproveActions());
        assertTrue(Files.exists(tempDir.resolve("sessions")
                                        .resolve(session.getId())
                                        .resolve(FileSystemSessionStateStore.FILE_NAME)));
    }
}
