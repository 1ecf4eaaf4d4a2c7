package com.phonepe.soulwire.core.wire;

import com.phonepe.soulwire.core.errors.QuestionNotSupportedException;
import com.phonepe.soulwire.core.errors.WireShutdownException;
import com.phonepe.soulwire.core.messages.TextPart;
import com.phonepe.soulwire.core.utils.TestUtils;
import com.phonepe.soulwire.core.wire.messages.ApprovalOutcome;
import com.phonepe.soulwire.core.wire.messages.ApprovalRequest;
import com.phonepe.soulwire.core.wire.messages.ContentPartEvent;
import com.phonepe.soulwire.core.wire.messages.Question;
import com.phonepe.soulwire.core.wire.messages.QuestionRequest;
import com.phonepe.soulwire.core.wire.messages.StepBegin;
import com.phonepe.soulwire.core.wire.messages.SubagentEvent;
import com.phonepe.soulwire.core.wire.messages.TurnBegin;
import com.phonepe.soulwire.core.wire.messages.TurnEnd;
import com.phonepe.soulwire.core.wire.messages.UserInput;
import com.phonepe.soulwire.core.wire.messages.WireMessage;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class WireTest {

    @Test
    @SneakyThrows
    void testEventsReachEverySideInOrder() {
        final var wire = new Wire();
        final var first = wire.attach(SideOptions.OBSERVER);
        final var second = wire.attach(SideOptions.builder().requestHandler(true).build());

        final var events = List.<WireMessage>of(new TurnBegin(UserInput.text("hello")),
                                                new StepBegin(1),
                                                new ContentPartEvent(new TextPart("Hi")),
                                                new TurnEnd());
        events.forEach(wire::publish);

        assertEquals(events, TestUtils.drain(first));
        assertEquals(events, TestUtils.drain(second));
    }

    @Test
    @SneakyThrows
    void testRequestGoesToLatestHandlerOnly() {
        final var wire = new Wire();
        final var observer = wire.attach(SideOptions.OBSERVER);
        final var oldHandler = wire.attach(SideOptions.builder().requestHandler(true).build());
        final var handler = wire.attach(SideOptions.builder().requestHandler(true).build());

        final var request = approvalRequest("req-1");
        wire.request(request);

        assertEquals(List.of(request), TestUtils.drain(handler));
        assertTrue(TestUtils.drain(oldHandler).isEmpty());
        assertTrue(TestUtils.drain(observer).isEmpty());
        assertEquals(List.of(request), wire.outstandingRequests());

        request.resolve(ApprovalOutcome.APPROVE);
        assertEquals(ApprovalOutcome.APPROVE, request.await(Duration.ofSeconds(1)));
        assertTrue(wire.outstandingRequests().isEmpty());

        // Detached handlers are skipped
        handler.close();
        final var next = approvalRequest("req-2");
        wire.request(next);
        assertEquals(List.of(next), TestUtils.drain(oldHandler));
    }

    @Test
    @SneakyThrows
    void testRequestsWaitForHandler() {
        final var wire = new Wire();
        final var first = approvalRequest("req-1");
        final var second = approvalRequest("req-2");
        wire.request(first);
        wire.request(second);
        assertFalse(first.isResolved());

        final var handler = wire.attach(SideOptions.builder().requestHandler(true).build());
        assertEquals(List.of(first, second), TestUtils.drain(handler));
    }

    @Test
    @SneakyThrows
    void testQuestionsNeedSupport() {
        final var wire = new Wire();
        final var handler = wire.attach(SideOptions.builder().requestHandler(true).build());
        final var unsupported = questionRequest("q-1");
        wire.request(unsupported);
        assertThrows(QuestionNotSupportedException.class, unsupported::await);
        assertTrue(TestUtils.drain(handler).isEmpty());

        handler.setSupportsQuestions(true);
        final var supported = questionRequest("q-2");
        wire.request(supported);
        assertEquals(List.of(supported), TestUtils.drain(handler));
        supported.resolve(Map.of("Which database?", "Postgres"));
        assertEquals(Map.of("Which database?", "Postgres"), supported.await());
    }

    @Test
    @SneakyThrows
    void testPublishingRequestAsEventFails() {
        final var wire = new Wire();
        assertThrows(IllegalArgumentException.class, () -> wire.publish(approvalRequest("req-1")));
    }

    @Test
    @SneakyThrows
    void testShutdownDrainsThenFails() {
        final var wire = new Wire(WireSetup.builder().pollInterval(Duration.ofMillis(10)).build());
        final var side = wire.attach(SideOptions.OBSERVER);
        wire.publish(new StepBegin(1));
        wire.shutdown();
        wire.publish(new StepBegin(2));

        assertEquals(new StepBegin(1), side.receive());
        assertThrows(WireShutdownException.class, side::receive);
        assertTrue(wire.isShutdown());

        final var late = wire.attach(SideOptions.OBSERVER);
        assertThrows(WireShutdownException.class, () -> late.poll(Duration.ZERO));
    }

    @Test
    @SneakyThrows
    void testDetachedSideFails() {
        final var wire = new Wire();
        final var side = wire.attach(SideOptions.OBSERVER);
        side.close();
        wire.publish(new StepBegin(1));
        assertThrows(WireShutdownException.class, () -> side.poll(Duration.ZERO));
        assertTrue(wire.sides().isEmpty());
    }

    @Test
    @SneakyThrows
    void testReplayBeforeLive() {
        final var wire = new Wire();
        final var backlog = List.<WireMessage>of(new TurnBegin(UserInput.text("earlier")), new TurnEnd());
        final var side = wire.attach(SideOptions.builder().replayBacklog(true).build(), backlog);
        assertTrue(side.isReplaying());

        wire.publish(new TurnBegin(UserInput.text("now")));
        wire.publish(new StepBegin(1));

        assertEquals(List.of(new TurnBegin(UserInput.text("earlier")),
                             new TurnEnd(),
                             new TurnBegin(UserInput.text("now")),
                             new StepBegin(1)),
                     TestUtils.drain(side));
        assertFalse(side.isReplaying());

        wire.publish(new TurnEnd());
        assertEquals(List.of(new TurnEnd()), TestUtils.drain(side));
    }

    @Test
    @SneakyThrows
    void testBacklogIgnoredWithoutReplay() {
        final var wire = new Wire();
        final var side = wire.attach(SideOptions.OBSERVER, List.of(new TurnEnd()));
        assertTrue(TestUtils.drain(side).isEmpty());
    }

    @Test
    @SneakyThrows
    void testMergedSideUnwrapsSubagentEvents() {
        final var wire = new Wire();
        final var raw = wire.attach(SideOptions.OBSERVER);
        final var merged = wire.attach(SideOptions.builder().merged(true).build());
        final var event = new SubagentEvent("task-1", new StepBegin(3));
        wire.publish(event);

        assertEquals(List.of(event), TestUtils.drain(raw));
        assertEquals(List.of(new StepBegin(3)), TestUtils.drain(merged));
    }

    @Test
    @SneakyThrows
    void testStalledSidesNeverBlockPublisher() {
        final var wire = new Wire(WireSetup.builder()
                                          .sideQueueCapacity(1000)
                                          .build());
        final var first = wire.attach(SideOptions.OBSERVER);
        final var second = wire.attach(SideOptions.OBSERVER);

        assertTimeout(Duration.ofSeconds(2), () -> {
            for (var i = 1; i <= 1002; i++) {
                wire.publish(new StepBegin(i));
            }
        });

        for (final var side : List.of(first, second)) {
            assertTrue(side.isLagging());
            assertFalse(wire.sides().contains(side));
            final var received = TestUtils.drain(side);
            assertEquals(1000, received.size());
            assertEquals(new StepBegin(1), received.get(0));
            assertEquals(new StepBegin(1000), received.get(999));
            assertThrows(WireShutdownException.class, () -> side.poll(Duration.ZERO));
        }
    }

    @Test
    @SneakyThrows
    void testLaggingSideDoesNotAffectOthers() {
        final var wire = new Wire(WireSetup.builder()
                                          .sideQueueCapacity(2)
                                          .build());
        final var slow = wire.attach(SideOptions.OBSERVER);
        final var fast = wire.attach(SideOptions.OBSERVER);

        final var received = new ArrayList<WireMessage>();
        for (var i = 1; i <= 5; i++) {
            wire.publish(new StepBegin(i));
            received.addAll(TestUtils.drain(fast));
        }

        assertEquals(IntStream.rangeClosed(1, 5).mapToObj(StepBegin::new).toList(), received);
        assertFalse(fast.isLagging());
        assertTrue(slow.isLagging());
        assertEquals(List.of(new StepBegin(1), new StepBegin(2)), TestUtils.drain(slow));
    }

    @Test
    @SneakyThrows
    void testRequestsMoveToNextHandlerAfterLaggingHandler() {
        final var wire = new Wire(WireSetup.builder()
                                          .sideQueueCapacity(1)
                                          .build());
        final var stalled = wire.attach(SideOptions.builder().requestHandler(true).build());
        wire.publish(new StepBegin(1));
        wire.publish(new StepBegin(2));
        assertTrue(stalled.isLagging());

        final var request = approvalRequest("req-1");
        wire.request(request);
        assertFalse(request.isResolved());

        final var handler = wire.attach(SideOptions.builder().requestHandler(true).build());
        assertEquals(List.of(request), TestUtils.drain(handler));
        request.resolve(ApprovalOutcome.APPROVE);
        assertEquals(ApprovalOutcome.APPROVE, request.await());
        assertEquals(List.of(new StepBegin(1)), TestUtils.drain(stalled));
    }

    @Test
    void testRecorderSeesEverything() {
        final var wireLog = new InMemoryWireLog();
        final var wire = new Wire(WireSetup.DEFAULT, new WireRecorder(wireLog));
        wire.publish(new StepBegin(1));
        final var request = approvalRequest("req-1");
        wire.request(request);
        wire.publish(new TurnEnd());

        assertEquals(List.of(new StepBegin(1), request, new TurnEnd()),
                     wireLog.records().stream().map(WireRecord::getMessage).toList());
    }

    private static ApprovalRequest approvalRequest(String id) {
        return ApprovalRequest.builder()
                .id(id)
                .toolCallId("call-1")
                .sender("shell")
                .action("run command")
                .description("ls -la")
                .build();
    }

    private static QuestionRequest questionRequest(String id) {
        return QuestionRequest.builder()
                .id(id)
                .toolCallId("call-1")
                .questions(List.of(Question.builder()
                                           .question("Which database?")
                                           .build()))
                .build();
    }
}
