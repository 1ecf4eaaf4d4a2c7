package com.phonepe.soulwire.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.approval.Approval;
import com.phonepe.soulwire.core.errors.ErrorType;
import com.phonepe.soulwire.core.messages.ToolCall;
import com.phonepe.soulwire.core.utils.JsonUtils;
import com.phonepe.soulwire.core.wire.SideOptions;
import com.phonepe.soulwire.core.wire.Wire;
import com.phonepe.soulwire.core.wire.messages.QuestionRequest;
import lombok.SneakyThrows;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AskUserToolTest {
    private static final String ARGUMENTS = """
            {"questions": [{"question": "Which database?", "header": "Storage", "multi_select": false,
              "options": [{"label": "Postgres"}, {"label": "Redis", "description": "In memory"}]}]}""";

    private final ObjectMapper mapper = JsonUtils.createMapper();
    private ExecutorService executorService;
    private Wire wire;

    @BeforeEach
    void setup() {
        executorService = Executors.newCachedThreadPool();
        wire = new Wire();
    }

    @AfterEach
    void tearDown() {
        wire.shutdown();
        executorService.shutdownNow();
    }

    @Test
    @SneakyThrows
    void testAnswered() {
        final var handler = wire.attach(SideOptions.builder().requestHandler(true).supportsQuestions(true).build());
        final var tool = new AskUserTool(mapper);
        final var result = executorService.submit(() -> tool.call(context(), ARGUMENTS));

        final var request = (QuestionRequest) handler.poll(Duration.ofSeconds(5)).orElseThrow();
        assertEquals("call-1", request.getToolCallId());
        final var question = request.getQuestions().get(0);
        assertEquals("Which database?", question.getQuestion());
        assertEquals(2, question.getOptions().size());
        assertEquals("In memory", question.getOptions().get(1).getDescription());
        request.resolve(Map.of("Which database?", "Postgres"));

        final var returnValue = result.get(5, TimeUnit.SECONDS);
        assertFalse(returnValue.isError());
        assertEquals(Map.of("answers", Map.of("Which database?", "Postgres")),
                     mapper.readValue(returnValue.getOutput(), Map.class));
        assertEquals("User has answered.", returnValue.getMessage());
    }

    @Test
    @SneakyThrows
    void testDismissed() {
        final var handler = wire.attach(SideOptions.builder().requestHandler(true).supportsQuestions(true).build());
        final var tool = new AskUserTool(mapper);
        final var result = executorService.submit(() -> tool.call(context(), ARGUMENTS));
        final var request = (QuestionRequest) handler.poll(Duration.ofSeconds(5)).orElseThrow();
        request.resolveWithDefault();

        final var returnValue = result.get(5, TimeUnit.SECONDS);
        assertFalse(returnValue.isError());
        assertEquals("User dismissed the question without answering.", returnValue.getMessage());
        assertTrue(returnValue.getOutput().contains("\"answers\": {}"));
    }

    @Test
    @SneakyThrows
    void testClientWithoutQuestionSupport() {
        wire.attach(SideOptions.builder().requestHandler(true).build());
        final var returnValue = new AskUserTool(mapper).call(context(), ARGUMENTS);
        assertTrue(returnValue.isError());
        assertEquals(ErrorType.QUESTION_NOT_SUPPORTED.getMessage(), returnValue.getMessage());
    }

    @Test
    @SneakyThrows
    void testNoQuestions() {
        final var tool = new AskUserTool(mapper);
        assertTrue(tool.call(context(), "{\"questions\": []}").isError());
        assertTrue(tool.call(context(), null).isError());
        assertEquals(AskUserTool.NAME, tool.name());
        assertEquals("object", tool.definition().getParameters().get("type").asText());
    }

    private ToolCallContext context() {
        return new ToolCallContext(ToolCall.of("call-1", AskUserTool.NAME, ARGUMENTS), new Approval(), wire, mapper);
    }
}
