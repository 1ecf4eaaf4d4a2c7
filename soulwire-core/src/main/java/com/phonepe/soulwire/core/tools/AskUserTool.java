package com.phonepe.soulwire.core.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.soulwire.core.errors.ErrorType;
import com.phonepe.soulwire.core.errors.QuestionNotSupportedException;
import com.phonepe.soulwire.core.wire.messages.Question;
import com.phonepe.soulwire.core.wire.messages.ToolReturnValue;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Lets the model ask the user structured multiple choice questions through the connected client
 */
@Slf4j
public class AskUserTool implements Tool {
    public static final String NAME = "AskUserQuestion";

    private static final String DESCRIPTION = """
            Ask the user one to four multiple choice questions when a decision needs their input. \
            Offer two to four distinct options per question. An "Other" option is added automatically.""";

    private static final String PARAMETERS = """
            {
              "type": "object",
              "properties": {
                "questions": {
                  "type": "array",
                  "minItems": 1,
                  "maxItems": 4,
                  "items": {
                    "type": "object",
                    "properties": {
                      "question": {"type": "string", "description": "A specific question ending with '?'"},
                      "header": {"type": "string", "description": "Short category tag"},
                      "options": {
                        "type": "array",
                        "minItems": 2,
                        "maxItems": 4,
                        "items": {
                          "type": "object",
                          "properties": {
                            "label": {"type": "string"},
                            "description": {"type": "string"}
                          },
                          "required": ["label"]
                        }
                      },
                      "multi_select": {"type": "boolean"}
                    },
                    "required": ["question", "options"]
                  }
                }
              },
              "required": ["questions"]
            }""";

    private static final String DISMISSED = "User dismissed the question without answering.";
    private static final String DISMISSED_OUTPUT = "{\"answers\": {}, \"note\": \"" + DISMISSED + "\"}";

    private final ObjectMapper mapper;
    private final ToolDefinition definition;

    @SneakyThrows
    public AskUserTool(ObjectMapper mapper) {
        this.mapper = mapper;
        this.definition = ToolDefinition.builder()
                .name(NAME)
                .description(DESCRIPTION)
                .parameters(mapper.readTree(PARAMETERS))
                .build();
    }

    @Override
    public ToolDefinition definition() {
        return definition;
    }

    @Override
    public ToolReturnValue call(ToolCallContext context, String arguments) throws Exception {
        final var params = mapper.readValue(arguments == null ? "{}" : arguments, Params.class);
        if (params.questions() == null || params.questions().isEmpty()) {
            return ToolReturnValue.error("", "At least one question is needed.", "Invalid arguments");
        }
        final Map<String, String> answers;
        try {
            answers = context.askQuestions(params.questions());
        }
        catch (QuestionNotSupportedException e) {
            return ToolReturnValue.error("", ErrorType.QUESTION_NOT_SUPPORTED.getMessage(), "Client unsupported");
        }
        if (answers.isEmpty()) {
            return ToolReturnValue.ok(DISMISSED_OUTPUT, DISMISSED, "User dismissed");
        }
        return ToolReturnValue.ok(mapper.writeValueAsString(Map.of("answers", answers)),
                                  "User has answered.",
                                  "User answered");
    }

    record Params(List<Question> questions) {
    }
}
