package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Asks the user one or more structured questions. The answer maps question text to the chosen answer.
 * An empty answer means the user dismissed the questions.
 */
@Value
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class QuestionRequest extends WireRequest<Map<String, String>> {
    String id;
    String toolCallId;
    List<Question> questions;

    @Builder
    @Jacksonized
    public QuestionRequest(@NonNull String id, @NonNull String toolCallId, @NonNull List<Question> questions) {
        super(WireMessageType.QUESTION_REQUEST);
        this.id = id;
        this.toolCallId = toolCallId;
        this.questions = questions;
    }

    @Override
    public Map<String, String> defaultResolution() {
        return Map.of();
    }

    @Override
    public <T> T accept(WireRequestVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
