package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class Question {
    @NonNull
    String question;

    /**
     * Short label shown as a chip or tab title
     */
    String header;

    @Singular
    List<QuestionOption> options;

    boolean multiSelect;
}
