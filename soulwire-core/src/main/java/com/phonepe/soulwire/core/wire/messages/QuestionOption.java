package com.phonepe.soulwire.core.wire.messages;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QuestionOption {
    @NonNull
    String label;

    String description;
}
