package com.phonepe.soulwire.core.provider;

import com.phonepe.soulwire.core.messages.Message;
import com.phonepe.soulwire.core.messages.TokenUsage;
import lombok.Value;

@Value
public class GenerateResult {
    String id;
    Message message;
    TokenUsage usage;
}
