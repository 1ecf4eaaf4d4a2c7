package com.phonepe.soulwire.core.wire.messages;

public interface WireRequestVisitor<T> {
    T visit(ApprovalRequest request);

    T visit(QuestionRequest request);

    T visit(ToolCallRequest request);
}
