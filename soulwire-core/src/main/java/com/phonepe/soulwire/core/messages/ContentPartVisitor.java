package com.phonepe.soulwire.core.messages;

public interface ContentPartVisitor<T> {
    T visit(TextPart textPart);

    T visit(ThinkPart thinkPart);

    T visit(ImageUrlPart imageUrlPart);

    T visit(AudioUrlPart audioUrlPart);

    T visit(VideoUrlPart videoUrlPart);
}
