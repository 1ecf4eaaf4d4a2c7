package com.phonepe.soulwire.core.messages;

import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Helpers to build and inspect message content
 */
@UtilityClass
public class Messages {

    /**
     * Wraps an engine generated notice so that the model can tell it apart from user text.
     */
    public static TextPart system(String notice) {
        return new TextPart("<system>" + notice + "</system>");
    }

    /**
     * Concatenated text of all text parts. Reasoning and media parts are skipped.
     */
    public static String text(Message message, String separator) {
        return message.getContent()
                .stream()
                .filter(TextPart.class::isInstance)
                .map(part -> ((TextPart) part).getText())
                .collect(Collectors.joining(separator));
    }

    public static List<ContentPart> withoutThinking(Collection<ContentPart> parts) {
        return parts.stream()
                .filter(part -> !(part instanceof ThinkPart))
                .toList();
    }

    /**
     * Number of characters of literal text across all messages
     */
    public static long textLength(Collection<Message> messages) {
        return messages.stream()
                .flatMap(message -> message.getContent().stream())
                .filter(TextPart.class::isInstance)
                .mapToLong(part -> ((TextPart) part).getText().length())
                .sum();
    }
}
