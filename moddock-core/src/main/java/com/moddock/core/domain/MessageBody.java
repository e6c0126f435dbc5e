package com.moddock.core.domain;

/**
 * Content of a thread message: free text, or a system event.
 */
public record MessageBody(MessageType type, String text) {

    public static final int MAX_TEXT_LENGTH = 65536;

    public MessageBody {
        if (type == null) {
            throw new IllegalArgumentException("Message type is required");
        }
        if (type == MessageType.TEXT) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Text message must have a body");
            }
            if (text.length() > MAX_TEXT_LENGTH) {
                throw new IllegalArgumentException("Text exceeds " + MAX_TEXT_LENGTH + " characters");
            }
        } else if (text != null) {
            throw new IllegalArgumentException(type + " carries no text");
        }
    }

    public static MessageBody text(String text) {
        return new MessageBody(MessageType.TEXT, text);
    }

    public static MessageBody closure() {
        return new MessageBody(MessageType.THREAD_CLOSURE, null);
    }

    public static MessageBody reopen() {
        return new MessageBody(MessageType.THREAD_REOPEN, null);
    }

    public boolean isSystemEvent() {
        return type != MessageType.TEXT;
    }

    public enum MessageType {
        TEXT,
        THREAD_CLOSURE,
        THREAD_REOPEN
    }
}
