package com.chatflow.realtime.exception;

/** Unknown chat, message or backfill cursor. Mapped to 404. */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException chat(String chatId) {
        return new ResourceNotFoundException("Chat not found: " + chatId);
    }

    public static ResourceNotFoundException message(String messageId) {
        return new ResourceNotFoundException("Message not found: " + messageId);
    }
}
