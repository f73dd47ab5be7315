package com.chatflow.realtime.protocol;

/**
 * Thrown when message content is rejected before it is sent or stored
 * (empty, whitespace-only or oversized).
 */
public class MessageValidationException extends RuntimeException {

    public MessageValidationException(String message) {
        super(message);
    }
}
