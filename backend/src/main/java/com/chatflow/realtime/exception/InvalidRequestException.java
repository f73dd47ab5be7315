package com.chatflow.realtime.exception;

/** A well-formed request that violates a chat rule (e.g. a private chat with three members). Mapped to 400. */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
