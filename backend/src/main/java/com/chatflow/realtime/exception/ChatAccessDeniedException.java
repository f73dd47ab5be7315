package com.chatflow.realtime.exception;

/** The caller is not a member of the chat or lacks the role for the operation. Mapped to 403. */
public class ChatAccessDeniedException extends RuntimeException {

    public ChatAccessDeniedException(String message) {
        super(message);
    }
}
