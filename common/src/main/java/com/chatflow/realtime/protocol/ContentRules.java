package com.chatflow.realtime.protocol;

import com.chatflow.realtime.protocol.dto.SendMessageRequest;

/**
 * Content checks applied both locally by the client (before any network call) and by
 * the server on acceptance.
 */
public final class ContentRules {

    private ContentRules() {
    }

    /**
     * Returns the trimmed content.
     *
     * @throws MessageValidationException if the content is null, blank or longer than
     *                                    {@link SendMessageRequest#MAX_CONTENT_LENGTH}
     */
    public static String requireValidContent(String content) {
        if (content == null || content.isBlank()) {
            throw new MessageValidationException("Message content must not be empty.");
        }
        String trimmed = content.trim();
        if (trimmed.length() > SendMessageRequest.MAX_CONTENT_LENGTH) {
            throw new MessageValidationException("Message content exceeds "
                    + SendMessageRequest.MAX_CONTENT_LENGTH + " characters.");
        }
        return trimmed;
    }
}
