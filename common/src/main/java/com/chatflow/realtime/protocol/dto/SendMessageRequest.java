package com.chatflow.realtime.protocol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request body for {@code POST /api/messages}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SendMessageRequest {

    public static final int MAX_CONTENT_LENGTH = 4000;

    @NotBlank(message = "chatId is required")
    private String chatId;

    @NotBlank(message = "Message content must not be blank")
    @Size(max = MAX_CONTENT_LENGTH, message = "Message content must be at most 4000 characters")
    private String content;

    private String replyToId;

    /** Client-generated id; a repeated send with the same id returns the stored message. */
    @Size(max = 64, message = "clientMessageId must be at most 64 characters")
    private String clientMessageId;
}
