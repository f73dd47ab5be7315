package com.chatflow.realtime.protocol.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Data of {@code message.read}: {@code userId} has read everything up to {@code messageId}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadReceiptPayload {
    private String chatId;
    private String userId;
    private String messageId;
    private Long sequence;
    private Instant readAt;
}
