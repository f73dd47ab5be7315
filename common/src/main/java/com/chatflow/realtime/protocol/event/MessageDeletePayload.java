package com.chatflow.realtime.protocol.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Data of {@code message.delete}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDeletePayload {
    private String id;
    private String chatId;
    private boolean deletedForEveryone;
}
