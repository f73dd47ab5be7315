package com.chatflow.realtime.protocol.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Data of {@code typing.start} / {@code typing.stop}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypingPayload {
    private String chatId;
    private String userId;
    private String username;
}
