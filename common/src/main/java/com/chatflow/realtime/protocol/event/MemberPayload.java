package com.chatflow.realtime.protocol.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Data of {@code chat.member.join} / {@code chat.member.leave}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MemberPayload {
    private String chatId;
    private String userId;
    private String username;
    private int memberCount;
}
