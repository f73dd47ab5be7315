package com.chatflow.realtime.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * User ↔ chat association. A user appears at most once per chat; the chat's member
 * map is keyed by user id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMember {

    private String userId;
    private String chatId;

    @Builder.Default
    private MemberRole role = MemberRole.MEMBER;

    private Instant joinedAt;

    /** Highest room sequence this member has read; 0 when nothing has been read. */
    private long lastReadSequence;
}
