package com.chatflow.realtime.protocol.dto;

import com.chatflow.realtime.protocol.ChatKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of a user's chat list. {@code unreadCount}, {@code counterpartId} and
 * {@code online} are relative to the requesting user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatSummaryDto {
    private String id;
    private String name;
    private ChatKind kind;
    private int memberCount;
    private int unreadCount;
    private MessagePreview lastMessage;
    private Instant lastMessageAt;

    /** Other participant of a private chat. */
    private String counterpartId;

    /** Presence of the counterpart; always false for group and broadcast chats. */
    private boolean online;
}
