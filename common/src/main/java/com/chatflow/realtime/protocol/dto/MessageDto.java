package com.chatflow.realtime.protocol.dto;

import com.chatflow.realtime.protocol.DeliveryStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical message as returned by send/backfill and carried by {@code message.new}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageDto {

    private String id;
    private String chatId;

    /** Absent for system messages. */
    private String senderId;
    private String senderName;

    private String content;

    @Builder.Default
    private String messageType = "text";

    private String replyToId;

    /** Echo of the sender's client-generated id, used to match optimistic copies. */
    private String clientMessageId;

    /** Per-room sequence number; {@code null} until the hub accepts the message. */
    private Long sequence;

    private DeliveryStatus status;

    private boolean edited;
    private Instant editedAt;
    private boolean deleted;
    private boolean pinned;

    @Builder.Default
    private List<AttachmentRef> attachments = new ArrayList<>();

    @Builder.Default
    private List<ReactionSummary> reactions = new ArrayList<>();

    private Instant createdAt;
}
