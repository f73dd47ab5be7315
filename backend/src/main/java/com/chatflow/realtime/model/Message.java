package com.chatflow.realtime.model;

import com.chatflow.realtime.protocol.DeliveryStatus;
import com.chatflow.realtime.protocol.dto.AttachmentRef;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.ReactionSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stored chat message. Mutations after creation (edit, delete, reactions, pin) happen
 * inside the room's publish step, so they are serialized per chat.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String id;
    private String chatId;
    private String senderId;
    private String senderName;
    private String content;

    @Builder.Default
    private String messageType = "text";

    private String replyToId;
    private String clientMessageId;
    private long sequence;

    private boolean edited;
    private Instant editedAt;
    private boolean deleted;
    private Instant deletedAt;
    private boolean pinned;

    @Builder.Default
    private List<AttachmentRef> attachments = new ArrayList<>();

    // emoji → user ids, in first-reaction order
    @Builder.Default
    private Map<String, Set<String>> reactions = new LinkedHashMap<>();

    private Instant createdAt;

    /** @return true if the reaction set changed */
    public synchronized boolean addReaction(String emoji, String userId) {
        return reactions.computeIfAbsent(emoji, e -> new LinkedHashSet<>()).add(userId);
    }

    /** @return true if the reaction set changed */
    public synchronized boolean removeReaction(String emoji, String userId) {
        Set<String> users = reactions.get(emoji);
        if (users == null || !users.remove(userId)) {
            return false;
        }
        if (users.isEmpty()) {
            reactions.remove(emoji);
        }
        return true;
    }

    public synchronized MessageDto toDto() {
        List<ReactionSummary> summaries = new ArrayList<>();
        reactions.forEach((emoji, users) -> summaries.add(ReactionSummary.builder()
                .emoji(emoji)
                .userIds(new ArrayList<>(users))
                .build()));

        return MessageDto.builder()
                .id(id)
                .chatId(chatId)
                .senderId(senderId)
                .senderName(senderName)
                .content(content)
                .messageType(messageType)
                .replyToId(replyToId)
                .clientMessageId(clientMessageId)
                .sequence(sequence)
                .status(DeliveryStatus.SENT)
                .edited(edited)
                .editedAt(editedAt)
                .deleted(deleted)
                .pinned(pinned)
                .attachments(new ArrayList<>(attachments))
                .reactions(summaries)
                .createdAt(createdAt)
                .build();
    }
}
