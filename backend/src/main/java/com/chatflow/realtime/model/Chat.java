package com.chatflow.realtime.model;

import com.chatflow.realtime.protocol.ChatKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chat room. The member set is never empty and a private chat has exactly two
 * members; {@link com.chatflow.realtime.service.ChatService} enforces both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Chat {

    private String id;
    private ChatKind kind;
    private String name;

    // userId → member
    @Builder.Default
    private Map<String, ChatMember> members = new ConcurrentHashMap<>();

    private String createdBy;
    private Instant createdAt;
    private volatile Instant lastActivityAt;

    public boolean isMember(String userId) {
        return userId != null && members.containsKey(userId);
    }

    public Optional<ChatMember> member(String userId) {
        return Optional.ofNullable(userId == null ? null : members.get(userId));
    }

    public Set<String> memberIds() {
        return Set.copyOf(members.keySet());
    }

    public int memberCount() {
        return members.size();
    }

    /** The other participant of a private chat, if {@code userId} is one of the two. */
    public Optional<String> counterpartOf(String userId) {
        if (kind != ChatKind.PRIVATE || !isMember(userId)) {
            return Optional.empty();
        }
        return members.keySet().stream().filter(id -> !id.equals(userId)).findFirst();
    }
}
