package com.chatflow.realtime.client.store;

import com.chatflow.realtime.client.typing.TypingTimers;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import lombok.Getter;
import lombok.Setter;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of the reconciliation store. Only {@link StateReducer} writes to it,
 * and only inside the store's serialized dispatch.
 *
 * <pre>
 *  messages   id → MessageDto            (flat table, canonical and local entries)
 *  timelines  chatId → ChatTimeline      (sequence → id, plus pending local ids)
 *  chats      chatId → ChatSummaryDto    (list order as loaded)
 * </pre>
 */
@Getter
public class StoreState {

    private final String currentUserId;

    private final Map<String, MessageDto> messages = new HashMap<>();
    private final Map<String, ChatTimeline> timelines = new HashMap<>();
    private final Map<String, ChatSummaryDto> chats = new LinkedHashMap<>();

    /** Chats whose first page has been loaded. */
    private final Set<String> loadedChats = new HashSet<>();
    private final Map<String, Boolean> hasMore = new HashMap<>();

    /** chatId → identities deleted for everyone; any later copy of them is ignored. */
    private final Map<String, Set<String>> tombstones = new HashMap<>();

    /** Highest room sequence observed per chat. */
    private final Map<String, Long> watermarks = new HashMap<>();

    /** chatId → remote users currently typing. */
    private final Map<String, TypingTimers<String>> typing = new HashMap<>();

    @Setter
    private String activeChatId;

    @Setter
    private int totalUnread;

    public StoreState(String currentUserId) {
        this.currentUserId = currentUserId;
    }

    public ChatTimeline timeline(String chatId) {
        return timelines.computeIfAbsent(chatId, id -> new ChatTimeline());
    }

    public void tombstone(String chatId, String messageId) {
        tombstones.computeIfAbsent(chatId, id -> new HashSet<>()).add(messageId);
    }

    public boolean isTombstoned(String chatId, String messageId) {
        Set<String> deleted = tombstones.get(chatId);
        return deleted != null && deleted.contains(messageId);
    }

    public boolean isOwn(MessageDto message) {
        return currentUserId.equals(message.getSenderId());
    }
}
