package com.chatflow.realtime.repository;

import com.chatflow.realtime.model.Chat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory chat directory using a thread-safe ConcurrentHashMap, keyed by chat id.
 *
 * NOTE: Data is lost on server restart. The durable chat store is an external
 * collaborator; this repository only offers the lookups the sync engine needs.
 */
@Slf4j
@Repository
public class ChatRepository {

    // chatId → Chat
    private final Map<String, Chat> store = new ConcurrentHashMap<>();

    public Optional<Chat> findById(String chatId) {
        return Optional.ofNullable(chatId == null ? null : store.get(chatId));
    }

    public Chat save(Chat chat) {
        store.put(chat.getId(), chat);
        log.info("Chat saved: chatId={} kind={} members={}", chat.getId(), chat.getKind(), chat.memberCount());
        return chat;
    }

    /** Chats the user belongs to, most recently active first. */
    public List<Chat> findByMember(String userId) {
        return store.values().stream()
                .filter(chat -> chat.isMember(userId))
                .sorted(Comparator.comparing(Chat::getLastActivityAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .collect(Collectors.toList());
    }

    public List<String> chatIdsForUser(String userId) {
        return store.values().stream()
                .filter(chat -> chat.isMember(userId))
                .map(Chat::getId)
                .collect(Collectors.toList());
    }

    public void delete(String chatId) {
        if (store.remove(chatId) != null) {
            log.info("Chat deleted: chatId={}", chatId);
        }
    }

    public int count() {
        return store.size();
    }
}
