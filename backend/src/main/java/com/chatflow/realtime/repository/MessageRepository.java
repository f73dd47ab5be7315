package com.chatflow.realtime.repository;

import com.chatflow.realtime.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory message store. Each chat keeps its messages in a sorted map keyed by room
 * sequence, plus a global id index.
 *
 * {@link #lastSequence(String)} is the room's high-water mark. It also counts sequences
 * consumed by non-message events (edits, reactions, receipts), so the fan-out hub can
 * seed its counter from it after a restart of the room channel.
 *
 * NOTE: Data is lost on server restart.
 */
@Slf4j
@Repository
public class MessageRepository {

    // chatId → (sequence → Message)
    private final Map<String, ConcurrentSkipListMap<Long, Message>> byChat = new ConcurrentHashMap<>();

    // messageId → Message
    private final Map<String, Message> byId = new ConcurrentHashMap<>();

    // chatId:senderId:clientMessageId → messageId
    private final Map<String, String> byClientId = new ConcurrentHashMap<>();

    // chatId → highest committed sequence
    private final Map<String, AtomicLong> highWater = new ConcurrentHashMap<>();

    public Message save(Message message) {
        byChat.computeIfAbsent(message.getChatId(), id -> new ConcurrentSkipListMap<>())
                .put(message.getSequence(), message);
        byId.put(message.getId(), message);
        if (message.getClientMessageId() != null) {
            byClientId.put(clientKey(message.getChatId(), message.getSenderId(), message.getClientMessageId()),
                    message.getId());
        }
        recordSequence(message.getChatId(), message.getSequence());
        log.debug("Message saved: id={} chatId={} seq={}", message.getId(), message.getChatId(), message.getSequence());
        return message;
    }

    public Optional<Message> findById(String messageId) {
        return Optional.ofNullable(messageId == null ? null : byId.get(messageId));
    }

    public Optional<Message> findByClientMessageId(String chatId, String senderId, String clientMessageId) {
        if (clientMessageId == null) {
            return Optional.empty();
        }
        return findById(byClientId.get(clientKey(chatId, senderId, clientMessageId)));
    }

    public long lastSequence(String chatId) {
        AtomicLong seq = highWater.get(chatId);
        return seq == null ? 0L : seq.get();
    }

    public void recordSequence(String chatId, long sequence) {
        highWater.computeIfAbsent(chatId, id -> new AtomicLong()).accumulateAndGet(sequence, Math::max);
    }

    /**
     * Non-deleted messages with a sequence strictly lower than {@code beforeSequence},
     * newest first.
     *
     * @param beforeSequence exclusive upper bound, {@code null} for the newest messages
     */
    public List<Message> findBefore(String chatId, Long beforeSequence, int limit) {
        ConcurrentSkipListMap<Long, Message> messages = byChat.get(chatId);
        List<Message> result = new ArrayList<>();
        if (messages == null || limit <= 0) {
            return result;
        }
        NavigableMap<Long, Message> range = beforeSequence == null
                ? messages.descendingMap()
                : messages.headMap(beforeSequence, false).descendingMap();
        for (Message message : range.values()) {
            if (message.isDeleted()) {
                continue;
            }
            result.add(message);
            if (result.size() == limit) {
                break;
            }
        }
        return result;
    }

    public Optional<Message> latest(String chatId) {
        List<Message> newest = findBefore(chatId, null, 1);
        return newest.isEmpty() ? Optional.empty() : Optional.of(newest.get(0));
    }

    public List<Message> findPinned(String chatId) {
        ConcurrentSkipListMap<Long, Message> messages = byChat.get(chatId);
        if (messages == null) {
            return List.of();
        }
        return messages.descendingMap().values().stream()
                .filter(m -> m.isPinned() && !m.isDeleted())
                .collect(Collectors.toList());
    }

    /** Messages after {@code afterSequence} not sent by {@code userId} and not deleted. */
    public int countUnread(String chatId, long afterSequence, String userId) {
        ConcurrentSkipListMap<Long, Message> messages = byChat.get(chatId);
        if (messages == null) {
            return 0;
        }
        int count = 0;
        for (Message message : messages.tailMap(afterSequence, false).values()) {
            if (!message.isDeleted() && !userId.equals(message.getSenderId())) {
                count++;
            }
        }
        return count;
    }

    public void deleteChat(String chatId) {
        ConcurrentSkipListMap<Long, Message> removed = byChat.remove(chatId);
        if (removed != null) {
            removed.values().forEach(m -> {
                byId.remove(m.getId());
                if (m.getClientMessageId() != null) {
                    byClientId.remove(clientKey(chatId, m.getSenderId(), m.getClientMessageId()));
                }
            });
        }
        highWater.remove(chatId);
    }

    private static String clientKey(String chatId, String senderId, String clientMessageId) {
        return chatId + ':' + senderId + ':' + clientMessageId;
    }
}
