package com.chatflow.realtime.hub;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SubscriptionRegistry tracks which sessions listen to which chat rooms.
 *
 * <pre>
 *  sessionId → userId          (registered on STOMP CONNECT)
 *  sessionId → {chatId, ...}   (chat.subscribe / chat.unsubscribe)
 *  chatId    → {sessionId, ...}
 *  userId    → {sessionId, ...} (one entry per device)
 * </pre>
 *
 * Mutations are synchronized so the forward and reverse maps never disagree; reads
 * return snapshots and never block a publish.
 */
@Slf4j
@Component
public class SubscriptionRegistry {

    private final Map<String, String> userBySession = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> chatsBySession = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByChat = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    // ── Sessions ──────────────────────────────────────────────────────────

    /** @return false if the session was already registered */
    public synchronized boolean registerSession(String sessionId, String userId) {
        if (userBySession.putIfAbsent(sessionId, userId) != null) {
            return false;
        }
        chatsBySession.put(sessionId, ConcurrentHashMap.newKeySet());
        sessionsByUser.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(sessionId);
        log.debug("Session registered: sessionId={} userId={}", sessionId, userId);
        return true;
    }

    /**
     * Removes the session and every subscription it holds. Safe to call repeatedly;
     * only the first call returns the released state.
     */
    public synchronized Optional<ReleasedSession> removeSession(String sessionId) {
        String userId = userBySession.remove(sessionId);
        if (userId == null) {
            return Optional.empty();
        }
        Set<String> chats = chatsBySession.remove(sessionId);
        Set<String> released = chats == null ? Set.of() : Set.copyOf(chats);
        for (String chatId : released) {
            removeFromChat(chatId, sessionId);
        }
        Set<String> userSessions = sessionsByUser.get(userId);
        if (userSessions != null) {
            userSessions.remove(sessionId);
            if (userSessions.isEmpty()) {
                sessionsByUser.remove(userId);
            }
        }
        log.debug("Session removed: sessionId={} userId={} releasedChats={}", sessionId, userId, released.size());
        return Optional.of(new ReleasedSession(sessionId, userId, released));
    }

    // ── Subscriptions ─────────────────────────────────────────────────────

    /** @return false if the session is unknown (already torn down) */
    public synchronized boolean subscribe(String sessionId, String chatId) {
        Set<String> chats = chatsBySession.get(sessionId);
        if (chats == null) {
            return false;
        }
        chats.add(chatId);
        sessionsByChat.computeIfAbsent(chatId, id -> ConcurrentHashMap.newKeySet()).add(sessionId);
        log.debug("Subscribed: sessionId={} chatId={}", sessionId, chatId);
        return true;
    }

    /** @return true if the session was subscribed to the chat */
    public synchronized boolean unsubscribe(String sessionId, String chatId) {
        Set<String> chats = chatsBySession.get(sessionId);
        if (chats == null || !chats.remove(chatId)) {
            return false;
        }
        removeFromChat(chatId, sessionId);
        log.debug("Unsubscribed: sessionId={} chatId={}", sessionId, chatId);
        return true;
    }

    /** Drops every session of {@code userId} from the chat, e.g. after the user left it. */
    public synchronized void unsubscribeUser(String chatId, String userId) {
        for (String sessionId : sessionsOf(userId)) {
            unsubscribe(sessionId, chatId);
        }
    }

    /** Drops all subscriptions to a deleted chat. */
    public synchronized void unsubscribeAll(String chatId) {
        Set<String> sessions = sessionsByChat.remove(chatId);
        if (sessions == null) {
            return;
        }
        for (String sessionId : sessions) {
            Set<String> chats = chatsBySession.get(sessionId);
            if (chats != null) {
                chats.remove(chatId);
            }
        }
    }

    // ── Queries ───────────────────────────────────────────────────────────

    public List<String> subscribersOf(String chatId) {
        Set<String> sessions = sessionsByChat.get(chatId);
        return sessions == null ? List.of() : List.copyOf(sessions);
    }

    public Set<String> sessionsOf(String userId) {
        Set<String> sessions = userId == null ? null : sessionsByUser.get(userId);
        return sessions == null ? Set.of() : Set.copyOf(sessions);
    }

    public Set<String> subscriptionsOf(String sessionId) {
        Set<String> chats = chatsBySession.get(sessionId);
        return chats == null ? Set.of() : Collections.unmodifiableSet(new HashSet<>(chats));
    }

    public Optional<String> userOf(String sessionId) {
        return Optional.ofNullable(sessionId == null ? null : userBySession.get(sessionId));
    }

    public boolean isSubscribed(String sessionId, String chatId) {
        Set<String> chats = chatsBySession.get(sessionId);
        return chats != null && chats.contains(chatId);
    }

    public int sessionCount() {
        return userBySession.size();
    }

    private void removeFromChat(String chatId, String sessionId) {
        Set<String> sessions = sessionsByChat.get(chatId);
        if (sessions != null) {
            sessions.remove(sessionId);
            if (sessions.isEmpty()) {
                sessionsByChat.remove(chatId);
            }
        }
    }
}
