package com.chatflow.realtime.typing;

import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.event.TypingPayload;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-side mirror of who is typing where. Entries are ephemeral: they expire after
 * {@code chatflow.typing.ttl-ms}, are removed on {@code typing.stop}, and are cleared
 * (with a {@code typing.stop} broadcast) when the contributing session goes away.
 *
 * Typing events are unsequenced and never reach the typing user's own sessions.
 */
@Slf4j
@Component
public class TypingMirror {

    private final FanoutHub hub;
    private final Clock clock;
    private final long ttlMs;

    private final Map<TypingKey, TypingEntry> entries = new ConcurrentHashMap<>();

    public TypingMirror(FanoutHub hub, Clock clock,
                        @Value("${chatflow.typing.ttl-ms:6000}") long ttlMs) {
        this.hub = hub;
        this.clock = clock;
        this.ttlMs = ttlMs;
    }

    /** Records or refreshes the entry; every call is mirrored so remote timers restart. */
    public void start(String chatId, String userId, String username, String sessionId) {
        Instant expiresAt = Instant.now(clock).plusMillis(ttlMs);
        entries.put(new TypingKey(chatId, userId), new TypingEntry(sessionId, username, expiresAt));
        hub.broadcast(chatId, EventKind.TYPING_START, payload(chatId, userId, username), userId);
    }

    public void stop(String chatId, String userId) {
        TypingEntry removed = entries.remove(new TypingKey(chatId, userId));
        if (removed != null) {
            hub.broadcast(chatId, EventKind.TYPING_STOP, payload(chatId, userId, removed.getUsername()), userId);
        }
    }

    /** Stops every entry the session contributed. */
    public int clearSession(String sessionId) {
        List<TypingKey> owned = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (entry.getSessionId().equals(sessionId)) {
                owned.add(key);
            }
        });
        int cleared = 0;
        for (TypingKey key : owned) {
            TypingEntry removed = entries.remove(key);
            if (removed != null) {
                cleared++;
                hub.broadcast(key.getChatId(), EventKind.TYPING_STOP,
                        payload(key.getChatId(), key.getUserId(), removed.getUsername()), key.getUserId());
            }
        }
        return cleared;
    }

    @Scheduled(fixedDelayString = "${chatflow.typing.sweep-ms:1000}")
    public void sweepExpired() {
        Instant now = Instant.now(clock);
        entries.forEach((key, entry) -> {
            if (!entry.getExpiresAt().isAfter(now) && entries.remove(key, entry)) {
                log.debug("Typing expired: chatId={} userId={}", key.getChatId(), key.getUserId());
                hub.broadcast(key.getChatId(), EventKind.TYPING_STOP,
                        payload(key.getChatId(), key.getUserId(), entry.getUsername()), key.getUserId());
            }
        });
    }

    public boolean isTyping(String chatId, String userId) {
        return entries.containsKey(new TypingKey(chatId, userId));
    }

    private static TypingPayload payload(String chatId, String userId, String username) {
        return TypingPayload.builder().chatId(chatId).userId(userId).username(username).build();
    }

    @Data
    private static class TypingKey {
        private final String chatId;
        private final String userId;
    }

    @Data
    private static class TypingEntry {
        private final String sessionId;
        private final String username;
        private final Instant expiresAt;
    }
}
