package com.chatflow.realtime.presence;

import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.event.PresencePayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PresenceTracker derives online/offline state from session lifecycle.
 *
 * A user is online while at least one session is connected. Only the 0 → 1 and
 * 1 → 0 transitions are announced; further devices connecting or disconnecting are
 * silent. Each user's session set is updated inside {@code compute}, so concurrent
 * connects and disconnects of the same user observe a single transition each, and
 * the announcements are queued in transition order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceTracker {

    private final PresenceNotifier notifier;
    private final Clock clock;

    // userId → connected session ids
    private final Map<String, Set<String>> sessionsByUser = new ConcurrentHashMap<>();

    // userId → time the user went offline
    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    /** @return true if this connect brought the user online */
    public boolean onConnect(String userId, String sessionId) {
        boolean[] cameOnline = {false};
        sessionsByUser.compute(userId, (id, current) -> {
            Set<String> sessions = current == null ? new HashSet<>() : current;
            if (sessions.add(sessionId) && sessions.size() == 1) {
                cameOnline[0] = true;
                notifier.announce(EventKind.USER_ONLINE, PresencePayload.builder()
                        .userId(userId)
                        .status(PresencePayload.ONLINE)
                        .build());
            }
            return sessions;
        });
        if (cameOnline[0]) {
            log.info("User online: userId={}", userId);
        }
        return cameOnline[0];
    }

    /** @return true if this disconnect took the user offline */
    public boolean onDisconnect(String userId, String sessionId) {
        boolean[] wentOffline = {false};
        sessionsByUser.computeIfPresent(userId, (id, sessions) -> {
            if (!sessions.remove(sessionId) || !sessions.isEmpty()) {
                return sessions;
            }
            wentOffline[0] = true;
            Instant now = Instant.now(clock);
            lastSeen.put(userId, now);
            notifier.announce(EventKind.USER_OFFLINE, PresencePayload.builder()
                    .userId(userId)
                    .status(PresencePayload.OFFLINE)
                    .lastSeen(now)
                    .build());
            return null;
        });
        if (wentOffline[0]) {
            log.info("User offline: userId={}", userId);
        }
        return wentOffline[0];
    }

    public boolean isOnline(String userId) {
        return userId != null && sessionsByUser.containsKey(userId);
    }

    public Optional<Instant> lastSeen(String userId) {
        return Optional.ofNullable(lastSeen.get(userId));
    }

    public int onlineUserCount() {
        return sessionsByUser.size();
    }
}
