package com.chatflow.realtime.client.typing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-key typing state machine: {@code Idle → TypingActive(expiresAt) → Idle}.
 * A key is active while it has an expiry; {@link #expire(Instant)} drives the timeout
 * transition from a scheduled check. Not thread-safe; owners guard it.
 *
 * @param <K> what is typing: a user id for remote indicators, a chat id for local state
 */
public class TypingTimers<K> {

    private final Map<K, Instant> expiries = new LinkedHashMap<>();

    /** @return true if the key entered TypingActive, false if it was already active */
    public boolean activate(K key, Instant expiresAt) {
        return expiries.put(key, expiresAt) == null;
    }

    /** @return true if the key left TypingActive */
    public boolean deactivate(K key) {
        return expiries.remove(key) != null;
    }

    /** Moves every key whose expiry is at or before {@code now} back to Idle. */
    public List<K> expire(Instant now) {
        List<K> expired = new ArrayList<>();
        Iterator<Map.Entry<K, Instant>> it = expiries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<K, Instant> entry = it.next();
            if (!entry.getValue().isAfter(now)) {
                expired.add(entry.getKey());
                it.remove();
            }
        }
        return expired;
    }

    public boolean isActive(K key) {
        return expiries.containsKey(key);
    }

    public Set<K> activeKeys() {
        return expiries.keySet();
    }

    public boolean isEmpty() {
        return expiries.isEmpty();
    }
}
