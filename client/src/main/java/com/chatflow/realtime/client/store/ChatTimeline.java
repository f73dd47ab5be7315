package com.chatflow.realtime.client.store;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Ordered identity index of one chat: canonical messages by room sequence, then
 * optimistic sends that have no sequence yet, in send order.
 */
public class ChatTimeline {

    private final TreeMap<Long, String> bySequence = new TreeMap<>();
    private final List<String> pending = new ArrayList<>();

    /** @return identity previously held at this sequence, or {@code null} */
    public String put(long sequence, String messageId) {
        return bySequence.put(sequence, messageId);
    }

    public void removeSequenced(long sequence) {
        bySequence.remove(sequence);
    }

    public void addPending(String localId) {
        if (!pending.contains(localId)) {
            pending.add(localId);
        }
    }

    public boolean removePending(String localId) {
        return pending.remove(localId);
    }

    public boolean isPending(String localId) {
        return pending.contains(localId);
    }

    /** Identity of the oldest canonical message, or {@code null}. */
    public String oldestId() {
        return bySequence.isEmpty() ? null : bySequence.firstEntry().getValue();
    }

    /** Identity of the newest canonical message, or {@code null}. */
    public String newestId() {
        return bySequence.isEmpty() ? null : bySequence.lastEntry().getValue();
    }

    /** Canonical messages in ascending sequence order. */
    public NavigableMap<Long, String> sequenced() {
        return bySequence;
    }

    public List<String> pending() {
        return pending;
    }

    /** Canonical identities in sequence order followed by pending identities. */
    public List<String> orderedIds() {
        List<String> ids = new ArrayList<>(bySequence.values());
        ids.addAll(pending);
        return ids;
    }

    public int size() {
        return bySequence.size() + pending.size();
    }
}
