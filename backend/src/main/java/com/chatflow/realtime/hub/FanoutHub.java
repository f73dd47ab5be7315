package com.chatflow.realtime.hub;

import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.repository.MessageRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongFunction;

/**
 * FanoutHub assigns per-room sequence numbers and pushes events to every session
 * subscribed to the room.
 *
 * <h3>Publish path</h3>
 *
 * <pre>
 *  MessageService ──publish(chatId, kind, seq → payload)──► RoomChannel(chatId)
 *                                                             │  lock
 *                                                             │  seq = last + 1
 *                                                             │  payload = factory(seq)   (may throw: seq not consumed)
 *                                                             │  last = seq
 *                                                             │  for session in subscribersOf(chatId):
 *                                                             │      sink.deliver(session, envelope)
 *                                                             ▼  unlock
 * </pre>
 *
 * <ul>
 * <li>One lock per room: sequences inside a room are gapless and strictly increasing,
 * publishes to different rooms never contend.</li>
 * <li>Delivery happens inside the room step, so every session receives a room's events
 * in sequence order. The broker is configured to preserve publish order per session.</li>
 * <li>A delivery failure to one session is logged; other subscribers and the committed
 * sequence are unaffected.</li>
 * <li>Counters are seeded lazily from {@link MessageRepository#lastSequence(String)}.
 * The hub keeps no event history; clients recover gaps through backfill.</li>
 * </ul>
 *
 * Typing and presence go through {@link #broadcast}/{@link #sendToUser} and carry no
 * sequence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FanoutHub {

    private final SubscriptionRegistry registry;
    private final SessionSink sink;
    private final MessageRepository messageRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, RoomChannel> rooms = new ConcurrentHashMap<>();

    // ── Sequenced room events ─────────────────────────────────────────────

    public long publish(String chatId, EventKind kind, Object payload) {
        return publish(chatId, kind, seq -> payload);
    }

    /**
     * Publishes an event whose payload depends on its own sequence number (e.g. a new
     * message stored with the sequence it is accepted under). The factory runs under
     * the room lock; if it throws, no sequence is consumed and nothing is delivered.
     *
     * @return the sequence number assigned to the event
     */
    public long publish(String chatId, EventKind kind, LongFunction<?> payloadFactory) {
        RoomChannel room = rooms.computeIfAbsent(chatId, id -> new RoomChannel());
        room.lock.lock();
        try {
            if (!room.seeded) {
                room.lastSequence = messageRepository.lastSequence(chatId);
                room.seeded = true;
            }
            long sequence = room.lastSequence + 1;
            Object payload = payloadFactory.apply(sequence);

            room.lastSequence = sequence;
            messageRepository.recordSequence(chatId, sequence);

            Envelope envelope = Envelope.builder()
                    .event(kind)
                    .chatId(chatId)
                    .sequence(sequence)
                    .data(objectMapper.valueToTree(payload))
                    .timestamp(Instant.now(clock))
                    .build();

            int delivered = deliverAll(registry.subscribersOf(chatId), envelope);
            log.debug("Published {} chatId={} seq={} deliveredTo={}", kind, chatId, sequence, delivered);
            return sequence;
        } finally {
            room.lock.unlock();
        }
    }

    public long currentSequence(String chatId) {
        RoomChannel room = rooms.get(chatId);
        if (room == null) {
            return messageRepository.lastSequence(chatId);
        }
        room.lock.lock();
        try {
            return room.seeded ? room.lastSequence : messageRepository.lastSequence(chatId);
        } finally {
            room.lock.unlock();
        }
    }

    /** Drops the room's counter after the chat was deleted. */
    public void forgetRoom(String chatId) {
        rooms.remove(chatId);
    }

    // ── Unsequenced events ────────────────────────────────────────────────

    /**
     * Sends an ephemeral event to the room's subscribers, skipping every session of
     * {@code excludeUserId} (may be {@code null}).
     */
    public void broadcast(String chatId, EventKind kind, Object payload, String excludeUserId) {
        Set<String> excluded = registry.sessionsOf(excludeUserId);
        Envelope envelope = unsequenced(kind, chatId, payload);
        int delivered = 0;
        for (String sessionId : registry.subscribersOf(chatId)) {
            if (!excluded.contains(sessionId) && deliver(sessionId, envelope)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} chatId={} deliveredTo={}", kind, chatId, delivered);
    }

    /** Sends to every connected session of the user, subscribed or not. */
    public void sendToUser(String userId, EventKind kind, String chatId, Object payload) {
        deliverAll(registry.sessionsOf(userId), unsequenced(kind, chatId, payload));
    }

    public void sendToSession(String sessionId, EventKind kind, String chatId, Object payload) {
        deliver(sessionId, unsequenced(kind, chatId, payload));
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private Envelope unsequenced(EventKind kind, String chatId, Object payload) {
        return Envelope.builder()
                .event(kind)
                .chatId(chatId)
                .data(payload == null ? null : objectMapper.valueToTree(payload))
                .timestamp(Instant.now(clock))
                .build();
    }

    private int deliverAll(Collection<String> sessionIds, Envelope envelope) {
        int delivered = 0;
        for (String sessionId : sessionIds) {
            if (deliver(sessionId, envelope)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(String sessionId, Envelope envelope) {
        try {
            sink.deliver(sessionId, envelope);
            return true;
        } catch (RuntimeException e) {
            log.warn("Delivery of {} to sessionId={} failed: {}", envelope.getEvent(), sessionId, e.getMessage());
            return false;
        }
    }

    private static final class RoomChannel {
        private final ReentrantLock lock = new ReentrantLock();
        private long lastSequence;
        private boolean seeded;
    }
}
