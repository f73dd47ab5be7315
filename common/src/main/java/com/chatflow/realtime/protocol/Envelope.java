package com.chatflow.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Unified frame pushed to {@code /user/queue/events} and sent by clients to
 * {@code /app/*}.
 *
 * <pre>
 * {
 *   "event": "message.new",
 *   "chatId": "c-42",
 *   "sequence": 17,
 *   "data": { ...payload... },
 *   "timestamp": "2026-01-01T10:00:00Z"
 * }
 * </pre>
 *
 * {@code sequence} is present only for events published through a room's serialized
 * publish path. Typing and presence events are ephemeral and carry no sequence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Envelope {

    private EventKind event;

    /** Room the event belongs to; absent for user-scoped events. */
    private String chatId;

    /** Per-room sequence number assigned at publish time. */
    private Long sequence;

    private JsonNode data;

    private Instant timestamp;

    public boolean isSequenced() {
        return sequence != null && chatId != null;
    }
}
