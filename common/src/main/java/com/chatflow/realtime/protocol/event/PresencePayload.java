package com.chatflow.realtime.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Data of {@code user.online}, {@code user.offline} and {@code user.status}.
 * {@code lastSeen} is only set on the transition to offline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PresencePayload {

    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";

    private String userId;
    private String status;
    private Instant lastSeen;

    /** Free-text status message, only for {@code user.status}. */
    private String statusMessage;

    public boolean isOnline() {
        return ONLINE.equals(status);
    }
}
