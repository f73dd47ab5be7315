package com.chatflow.realtime.hub;

import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.SyncDestinations;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Sends to exactly one STOMP session through the user destination
 * {@code /user/queue/events}. Passing the session id as the "user" together with a
 * matching session header targets that session only, not every device of the user.
 */
@Component
@RequiredArgsConstructor
public class StompSessionSink implements SessionSink {

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void deliver(String sessionId, Envelope envelope) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(sessionId);
        accessor.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(sessionId, SyncDestinations.EVENTS_QUEUE, envelope,
                accessor.getMessageHeaders());
    }
}
