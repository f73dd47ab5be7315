package com.chatflow.realtime.session;

import com.chatflow.realtime.hub.ReleasedSession;
import com.chatflow.realtime.hub.SubscriptionRegistry;
import com.chatflow.realtime.presence.PresenceTracker;
import com.chatflow.realtime.security.ChatPrincipal;
import com.chatflow.realtime.typing.TypingMirror;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.security.Principal;
import java.util.Optional;

/**
 * Binds STOMP session lifecycle to the registry, typing mirror and presence tracker.
 *
 * <pre>
 *  CONNECT frame      → registry.registerSession → presence.onConnect
 *  socket closed      → registry.removeSession   (subscriptions released first)
 *  (DISCONNECT frame,   → typingMirror.clearSession (typing.stop for each entry)
 *   heartbeat timeout,  → presence.onDisconnect
 *   transport error)
 * </pre>
 *
 * Registration happens on the inbound CONNECT rather than on CONNECTED so the session
 * is known before the client's first command frame. Teardown may be signalled more
 * than once for one session; only the first signal has an effect.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionLifecycleListener {

    private final SubscriptionRegistry registry;
    private final TypingMirror typingMirror;
    private final PresenceTracker presenceTracker;

    @EventListener
    public void onConnect(SessionConnectEvent event) {
        String sessionId = StompHeaderAccessor.wrap(event.getMessage()).getSessionId();
        Principal user = event.getUser();
        if (!(user instanceof ChatPrincipal)) {
            log.warn("STOMP CONNECT without an authenticated principal: sessionId={}", sessionId);
            return;
        }
        register(sessionId, ((ChatPrincipal) user).getUserId());
    }

    @EventListener
    public void onDisconnect(SessionDisconnectEvent event) {
        log.debug("Session closed: sessionId={} status={}", event.getSessionId(), event.getCloseStatus());
        teardown(event.getSessionId());
    }

    public void register(String sessionId, String userId) {
        if (registry.registerSession(sessionId, userId)) {
            presenceTracker.onConnect(userId, sessionId);
            log.info("Session connected: sessionId={} userId={}", sessionId, userId);
        }
    }

    /** @return the released state, or empty if the session was already torn down */
    public Optional<ReleasedSession> teardown(String sessionId) {
        Optional<ReleasedSession> released = registry.removeSession(sessionId);
        if (released.isEmpty()) {
            log.debug("Teardown ignored for unknown sessionId={}", sessionId);
            return released;
        }
        String userId = released.get().getUserId();
        int typingCleared = typingMirror.clearSession(sessionId);
        presenceTracker.onDisconnect(userId, sessionId);
        log.info("Session disconnected: sessionId={} userId={} chats={} typingCleared={}",
                sessionId, userId, released.get().getChatIds().size(), typingCleared);
        return released;
    }
}
