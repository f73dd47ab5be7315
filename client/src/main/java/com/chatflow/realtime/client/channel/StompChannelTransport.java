package com.chatflow.realtime.client.channel;

import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.ProtocolMapper;
import com.chatflow.realtime.protocol.SyncDestinations;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.lang.reflect.Type;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ChannelTransport} over STOMP on a plain WebSocket. The access token travels
 * as a query parameter because browsers and most WebSocket clients cannot set headers
 * on the upgrade request.
 */
@Slf4j
public class StompChannelTransport implements ChannelTransport {

    private final String webSocketUrl;
    private final WebSocketStompClient stompClient;
    private final ThreadPoolTaskScheduler heartbeatScheduler;

    private volatile StompSession session;

    public StompChannelTransport(String webSocketUrl, Duration heartbeat) {
        this.webSocketUrl = webSocketUrl;

        MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
        converter.setObjectMapper(ProtocolMapper.create());

        this.heartbeatScheduler = new ThreadPoolTaskScheduler();
        heartbeatScheduler.setPoolSize(1);
        heartbeatScheduler.setThreadNamePrefix("stomp-heartbeat-");
        heartbeatScheduler.setDaemon(true);
        heartbeatScheduler.initialize();

        this.stompClient = new WebSocketStompClient(new StandardWebSocketClient());
        stompClient.setMessageConverter(converter);
        stompClient.setTaskScheduler(heartbeatScheduler);
        long hb = heartbeat.toMillis();
        stompClient.setDefaultHeartbeat(new long[]{hb, hb});
    }

    @Override
    public CompletableFuture<Void> open(String token, TransportListener listener) {
        URI uri = UriComponentsBuilder.fromUriString(webSocketUrl)
                .queryParam(SyncDestinations.TOKEN_PARAM, token)
                .build()
                .toUri();
        log.debug("Opening STOMP session to {}", webSocketUrl);

        return stompClient.connectAsync(uri, null, new StompHeaders(), new SessionHandler(listener))
                .thenAccept(opened -> {
                    session = opened;
                    opened.subscribe(SyncDestinations.USER_EVENTS, new EventFrameHandler(listener));
                });
    }

    @Override
    public void send(String command, Object payload) {
        StompSession current = session;
        if (current == null || !current.isConnected()) {
            throw new IllegalStateException("STOMP session is not connected");
        }
        current.send(SyncDestinations.app(command), payload);
    }

    @Override
    public void close() {
        StompSession current = session;
        session = null;
        if (current != null && current.isConnected()) {
            current.disconnect();
        }
    }

    /** Releases the heartbeat scheduler. The transport cannot be reopened afterwards. */
    public void shutdown() {
        close();
        heartbeatScheduler.shutdown();
    }

    private static final class SessionHandler extends StompSessionHandlerAdapter {
        private final TransportListener listener;

        private SessionHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void handleException(StompSession session, StompCommand command, StompHeaders headers,
                                    byte[] payload, Throwable exception) {
            log.error("Failed to handle STOMP {} frame", command, exception);
        }

        @Override
        public void handleTransportError(StompSession session, Throwable exception) {
            listener.onClosed(exception);
        }
    }

    private static final class EventFrameHandler implements StompFrameHandler {
        private final TransportListener listener;

        private EventFrameHandler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return Envelope.class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            listener.onEnvelope((Envelope) payload);
        }
    }
}
