package com.chatflow.realtime.config;

import com.chatflow.realtime.protocol.SyncDestinations;
import com.chatflow.realtime.security.JwtHandshakeInterceptor;
import com.chatflow.realtime.security.UserHandshakeHandler;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Configures the STOMP session channel.
 *
 * Every client holds ONE connection and receives all of its events on its private
 * queue {@code /user/queue/events}. Chat-room membership is not expressed as STOMP
 * subscriptions: the client sends {@code /app/chat.subscribe} and the server-side
 * SubscriptionRegistry decides which sessions a room's events fan out to, so sequence
 * assignment and delivery stay with the application rather than the broker.
 *
 * Ordering:
 * - preserveReceiveOrder: a client's SUBSCRIBE to its queue is processed before its
 *   first {@code chat.subscribe} command.
 * - preservePublishOrder: events pushed to one session leave in the order they were
 *   published, so per-room sequence order survives the outbound thread pool.
 *
 * Heartbeats: the simple broker exchanges STOMP heartbeats so that half-open
 * connections are closed and go through regular session teardown.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final JwtHandshakeInterceptor handshakeInterceptor;
    private final UserHandshakeHandler handshakeHandler;

    @Value("${chatflow.ws.allowed-origins:*}")
    private String allowedOrigins;

    @Value("${chatflow.ws.heartbeat-ms:10000}")
    private long heartbeatMs;

    private TaskScheduler heartbeatScheduler;

    public WebSocketConfig(JwtHandshakeInterceptor handshakeInterceptor,
                           UserHandshakeHandler handshakeHandler) {
        this.handshakeInterceptor = handshakeInterceptor;
        this.handshakeHandler = handshakeHandler;
    }

    @Autowired
    public void setHeartbeatScheduler(@Lazy @Qualifier("messageBrokerTaskScheduler") TaskScheduler scheduler) {
        this.heartbeatScheduler = scheduler;
    }

    /**
     * Java/native clients connect to: ws://host:8080/ws/sync?token=...
     * Browsers that need a fallback use the SockJS variant.
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(SyncDestinations.ENDPOINT)
                .setAllowedOriginPatterns(allowedOrigins.split(","))
                .addInterceptors(handshakeInterceptor)
                .setHandshakeHandler(handshakeHandler);

        registry.addEndpoint(SyncDestinations.ENDPOINT + "-sockjs")
                .setAllowedOriginPatterns(allowedOrigins.split(","))
                .addInterceptors(handshakeInterceptor)
                .setHandshakeHandler(handshakeHandler)
                .withSockJS();

        registry.setPreserveReceiveOrder(true);
    }

    /**
     * /queue → per-session event queue (server to client)
     * /app   → client commands handled by SyncSocketController
     * /user  → user/session destination prefix
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/queue")
                .setHeartbeatValue(new long[] { heartbeatMs, heartbeatMs })
                .setTaskScheduler(heartbeatScheduler);
        registry.setApplicationDestinationPrefixes(SyncDestinations.APP_PREFIX);
        registry.setUserDestinationPrefix(SyncDestinations.USER_PREFIX);
        registry.setPreservePublishOrder(true);
    }
}
