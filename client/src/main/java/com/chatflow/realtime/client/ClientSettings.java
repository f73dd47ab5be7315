package com.chatflow.realtime.client;

import com.chatflow.realtime.client.channel.ReconnectPolicy;
import com.chatflow.realtime.protocol.SyncDestinations;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Client configuration. Every field has a default, so
 * {@code ClientSettings.builder().serverUrl("https://chat.example.com").build()} is a
 * complete configuration.
 */
@Value
@Builder(toBuilder = true)
public class ClientSettings {

    /** HTTP base URL of the server; the WebSocket URL is derived from it. */
    @Builder.Default
    String serverUrl = "http://localhost:8080";

    // ── Session channel ───────────────────────────────────────────────────

    @Builder.Default
    Duration heartbeatInterval = Duration.ofSeconds(10);

    /** No inbound frame for this long forces a reconnect. */
    @Builder.Default
    Duration heartbeatTimeout = Duration.ofSeconds(30);

    @Builder.Default
    ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();

    @Builder.Default
    int outboxCapacity = 256;

    // ── Typing ────────────────────────────────────────────────────────────

    /** How long a remote typing indicator stays visible without a refresh. */
    @Builder.Default
    Duration typingTtl = Duration.ofSeconds(6);

    /** Local typing state ends this long after the last keystroke. */
    @Builder.Default
    Duration typingIdleTimeout = Duration.ofSeconds(3);

    /** While typing continues, {@code typing.start} is repeated at this interval. */
    @Builder.Default
    Duration typingRefreshInterval = Duration.ofSeconds(4);

    // ── Store ─────────────────────────────────────────────────────────────

    @Builder.Default
    int pageSize = 50;

    /** Verify store invariants after every transition. Meant for tests and debugging. */
    @Builder.Default
    boolean invariantChecks = false;

    public String webSocketUrl() {
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        if (base.startsWith("https://")) {
            base = "wss://" + base.substring("https://".length());
        } else if (base.startsWith("http://")) {
            base = "ws://" + base.substring("http://".length());
        }
        return base + SyncDestinations.ENDPOINT;
    }
}
