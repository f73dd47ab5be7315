package com.chatflow.realtime.client.channel;

import java.util.concurrent.CompletableFuture;

/**
 * Duplex transport under the session channel. Implementations deliver inbound frames
 * and the close signal to the listener passed to {@link #open}.
 */
public interface ChannelTransport {

    /** Completes when the connection is established and the event queue is subscribed. */
    CompletableFuture<Void> open(String token, TransportListener listener);

    /**
     * @throws IllegalStateException if the transport is not open
     */
    void send(String command, Object payload);

    void close();
}
