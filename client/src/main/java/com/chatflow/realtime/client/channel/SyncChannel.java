package com.chatflow.realtime.client.channel;

/** The part of the session channel the store and typing notifier talk to. */
public interface SyncChannel {

    ChannelState state();

    /** Marks the chat active; it is (re)subscribed on every connect until unsubscribed. */
    void subscribe(String chatId);

    void unsubscribe(String chatId);

    /**
     * @param command destination suffix under {@code /app}, see
     *                {@link com.chatflow.realtime.protocol.SyncDestinations}
     * @throws ChannelNotConnectedException if the frame can be neither sent nor queued
     */
    void send(String command, Object payload, OutboundPolicy policy);
}
