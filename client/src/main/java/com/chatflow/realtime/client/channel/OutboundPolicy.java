package com.chatflow.realtime.client.channel;

/** What {@link SessionChannel#send} does with a frame while the channel is not connected. */
public enum OutboundPolicy {
    /** Keep it in the outbox and flush it, in order, on the next connect. */
    QUEUE,
    /** Fail fast with {@link ChannelNotConnectedException}. */
    REJECT
}
