package com.chatflow.realtime.client.channel;

/**
 * <pre>
 *  DISCONNECTED ──connect──► CONNECTING ──open──► CONNECTED
 *        ▲                       │                   │ transport lost / heartbeat timeout
 *        │                       ▼                   ▼
 *        └──── attempts exhausted / disconnect ── RECONNECTING ──backoff──► (open again)
 * </pre>
 */
public enum ChannelState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING
}
