package com.chatflow.realtime.hub;

import com.chatflow.realtime.protocol.Envelope;

/** Delivers one envelope to one connected session. */
public interface SessionSink {

    void deliver(String sessionId, Envelope envelope);
}
