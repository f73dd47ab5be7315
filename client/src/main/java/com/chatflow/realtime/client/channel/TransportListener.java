package com.chatflow.realtime.client.channel;

import com.chatflow.realtime.protocol.Envelope;

/** Callbacks from one opened transport. */
public interface TransportListener {

    void onEnvelope(Envelope envelope);

    /** The connection is gone; {@code cause} may be {@code null} for a clean close. */
    void onClosed(Throwable cause);
}
