package com.chatflow.realtime.client.channel;

import lombok.Value;

/**
 * One state transition. {@code reconnect} is true when a CONNECTED state follows an
 * earlier connection, i.e. events may have been missed in between. {@code cause} is set
 * when the transition was caused by a failure.
 */
@Value
public class ChannelStateChange {
    ChannelState previous;
    ChannelState current;
    boolean reconnect;
    Throwable cause;
}
