package com.chatflow.realtime.client.channel;

public class ChannelNotConnectedException extends RuntimeException {

    public ChannelNotConnectedException(String message) {
        super(message);
    }

    public ChannelNotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
