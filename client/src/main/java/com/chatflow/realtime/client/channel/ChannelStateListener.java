package com.chatflow.realtime.client.channel;

@FunctionalInterface
public interface ChannelStateListener {

    void stateChanged(ChannelStateChange change);
}
