package com.chatflow.realtime.client.store;

/** Notified after every applied store action, on the dispatching thread. */
public interface StoreListener {

    void stateChanged(StoreAction action);
}
