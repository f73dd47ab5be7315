package com.chatflow.realtime.client.store;

/** A request to change store state; see {@link StoreActions} for the concrete actions. */
public interface StoreAction {

    ActionType type();
}
