package com.chatflow.realtime.client.store;

/** Every transition the store knows. Each type has exactly one reducer function. */
public enum ActionType {

    // chats
    CHATS_LOADED,
    CHAT_SELECTED,
    ACTIVE_CHAT_CLEARED,
    CHAT_ADDED,
    CHAT_RENAMED,
    CHAT_REMOVED,
    MEMBERSHIP_CHANGED,
    PRESENCE_CHANGED,

    // messages
    PAGE_LOADED,
    LOCAL_MESSAGE_ADDED,
    SEND_ACKNOWLEDGED,
    SEND_FAILED,
    RETRY_STARTED,
    MESSAGE_RECEIVED,
    MESSAGE_UPDATED,
    MESSAGE_DELETED,
    REACTION_APPLIED,
    READ_RECEIPT_APPLIED,
    SEQUENCE_OBSERVED,

    // typing
    TYPING_SET,
    TYPING_EXPIRED
}
