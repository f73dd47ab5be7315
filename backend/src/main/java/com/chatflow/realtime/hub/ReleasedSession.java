package com.chatflow.realtime.hub;

import lombok.Value;

import java.util.Set;

/** Registry state released when a session is removed. */
@Value
public class ReleasedSession {
    String sessionId;
    String userId;
    Set<String> chatIds;
}
