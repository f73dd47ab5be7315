package com.chatflow.realtime.security;

import lombok.Value;

import java.security.Principal;

/**
 * Authenticated chat user, taken from the access token's subject and name claims.
 * Used both as the WebSocket session principal and as the REST authentication
 * principal.
 */
@Value
public class ChatPrincipal implements Principal {

    String userId;
    String displayName;

    @Override
    public String getName() {
        return userId;
    }
}
