package com.chatflow.realtime.controller;

import com.chatflow.realtime.hub.SubscriptionRegistry;
import com.chatflow.realtime.presence.PresenceTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SubscriptionRegistry registry;
    private final PresenceTracker presenceTracker;

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "UP",
                "sessions", registry.sessionCount(),
                "onlineUsers", presenceTracker.onlineUserCount());
    }
}
