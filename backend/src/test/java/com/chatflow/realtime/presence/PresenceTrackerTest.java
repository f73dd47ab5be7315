package com.chatflow.realtime.presence;

import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.event.PresencePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

class PresenceTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:30:00Z");

    private PresenceNotifier notifier;
    private PresenceTracker tracker;

    @BeforeEach
    void setUp() {
        notifier = mock(PresenceNotifier.class);
        tracker = new PresenceTracker(notifier, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void firstSessionBringsUserOnline() {
        assertThat(tracker.onConnect("alice", "s1")).isTrue();

        assertThat(tracker.isOnline("alice")).isTrue();
        ArgumentCaptor<PresencePayload> payload = ArgumentCaptor.forClass(PresencePayload.class);
        verify(notifier).announce(eq(EventKind.USER_ONLINE), payload.capture());
        assertThat(payload.getValue().getUserId()).isEqualTo("alice");
        assertThat(payload.getValue().isOnline()).isTrue();
    }

    @Test
    void additionalDevicesDoNotAnnounceAgain() {
        tracker.onConnect("alice", "s1");
        assertThat(tracker.onConnect("alice", "s2")).isFalse();
        assertThat(tracker.onDisconnect("alice", "s1")).isFalse();

        assertThat(tracker.isOnline("alice")).isTrue();
        verify(notifier, times(1)).announce(eq(EventKind.USER_ONLINE), any());
        verify(notifier, never()).announce(eq(EventKind.USER_OFFLINE), any());
    }

    @Test
    void lastSessionLeavingTakesUserOfflineWithLastSeen() {
        tracker.onConnect("alice", "s1");
        tracker.onConnect("alice", "s2");
        tracker.onDisconnect("alice", "s1");

        assertThat(tracker.onDisconnect("alice", "s2")).isTrue();

        assertThat(tracker.isOnline("alice")).isFalse();
        assertThat(tracker.lastSeen("alice")).contains(NOW);
        ArgumentCaptor<PresencePayload> payload = ArgumentCaptor.forClass(PresencePayload.class);
        verify(notifier).announce(eq(EventKind.USER_OFFLINE), payload.capture());
        assertThat(payload.getValue().getStatus()).isEqualTo(PresencePayload.OFFLINE);
        assertThat(payload.getValue().getLastSeen()).isEqualTo(NOW);
    }

    @Test
    void repeatedConnectAndDisconnectOfSameSessionAreIdempotent() {
        tracker.onConnect("alice", "s1");
        tracker.onConnect("alice", "s1");
        tracker.onDisconnect("alice", "s1");
        tracker.onDisconnect("alice", "s1");
        tracker.onDisconnect("bob", "s9");

        verify(notifier, times(1)).announce(eq(EventKind.USER_ONLINE), any());
        verify(notifier, times(1)).announce(eq(EventKind.USER_OFFLINE), any());
        verifyNoMoreInteractions(notifier);
        assertThat(tracker.onlineUserCount()).isZero();
    }
}
