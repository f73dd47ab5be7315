package com.chatflow.realtime.typing;

import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.hub.RecordingSessionSink;
import com.chatflow.realtime.hub.SubscriptionRegistry;
import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.ProtocolMapper;
import com.chatflow.realtime.repository.MessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class TypingMirrorTest {

    private final MovableClock clock = new MovableClock(Instant.parse("2026-02-01T12:00:00Z"));
    private RecordingSessionSink sink;
    private TypingMirror mirror;

    @BeforeEach
    void setUp() {
        SubscriptionRegistry registry = new SubscriptionRegistry();
        sink = new RecordingSessionSink();
        FanoutHub hub = new FanoutHub(registry, sink, new MessageRepository(), ProtocolMapper.create(), clock);
        mirror = new TypingMirror(hub, clock, 6000);

        registry.registerSession("alice-1", "alice");
        registry.registerSession("bob-1", "bob");
        registry.subscribe("alice-1", "c1");
        registry.subscribe("bob-1", "c1");
    }

    @Test
    void startIsMirroredToOthersOnly() {
        mirror.start("c1", "alice", "Alice", "alice-1");

        assertThat(mirror.isTyping("c1", "alice")).isTrue();
        Envelope envelope = sink.to("bob-1", EventKind.TYPING_START).get(0);
        assertThat(envelope.getData().get("username").asText()).isEqualTo("Alice");
        assertThat(sink.to("alice-1")).isEmpty();
    }

    @Test
    void stopRemovesEntryAndStopForUnknownEntryIsSilent() {
        mirror.start("c1", "alice", "Alice", "alice-1");
        mirror.stop("c1", "alice");
        mirror.stop("c1", "alice");

        assertThat(mirror.isTyping("c1", "alice")).isFalse();
        assertThat(sink.to("bob-1", EventKind.TYPING_STOP)).hasSize(1);
    }

    @Test
    void expiredEntriesAreSweptWithStopBroadcast() {
        mirror.start("c1", "alice", "Alice", "alice-1");

        clock.advance(Duration.ofSeconds(5));
        mirror.sweepExpired();
        assertThat(mirror.isTyping("c1", "alice")).isTrue();

        clock.advance(Duration.ofSeconds(2));
        mirror.sweepExpired();
        assertThat(mirror.isTyping("c1", "alice")).isFalse();
        assertThat(sink.to("bob-1", EventKind.TYPING_STOP)).hasSize(1);
    }

    @Test
    void repeatedStartRefreshesExpiry() {
        mirror.start("c1", "alice", "Alice", "alice-1");
        clock.advance(Duration.ofSeconds(5));
        mirror.start("c1", "alice", "Alice", "alice-1");
        clock.advance(Duration.ofSeconds(5));

        mirror.sweepExpired();

        assertThat(mirror.isTyping("c1", "alice")).isTrue();
    }

    @Test
    void clearSessionStopsOnlyThatSessionsEntries() {
        mirror.start("c1", "alice", "Alice", "alice-1");
        mirror.start("c1", "bob", "Bob", "bob-1");

        assertThat(mirror.clearSession("alice-1")).isEqualTo(1);
        assertThat(mirror.clearSession("alice-1")).isZero();

        assertThat(mirror.isTyping("c1", "alice")).isFalse();
        assertThat(mirror.isTyping("c1", "bob")).isTrue();
        assertThat(sink.to("bob-1", EventKind.TYPING_STOP)).hasSize(1);
    }

    static final class MovableClock extends Clock {
        private Instant now;

        MovableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
