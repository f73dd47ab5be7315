package com.chatflow.realtime.hub;

import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.ProtocolMapper;
import com.chatflow.realtime.protocol.event.TypingPayload;
import com.chatflow.realtime.repository.MessageRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FanoutHubTest {

    private SubscriptionRegistry registry;
    private RecordingSessionSink sink;
    private MessageRepository messageRepository;
    private FanoutHub hub;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
        sink = new RecordingSessionSink();
        messageRepository = new MessageRepository();
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);
        hub = new FanoutHub(registry, sink, messageRepository, ProtocolMapper.create(), clock);

        registry.registerSession("s1", "alice");
        registry.registerSession("s2", "bob");
        registry.subscribe("s1", "c1");
        registry.subscribe("s2", "c1");
    }

    @Test
    void concurrentPublishesGetGaplessIncreasingSequences() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Long>>> results = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            results.add(pool.submit(() -> {
                start.await();
                List<Long> assigned = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    assigned.add(hub.publish("c1", EventKind.MESSAGE_NEW, Map.of("n", i)));
                }
                return assigned;
            }));
        }
        start.countDown();

        List<Long> all = new ArrayList<>();
        for (Future<List<Long>> result : results) {
            all.addAll(result.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();

        List<Long> expected = LongStream.rangeClosed(1, (long) threads * perThread).boxed()
                .collect(Collectors.toList());
        assertThat(all).containsExactlyInAnyOrderElementsOf(expected);

        List<Long> received = sink.to("s1").stream().map(Envelope::getSequence).collect(Collectors.toList());
        assertThat(received).containsExactlyElementsOf(expected);
        assertThat(messageRepository.lastSequence("c1")).isEqualTo(threads * perThread);
    }

    @Test
    void roomsAreSequencedIndependently() {
        registry.subscribe("s1", "c2");

        assertThat(hub.publish("c1", EventKind.MESSAGE_NEW, Map.of())).isEqualTo(1);
        assertThat(hub.publish("c2", EventKind.MESSAGE_NEW, Map.of())).isEqualTo(1);
        assertThat(hub.publish("c1", EventKind.MESSAGE_NEW, Map.of())).isEqualTo(2);

        assertThat(sink.to("s1")).extracting(Envelope::getChatId).containsExactly("c1", "c2", "c1");
    }

    @Test
    void counterIsSeededFromStorage() {
        messageRepository.recordSequence("c1", 41);

        assertThat(hub.publish("c1", EventKind.MESSAGE_NEW, Map.of())).isEqualTo(42);
        assertThat(hub.currentSequence("c1")).isEqualTo(42);
    }

    @Test
    void failingFactoryConsumesNoSequence() {
        assertThatThrownBy(() -> hub.publish("c1", EventKind.MESSAGE_UPDATE, seq -> {
            throw new IllegalStateException("rejected");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(sink.total()).isZero();
        assertThat(hub.publish("c1", EventKind.MESSAGE_NEW, Map.of())).isEqualTo(1);
    }

    @Test
    void envelopeCarriesPayloadSequenceAndTimestamp() {
        hub.publish("c1", EventKind.MESSAGE_NEW, seq -> Map.of("id", "m1", "sequence", seq));

        Envelope envelope = sink.to("s2").get(0);
        assertThat(envelope.getEvent()).isEqualTo(EventKind.MESSAGE_NEW);
        assertThat(envelope.getChatId()).isEqualTo("c1");
        assertThat(envelope.getSequence()).isEqualTo(1L);
        assertThat(envelope.getData().get("sequence").asLong()).isEqualTo(1L);
        assertThat(envelope.getTimestamp()).isEqualTo(Instant.parse("2026-01-01T10:00:00Z"));
    }

    @Test
    void unsubscribedSessionStopsReceiving() {
        hub.publish("c1", EventKind.MESSAGE_NEW, Map.of());
        registry.unsubscribe("s2", "c1");
        hub.publish("c1", EventKind.MESSAGE_NEW, Map.of());

        assertThat(sink.to("s1")).hasSize(2);
        assertThat(sink.to("s2")).hasSize(1);
    }

    @Test
    void deliveryFailureDoesNotAffectOtherSubscribers() {
        sink.failFor("s1");

        long seq = hub.publish("c1", EventKind.MESSAGE_NEW, Map.of());

        assertThat(seq).isEqualTo(1);
        assertThat(sink.to("s2")).hasSize(1);
        assertThat(hub.publish("c1", EventKind.MESSAGE_NEW, Map.of())).isEqualTo(2);
    }

    @Test
    void broadcastIsUnsequencedAndSkipsTheOriginatingUser() {
        registry.registerSession("s3", "alice");
        registry.subscribe("s3", "c1");

        hub.broadcast("c1", EventKind.TYPING_START,
                TypingPayload.builder().chatId("c1").userId("alice").build(), "alice");

        assertThat(sink.to("s1")).isEmpty();
        assertThat(sink.to("s3")).isEmpty();
        Envelope typing = sink.to("s2").get(0);
        assertThat(typing.getSequence()).isNull();
        assertThat(typing.isSequenced()).isFalse();
        assertThat(hub.currentSequence("c1")).isZero();
    }

    @Test
    void sendToUserReachesEveryDeviceEvenWithoutSubscription() {
        registry.registerSession("s3", "alice");

        hub.sendToUser("alice", EventKind.CHAT_NEW, "c9", Map.of("id", "c9"));

        assertThat(sink.to("s1", EventKind.CHAT_NEW)).hasSize(1);
        assertThat(sink.to("s3", EventKind.CHAT_NEW)).hasSize(1);
        assertThat(sink.to("s2")).isEmpty();
    }
}
