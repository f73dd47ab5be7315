package com.chatflow.realtime.client.dispatch;

import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

class ClientEventDispatcherTest {

    private final ClientEventDispatcher dispatcher = new ClientEventDispatcher();
    private final List<String> calls = new ArrayList<>();

    private static Envelope envelope(EventKind kind) {
        return Envelope.builder().event(kind).chatId("c1").build();
    }

    @Test
    void catchAllRunsFirstThenKindHandlersInRegistrationOrder() {
        dispatcher.on(EventKind.MESSAGE_NEW, e -> calls.add("first"));
        dispatcher.on(EventKind.MESSAGE_NEW, e -> calls.add("second"));
        dispatcher.onAny(e -> calls.add("any:" + e.getEvent()));
        dispatcher.on(EventKind.TYPING_START, e -> calls.add("typing"));

        dispatcher.dispatch(envelope(EventKind.MESSAGE_NEW));

        assertThat(calls).containsExactly("any:message.new", "first", "second");
    }

    @Test
    void throwingHandlerDoesNotPreventLaterHandlers() {
        dispatcher.on(EventKind.MESSAGE_DELETE, e -> {
            throw new IllegalArgumentException("bad payload");
        });
        dispatcher.on(EventKind.MESSAGE_DELETE, e -> calls.add("after"));

        dispatcher.dispatch(envelope(EventKind.MESSAGE_DELETE));

        assertThat(calls).containsExactly("after");
    }

    @Test
    void unregisteringDuringDispatchKeepsTheEventInFlight() {
        List<Runnable> removers = new ArrayList<>();
        removers.add(dispatcher.on(EventKind.CHAT_NEW, e -> {
            calls.add("a");
            removers.forEach(Runnable::run);
        }));
        removers.add(dispatcher.on(EventKind.CHAT_NEW, e -> calls.add("b")));

        dispatcher.dispatch(envelope(EventKind.CHAT_NEW));
        dispatcher.dispatch(envelope(EventKind.CHAT_NEW));

        assertThat(calls).containsExactly("a", "b");
        assertThat(dispatcher.handlerCount(EventKind.CHAT_NEW)).isZero();
    }

    @Test
    void sameHandlerRegisteredTwiceIsRemovedOncePerRegistration() {
        Consumer<Envelope> handler = e -> calls.add("h");
        Runnable firstRegistration = dispatcher.on(EventKind.USER_ONLINE, handler);
        dispatcher.on(EventKind.USER_ONLINE, handler);

        firstRegistration.run();
        dispatcher.dispatch(envelope(EventKind.USER_ONLINE));

        assertThat(calls).containsExactly("h");
    }

    @Test
    void unknownKindOnlyReachesCatchAll() {
        dispatcher.onAny(e -> calls.add("any"));
        dispatcher.on(EventKind.ERROR, e -> calls.add("error"));

        dispatcher.dispatch(Envelope.builder().event(null).build());

        assertThat(calls).containsExactly("any");
    }
}
