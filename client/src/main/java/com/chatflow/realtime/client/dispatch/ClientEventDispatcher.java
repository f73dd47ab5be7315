package com.chatflow.realtime.client.dispatch;

import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes inbound envelopes to handlers registered per event kind.
 *
 * <p>
 * Catch-all handlers run first, then the handlers for the envelope's kind, each group
 * in registration order. Dispatch is serialized, so handlers observe events in arrival
 * order. A failing handler is logged and does not stop the others. Handlers removed
 * during a dispatch still see the envelope being dispatched.
 */
@Slf4j
public class ClientEventDispatcher {

    private final Map<EventKind, List<Consumer<Envelope>>> handlers = new EnumMap<>(EventKind.class);
    private final List<Consumer<Envelope>> anyHandlers = new CopyOnWriteArrayList<>();

    public ClientEventDispatcher() {
        for (EventKind kind : EventKind.values()) {
            handlers.put(kind, new CopyOnWriteArrayList<>());
        }
    }

    /** @return action that removes exactly this registration */
    public Runnable on(EventKind kind, Consumer<Envelope> handler) {
        List<Consumer<Envelope>> list = handlers.get(kind);
        Registration registration = new Registration(handler);
        list.add(registration);
        return () -> list.remove(registration);
    }

    /** Registers a handler for every event kind. */
    public Runnable onAny(Consumer<Envelope> handler) {
        Registration registration = new Registration(handler);
        anyHandlers.add(registration);
        return () -> anyHandlers.remove(registration);
    }

    public synchronized void dispatch(Envelope envelope) {
        EventKind kind = envelope.getEvent();
        invoke(anyHandlers, envelope);
        if (kind == null) {
            log.debug("Ignoring envelope with unknown event kind (chat={})", envelope.getChatId());
            return;
        }
        invoke(handlers.get(kind), envelope);
    }

    public int handlerCount(EventKind kind) {
        return handlers.get(kind).size();
    }

    private void invoke(List<Consumer<Envelope>> targets, Envelope envelope) {
        for (Consumer<Envelope> handler : targets) {
            try {
                handler.accept(envelope);
            } catch (RuntimeException e) {
                log.error("Handler failed for {} (chat={})", envelope.getEvent(), envelope.getChatId(), e);
            }
        }
    }

    /** Identity wrapper so the same lambda can be registered twice and removed once. */
    private static final class Registration implements Consumer<Envelope> {
        private final Consumer<Envelope> delegate;

        private Registration(Consumer<Envelope> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void accept(Envelope envelope) {
            delegate.accept(envelope);
        }
    }
}
