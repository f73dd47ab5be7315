package com.chatflow.realtime.client.channel;

import com.chatflow.realtime.client.ClientSettings;
import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.SyncDestinations;
import com.chatflow.realtime.protocol.event.ChatCommand;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * One persistent duplex connection per client, modelled as an explicit state machine.
 *
 * <h3>Transitions</h3>
 * <ul>
 * <li>{@code connect}: DISCONNECTED → CONNECTING; the transport is opened.</li>
 * <li>open succeeded: → CONNECTED. Every active chat is subscribed again, then the
 * outbox is flushed in FIFO order, then the heartbeat starts.</li>
 * <li>open failed, transport closed or heartbeat timeout: → RECONNECTING, next attempt
 * after the backoff delay. Once {@link ReconnectPolicy#getMaxAttempts()} is exceeded:
 * → DISCONNECTED with the failure as cause.</li>
 * <li>{@code disconnect}: → DISCONNECTED, no further reconnects. Active chats and the
 * outbox are kept for the next {@code connect}.</li>
 * </ul>
 *
 * Each transport attempt gets an epoch number; callbacks carrying an older epoch come
 * from a superseded connection and are ignored.
 *
 * State listeners are notified outside the channel lock, so they may call back into
 * the channel. Inbound events are handed to the event handlers on {@code eventExecutor},
 * which must be single-threaded to keep arrival order.
 */
@Slf4j
public class SessionChannel implements SyncChannel {

    private final ChannelTransport transport;
    private final ScheduledExecutorService scheduler;
    private final Executor eventExecutor;
    private final Clock clock;
    private final ReconnectPolicy reconnectPolicy;
    private final Duration heartbeatInterval;
    private final Duration heartbeatTimeout;
    private final int outboxCapacity;

    private final List<Consumer<Envelope>> eventHandlers = new CopyOnWriteArrayList<>();
    private final List<ChannelStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();

    // ── guarded by lock ──
    private ChannelState state = ChannelState.DISCONNECTED;
    private String token;
    private long epoch;
    private int reconnectAttempts;
    private boolean everConnected;
    private boolean manualDisconnect;
    private Instant lastInbound;
    private ScheduledFuture<?> heartbeatTask;
    private ScheduledFuture<?> reconnectTask;
    private final Set<String> activeChats = new LinkedHashSet<>();
    private final Deque<OutboundFrame> outbox = new ArrayDeque<>();

    public SessionChannel(ChannelTransport transport,
                          ScheduledExecutorService scheduler,
                          Executor eventExecutor,
                          Clock clock,
                          ClientSettings settings) {
        this.transport = transport;
        this.scheduler = scheduler;
        this.eventExecutor = eventExecutor;
        this.clock = clock;
        this.reconnectPolicy = settings.getReconnectPolicy();
        this.heartbeatInterval = settings.getHeartbeatInterval();
        this.heartbeatTimeout = settings.getHeartbeatTimeout();
        this.outboxCapacity = settings.getOutboxCapacity();
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Opens the channel. Ignored unless the channel is DISCONNECTED. */
    public void connect(String token) {
        List<ChannelStateChange> changes = new ArrayList<>();
        long attemptEpoch;
        synchronized (lock) {
            if (state != ChannelState.DISCONNECTED) {
                log.debug("connect() ignored in state {}", state);
                return;
            }
            this.token = token;
            this.manualDisconnect = false;
            this.reconnectAttempts = 0;
            transition(ChannelState.CONNECTING, false, null, changes);
            attemptEpoch = ++epoch;
        }
        fire(changes);
        open(attemptEpoch, token);
    }

    /** Closes the channel and suppresses reconnects. */
    public void disconnect() {
        List<ChannelStateChange> changes = new ArrayList<>();
        synchronized (lock) {
            manualDisconnect = true;
            epoch++;
            cancelTimers();
            if (state == ChannelState.DISCONNECTED) {
                return;
            }
            transition(ChannelState.DISCONNECTED, false, null, changes);
        }
        transport.close();
        fire(changes);
        log.info("Session channel disconnected by client");
    }

    @Override
    public ChannelState state() {
        synchronized (lock) {
            return state;
        }
    }

    // ── Subscriptions ─────────────────────────────────────────────────────

    @Override
    public void subscribe(String chatId) {
        synchronized (lock) {
            if (!activeChats.add(chatId) || state != ChannelState.CONNECTED) {
                return;
            }
            sendQuietly(SyncDestinations.SUBSCRIBE, ChatCommand.forChat(chatId));
        }
    }

    @Override
    public void unsubscribe(String chatId) {
        synchronized (lock) {
            if (!activeChats.remove(chatId) || state != ChannelState.CONNECTED) {
                return;
            }
            sendQuietly(SyncDestinations.UNSUBSCRIBE, ChatCommand.forChat(chatId));
        }
    }

    public Set<String> activeChats() {
        synchronized (lock) {
            return Set.copyOf(activeChats);
        }
    }

    // ── Outbound ──────────────────────────────────────────────────────────

    @Override
    public void send(String command, Object payload, OutboundPolicy policy) {
        synchronized (lock) {
            if (state == ChannelState.CONNECTED) {
                try {
                    transport.send(command, payload);
                    return;
                } catch (RuntimeException e) {
                    log.warn("Send of {} failed on an open channel: {}", command, e.getMessage());
                    if (policy == OutboundPolicy.REJECT) {
                        throw new ChannelNotConnectedException("Send failed: " + command, e);
                    }
                }
            } else if (policy == OutboundPolicy.REJECT) {
                throw new ChannelNotConnectedException("Channel is " + state + "; " + command + " rejected");
            }
            if (outbox.size() >= outboxCapacity) {
                throw new ChannelNotConnectedException("Outbox full (" + outboxCapacity + "); " + command + " rejected");
            }
            outbox.addLast(new OutboundFrame(command, payload));
            log.debug("Queued {} (outbox size {})", command, outbox.size());
        }
    }

    public int outboxSize() {
        synchronized (lock) {
            return outbox.size();
        }
    }

    // ── Listeners ─────────────────────────────────────────────────────────

    /** @return action that removes the handler */
    public Runnable onEvent(Consumer<Envelope> handler) {
        eventHandlers.add(handler);
        return () -> eventHandlers.remove(handler);
    }

    public void addStateListener(ChannelStateListener listener) {
        stateListeners.add(listener);
    }

    // ── Transport callbacks ───────────────────────────────────────────────

    private void open(long attemptEpoch, String token) {
        transport.open(token, new EpochListener(attemptEpoch))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        onOpenFailed(attemptEpoch, error);
                    } else {
                        onOpened(attemptEpoch);
                    }
                });
    }

    private void onOpened(long attemptEpoch) {
        List<ChannelStateChange> changes = new ArrayList<>();
        synchronized (lock) {
            if (attemptEpoch != epoch || manualDisconnect) {
                log.debug("Ignoring open of superseded attempt epoch={}", attemptEpoch);
                return;
            }
            boolean reconnect = everConnected;
            everConnected = true;
            reconnectAttempts = 0;
            lastInbound = Instant.now(clock);
            transition(ChannelState.CONNECTED, reconnect, null, changes);

            for (String chatId : activeChats) {
                sendQuietly(SyncDestinations.SUBSCRIBE, ChatCommand.forChat(chatId));
            }
            flushOutbox();
            startHeartbeat(attemptEpoch);
            log.info("Session channel connected (reconnect={}, chats={})", reconnect, activeChats.size());
        }
        fire(changes);
    }

    private void onOpenFailed(long attemptEpoch, Throwable error) {
        List<ChannelStateChange> changes = new ArrayList<>();
        synchronized (lock) {
            if (attemptEpoch != epoch || manualDisconnect) {
                return;
            }
            log.warn("Connect attempt failed: {}", error.getMessage());
            scheduleReconnect(error, changes);
        }
        fire(changes);
    }

    private void onTransportClosed(long attemptEpoch, Throwable cause) {
        List<ChannelStateChange> changes = new ArrayList<>();
        synchronized (lock) {
            if (attemptEpoch != epoch || manualDisconnect) {
                return;
            }
            log.warn("Transport closed: {}", cause == null ? "clean close" : cause.getMessage());
            cancelTimers();
            epoch++;
            scheduleReconnect(cause, changes);
        }
        fire(changes);
    }

    private void onInbound(long attemptEpoch, Envelope envelope) {
        synchronized (lock) {
            if (attemptEpoch != epoch) {
                return;
            }
            lastInbound = Instant.now(clock);
        }
        if (envelope.getEvent() == EventKind.PONG || envelope.getEvent() == EventKind.PING) {
            return;
        }
        eventExecutor.execute(() -> {
            for (Consumer<Envelope> handler : eventHandlers) {
                try {
                    handler.accept(envelope);
                } catch (RuntimeException e) {
                    log.error("Event handler failed for {}", envelope.getEvent(), e);
                }
            }
        });
    }

    // ── Heartbeat / reconnect (called with lock held) ─────────────────────

    private void startHeartbeat(long attemptEpoch) {
        long periodMs = heartbeatInterval.toMillis();
        heartbeatTask = scheduler.scheduleAtFixedRate(
                () -> heartbeatTick(attemptEpoch), periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    void heartbeatTick(long attemptEpoch) {
        List<ChannelStateChange> changes = new ArrayList<>();
        boolean timedOut = false;
        synchronized (lock) {
            if (attemptEpoch != epoch || state != ChannelState.CONNECTED) {
                return;
            }
            Duration silence = Duration.between(lastInbound, Instant.now(clock));
            if (silence.compareTo(heartbeatTimeout) > 0) {
                log.warn("No inbound frame for {} ms, reconnecting", silence.toMillis());
                cancelTimers();
                epoch++;
                timedOut = true;
                scheduleReconnect(new TimeoutException("Heartbeat timeout after " + silence.toMillis() + " ms"), changes);
            } else {
                sendQuietly(SyncDestinations.PING, new ChatCommand());
            }
        }
        if (timedOut) {
            transport.close();
        }
        fire(changes);
    }

    private void scheduleReconnect(Throwable cause, List<ChannelStateChange> changes) {
        reconnectAttempts++;
        if (reconnectPolicy.isExhausted(reconnectAttempts)) {
            log.error("Giving up after {} reconnect attempts", reconnectAttempts - 1);
            transition(ChannelState.DISCONNECTED, false, cause, changes);
            return;
        }
        transition(ChannelState.RECONNECTING, false, cause, changes);
        long delayMs = reconnectPolicy.computeDelayMs(reconnectAttempts);
        log.info("Reconnect attempt {} in {} ms", reconnectAttempts, delayMs);
        reconnectTask = scheduler.schedule(this::reconnectNow, delayMs, TimeUnit.MILLISECONDS);
    }

    private void reconnectNow() {
        long attemptEpoch;
        String currentToken;
        synchronized (lock) {
            if (manualDisconnect || state != ChannelState.RECONNECTING) {
                return;
            }
            attemptEpoch = ++epoch;
            currentToken = token;
        }
        open(attemptEpoch, currentToken);
    }

    private void flushOutbox() {
        while (!outbox.isEmpty()) {
            OutboundFrame frame = outbox.peekFirst();
            try {
                transport.send(frame.command, frame.payload);
                outbox.removeFirst();
            } catch (RuntimeException e) {
                log.warn("Outbox flush stopped at {}: {}", frame.command, e.getMessage());
                return;
            }
        }
    }

    private void sendQuietly(String command, Object payload) {
        try {
            transport.send(command, payload);
        } catch (RuntimeException e) {
            log.warn("Send of {} failed: {}", command, e.getMessage());
        }
    }

    private void cancelTimers() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void transition(ChannelState next, boolean reconnect, Throwable cause, List<ChannelStateChange> changes) {
        if (state == next) {
            return;
        }
        ChannelState previous = state;
        state = next;
        changes.add(new ChannelStateChange(previous, next, reconnect, cause));
    }

    private void fire(List<ChannelStateChange> changes) {
        for (ChannelStateChange change : changes) {
            log.debug("Channel {} → {}", change.getPrevious(), change.getCurrent());
            for (ChannelStateListener listener : stateListeners) {
                try {
                    listener.stateChanged(change);
                } catch (RuntimeException e) {
                    log.error("Channel state listener failed", e);
                }
            }
        }
    }

    private static final class OutboundFrame {
        private final String command;
        private final Object payload;

        private OutboundFrame(String command, Object payload) {
            this.command = command;
            this.payload = payload;
        }
    }

    private final class EpochListener implements TransportListener {
        private final long attemptEpoch;

        private EpochListener(long attemptEpoch) {
            this.attemptEpoch = attemptEpoch;
        }

        @Override
        public void onEnvelope(Envelope envelope) {
            onInbound(attemptEpoch, envelope);
        }

        @Override
        public void onClosed(Throwable cause) {
            onTransportClosed(attemptEpoch, cause);
        }
    }
}
