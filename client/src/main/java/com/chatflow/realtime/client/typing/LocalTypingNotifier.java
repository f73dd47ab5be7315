package com.chatflow.realtime.client.typing;

import com.chatflow.realtime.client.ClientSettings;
import com.chatflow.realtime.client.channel.ChannelNotConnectedException;
import com.chatflow.realtime.client.channel.OutboundPolicy;
import com.chatflow.realtime.client.channel.SyncChannel;
import com.chatflow.realtime.protocol.SyncDestinations;
import com.chatflow.realtime.protocol.event.ChatCommand;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Outbound typing state of the local user, one state machine per chat.
 *
 * <pre>
 *  keystroke ──► Idle ──(send typing.start)──► TypingActive(expiresAt = now + idle)
 *  keystroke ──► TypingActive: expiry extended; typing.start repeated every refresh interval
 *  expiry / stop(chatId) ──► Idle (send typing.stop)
 * </pre>
 *
 * Typing frames are never queued: while the channel is down they are dropped and logged.
 */
@Slf4j
public class LocalTypingNotifier {

    private final SyncChannel channel;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration idleTimeout;
    private final Duration refreshInterval;

    private final TypingTimers<String> timers = new TypingTimers<>();
    private final Map<String, Instant> lastStartSent = new HashMap<>();
    private ScheduledFuture<?> checkTask;

    public LocalTypingNotifier(SyncChannel channel, ScheduledExecutorService scheduler, Clock clock,
                               ClientSettings settings) {
        this.channel = channel;
        this.scheduler = scheduler;
        this.clock = clock;
        this.idleTimeout = settings.getTypingIdleTimeout();
        this.refreshInterval = settings.getTypingRefreshInterval();
    }

    /** Starts the periodic expiry check. */
    public synchronized void start() {
        if (checkTask != null) {
            return;
        }
        long periodMs = Math.max(100L, idleTimeout.toMillis() / 4);
        checkTask = scheduler.scheduleAtFixedRate(this::checkExpired, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void keystroke(String chatId) {
        Instant now = Instant.now(clock);
        boolean entered = timers.activate(chatId, now.plus(idleTimeout));
        Instant last = lastStartSent.get(chatId);
        if (entered || last == null || !now.isBefore(last.plus(refreshInterval))) {
            lastStartSent.put(chatId, now);
            sendTyping(SyncDestinations.TYPING_START, chatId);
        }
    }

    /** Ends typing immediately, e.g. after the message was sent. */
    public synchronized void stop(String chatId) {
        lastStartSent.remove(chatId);
        if (timers.deactivate(chatId)) {
            sendTyping(SyncDestinations.TYPING_STOP, chatId);
        }
    }

    public synchronized void checkExpired() {
        for (String chatId : timers.expire(Instant.now(clock))) {
            lastStartSent.remove(chatId);
            sendTyping(SyncDestinations.TYPING_STOP, chatId);
        }
    }

    public synchronized boolean isTyping(String chatId) {
        return timers.isActive(chatId);
    }

    /** Stops the check task and ends typing in every chat. */
    public synchronized void shutdown() {
        if (checkTask != null) {
            checkTask.cancel(false);
            checkTask = null;
        }
        List<String> active = new ArrayList<>(timers.activeKeys());
        active.forEach(this::stop);
    }

    private void sendTyping(String command, String chatId) {
        try {
            channel.send(command, ChatCommand.forChat(chatId), OutboundPolicy.REJECT);
        } catch (ChannelNotConnectedException e) {
            log.debug("Dropped {} for chatId={}: {}", command, chatId, e.getMessage());
        }
    }
}
