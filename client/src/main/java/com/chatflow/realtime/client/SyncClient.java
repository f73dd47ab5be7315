package com.chatflow.realtime.client;

import com.chatflow.realtime.client.api.ChatApi;
import com.chatflow.realtime.client.api.RestChatApi;
import com.chatflow.realtime.client.channel.ChannelState;
import com.chatflow.realtime.client.channel.ChannelStateChange;
import com.chatflow.realtime.client.channel.ChannelTransport;
import com.chatflow.realtime.client.channel.SessionChannel;
import com.chatflow.realtime.client.channel.StompChannelTransport;
import com.chatflow.realtime.client.dispatch.ClientEventDispatcher;
import com.chatflow.realtime.client.store.ChatSyncStore;
import com.chatflow.realtime.client.store.StoreEventBinder;
import com.chatflow.realtime.client.typing.LocalTypingNotifier;
import com.chatflow.realtime.protocol.ProtocolMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Entry point of the client library: one session channel, one dispatcher, one store.
 *
 * <pre>
 *  SessionChannel ──(event thread)──► ClientEventDispatcher ──► StoreEventBinder ──► ChatSyncStore
 *        ▲                                                                              │
 *        └──────────── subscribe / typing / ping ◄──────────────────────────────────────┘
 *  RestChatApi ◄── history, sends, chat list
 * </pre>
 *
 * A reconnect triggers a resync: the chat list is reloaded and the newest page of every
 * cached chat is merged, so events missed while offline appear without duplicates.
 */
@Slf4j
public class SyncClient implements AutoCloseable {

    private final ClientSettings settings;
    private final ChannelTransport transport;
    private final SessionChannel channel;
    private final ClientEventDispatcher dispatcher;
    private final ChatSyncStore store;
    private final StoreEventBinder binder;
    private final LocalTypingNotifier typing;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService ownedEventExecutor;

    private volatile String token;

    /** Production wiring: STOMP transport and WebClient REST calls against {@code settings.serverUrl}. */
    public SyncClient(ClientSettings settings, String currentUserId) {
        this.settings = settings;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("chatflow-timer-"));
        this.ownedEventExecutor = Executors.newSingleThreadExecutor(daemonThreads("chatflow-events-"));
        this.transport = new StompChannelTransport(settings.webSocketUrl(), settings.getHeartbeatInterval());
        ChatApi api = new RestChatApi(WebClient.builder(), settings.getServerUrl(), () -> token);
        this.channel = new SessionChannel(transport, scheduler, ownedEventExecutor, Clock.systemUTC(), settings);
        this.dispatcher = new ClientEventDispatcher();
        this.store = new ChatSyncStore(api, channel, currentUserId, scheduler, Clock.systemUTC(), settings);
        this.binder = new StoreEventBinder(store, ProtocolMapper.create());
        this.typing = new LocalTypingNotifier(channel, scheduler, Clock.systemUTC(), settings);
        wire();
    }

    SyncClient(ClientSettings settings,
               String currentUserId,
               ChannelTransport transport,
               ChatApi api,
               ScheduledExecutorService scheduler,
               Executor eventExecutor,
               Clock clock) {
        this.settings = settings;
        this.scheduler = scheduler;
        this.ownedEventExecutor = null;
        this.transport = transport;
        this.channel = new SessionChannel(transport, scheduler, eventExecutor, clock, settings);
        this.dispatcher = new ClientEventDispatcher();
        this.store = new ChatSyncStore(api, channel, currentUserId, scheduler, clock, settings);
        this.binder = new StoreEventBinder(store, ProtocolMapper.create());
        this.typing = new LocalTypingNotifier(channel, scheduler, clock, settings);
        wire();
    }

    private void wire() {
        binder.bind(dispatcher);
        channel.onEvent(dispatcher::dispatch);
        channel.addStateListener(this::onChannelState);
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Opens the session channel and loads the chat list.
     *
     * @return completes when the chat list has been loaded (or failed and was logged)
     */
    public CompletableFuture<Void> connect(String accessToken) {
        this.token = accessToken;
        store.start();
        typing.start();
        channel.connect(accessToken);
        return store.loadChats();
    }

    /** Closes the channel; cached state and queued sends are kept. */
    public void disconnect() {
        typing.shutdown();
        channel.disconnect();
    }

    @Override
    public void close() {
        disconnect();
        store.close();
        if (transport instanceof StompChannelTransport) {
            ((StompChannelTransport) transport).shutdown();
        }
        if (ownedEventExecutor != null) {
            ownedEventExecutor.shutdownNow();
            scheduler.shutdownNow();
        }
        log.info("Sync client closed");
    }

    private void onChannelState(ChannelStateChange change) {
        if (change.getCurrent() == ChannelState.CONNECTED && change.isReconnect()) {
            store.resyncAfterReconnect();
        } else if (change.getCurrent() == ChannelState.DISCONNECTED && change.getCause() != null) {
            log.error("Connection lost and not recoverable: {}", change.getCause().getMessage());
        }
    }

    // ── User operations ───────────────────────────────────────────────────

    /** Sends to the active chat and ends the local typing state there. */
    public String sendMessage(String content, String replyToId) {
        String localId = store.sendMessage(content, replyToId);
        store.activeChatId().ifPresent(typing::stop);
        return localId;
    }

    /** Reports a keystroke in the active chat's composer. */
    public void keystroke() {
        store.activeChatId().ifPresent(typing::keystroke);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public ChatSyncStore store() {
        return store;
    }

    public SessionChannel channel() {
        return channel;
    }

    public ClientEventDispatcher dispatcher() {
        return dispatcher;
    }

    public LocalTypingNotifier typing() {
        return typing;
    }

    public ClientSettings settings() {
        return settings;
    }
}
