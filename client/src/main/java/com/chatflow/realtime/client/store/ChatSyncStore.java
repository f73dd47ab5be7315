package com.chatflow.realtime.client.store;

import com.chatflow.realtime.client.ClientSettings;
import com.chatflow.realtime.client.api.ChatApi;
import com.chatflow.realtime.client.channel.SyncChannel;
import com.chatflow.realtime.client.typing.TypingTimers;
import com.chatflow.realtime.protocol.ContentRules;
import com.chatflow.realtime.protocol.DeliveryStatus;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;
import com.chatflow.realtime.protocol.event.MemberPayload;
import com.chatflow.realtime.protocol.event.MessageUpdatePayload;
import com.chatflow.realtime.protocol.event.ReactionPayload;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Client-side source of truth for everything rendered: chat list, cached message
 * timelines, unread counters, typing indicators.
 *
 * <pre>
 *  REST completions ─┐
 *  channel events ───┼──► dispatch(action) ──► StateReducer ──► [StateInvariants] ──► listeners
 *  user operations ──┘        (serialized)
 * </pre>
 *
 * Operations that need the network first read what they need under the store lock,
 * issue the call, and dispatch an action when the call completes. A slow backfill
 * therefore never blocks live events; both land through the same serialized step and
 * merge by identity and sequence.
 *
 * Queries return copies; callers cannot mutate store state.
 */
@Slf4j
public class ChatSyncStore {

    public static final String LOCAL_ID_PREFIX = "local-";

    private final ChatApi api;
    private final SyncChannel channel;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final Duration typingTtl;
    private final int pageSize;
    private final boolean invariantChecks;

    private final StoreState state;
    private final StateReducer reducer = new StateReducer();
    private final List<StoreListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledFuture<?> typingSweep;

    public ChatSyncStore(ChatApi api,
                         SyncChannel channel,
                         String currentUserId,
                         ScheduledExecutorService scheduler,
                         Clock clock,
                         ClientSettings settings) {
        this.api = api;
        this.channel = channel;
        this.scheduler = scheduler;
        this.clock = clock;
        this.typingTtl = settings.getTypingTtl();
        this.pageSize = settings.getPageSize();
        this.invariantChecks = settings.isInvariantChecks();
        this.state = new StoreState(currentUserId);
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Starts the typing expiry sweep. */
    public synchronized void start() {
        if (typingSweep != null) {
            return;
        }
        long periodMs = Math.max(100L, typingTtl.toMillis() / 6);
        typingSweep = scheduler.scheduleAtFixedRate(this::expireTyping, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void close() {
        if (typingSweep != null) {
            typingSweep.cancel(false);
            typingSweep = null;
        }
    }

    public void addListener(StoreListener listener) {
        listeners.add(listener);
    }

    /**
     * Applies one action. Transitions are serialized; listeners run on the calling
     * thread after the transition.
     */
    public synchronized void dispatch(StoreAction action) {
        reducer.apply(state, action);
        if (invariantChecks) {
            StateInvariants.check(state);
        }
        for (StoreListener listener : listeners) {
            try {
                listener.stateChanged(action);
            } catch (RuntimeException e) {
                log.error("Store listener failed on {}", action.type(), e);
            }
        }
    }

    // ── Chats ─────────────────────────────────────────────────────────────

    /** Replaces the chat list and subscribes the channel to every listed chat. */
    public CompletableFuture<Void> loadChats() {
        return api.getChats()
                .thenAccept(chats -> {
                    dispatch(new StoreActions.ChatsLoaded(chats));
                    chats.forEach(chat -> channel.subscribe(chat.getId()));
                    log.debug("Loaded {} chats, total unread {}", chats.size(), totalUnread());
                })
                .exceptionally(e -> {
                    log.warn("Loading chats failed: {}", e.getMessage());
                    return null;
                });
    }

    /**
     * Makes the chat active and zeroes its unread count. Loads the first page only when
     * nothing is cached yet; the server-side mark-read is best effort.
     */
    public CompletableFuture<Void> selectChat(String chatId) {
        boolean needsPage;
        synchronized (this) {
            if (!state.getChats().containsKey(chatId)) {
                log.debug("selectChat: unknown chatId={}", chatId);
                return CompletableFuture.completedFuture(null);
            }
            dispatch(new StoreActions.ChatSelected(chatId));
            needsPage = !state.getLoadedChats().contains(chatId);
        }
        channel.subscribe(chatId);
        api.markRead(chatId).exceptionally(e -> {
            log.warn("Mark read failed for chatId={}: {}", chatId, e.getMessage());
            return null;
        });
        return needsPage ? loadMessages(chatId, false) : CompletableFuture.completedFuture(null);
    }

    /** Clears the selection. The chat stays subscribed so its unread count stays live. */
    public void clearActiveChat() {
        dispatch(new StoreActions.ActiveChatCleared());
    }

    public void onChatAdded(ChatSummaryDto chat) {
        dispatch(new StoreActions.ChatAdded(chat));
        channel.subscribe(chat.getId());
    }

    public void onChatRenamed(String chatId, String name) {
        dispatch(new StoreActions.ChatRenamed(chatId, name));
    }

    public void onChatRemoved(String chatId) {
        dispatch(new StoreActions.ChatRemoved(chatId));
        channel.unsubscribe(chatId);
    }

    public void onMembershipChanged(MemberPayload member, boolean joined) {
        dispatch(new StoreActions.MembershipChanged(member.getChatId(), member.getUserId(), joined, member.getMemberCount()));
        if (!joined && state.getCurrentUserId().equals(member.getUserId())) {
            channel.unsubscribe(member.getChatId());
        }
    }

    public void updateOnlineStatus(String userId, boolean online) {
        dispatch(new StoreActions.PresenceChanged(userId, online));
    }

    // ── History ───────────────────────────────────────────────────────────

    /**
     * @param loadMore {@code true} to prepend the page older than the oldest cached
     *                 message; {@code false} to (re)load the newest page
     */
    public CompletableFuture<Void> loadMessages(String chatId, boolean loadMore) {
        String cursor = null;
        StoreActions.PageMode mode = StoreActions.PageMode.REPLACE;
        synchronized (this) {
            if (loadMore) {
                if (!state.getHasMore().getOrDefault(chatId, true)) {
                    return CompletableFuture.completedFuture(null);
                }
                ChatTimeline timeline = state.getTimelines().get(chatId);
                cursor = timeline == null ? null : timeline.oldestId();
                if (cursor != null) {
                    mode = StoreActions.PageMode.PREPEND;
                }
            }
        }
        return fetchPage(chatId, cursor, mode);
    }

    /**
     * Merges the newest history into the cache; used to close sequence gaps. Keeps paging
     * backwards until a page reaches the newest message cached before the call, so a gap
     * wider than one page is filled completely. With nothing cached the newest page
     * replaces the timeline.
     */
    public CompletableFuture<Void> backfillLatest(String chatId) {
        Long anchor;
        synchronized (this) {
            ChatTimeline timeline = state.getTimelines().get(chatId);
            anchor = timeline == null || timeline.sequenced().isEmpty() ? null : timeline.sequenced().lastKey();
        }
        if (anchor == null) {
            return fetchPage(chatId, null, StoreActions.PageMode.REPLACE);
        }
        return backfillDownTo(chatId, null, anchor);
    }

    private CompletableFuture<Void> backfillDownTo(String chatId, String cursor, long anchor) {
        return api.getMessages(chatId, cursor, pageSize)
                .thenCompose(page -> {
                    dispatch(new StoreActions.PageLoaded(chatId, page, StoreActions.PageMode.MERGE));
                    String next = gapCursor(page, anchor);
                    if (next == null) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    log.debug("Backfill of chatId={} continues before {} towards sequence {}", chatId, next, anchor);
                    return backfillDownTo(chatId, next, anchor);
                })
                .exceptionally(e -> {
                    log.warn("Backfill failed for chatId={} cursor={}: {}", chatId, cursor, e.getMessage());
                    return null;
                });
    }

    /** Cursor for the next older page while {@code page} has not reached {@code anchor}, else null. */
    private static String gapCursor(MessagePage page, long anchor) {
        if (!page.isHasMore() || page.getMessages().isEmpty()) {
            return null;
        }
        MessageDto oldest = page.getMessages().get(0);
        if (oldest.getSequence() == null || oldest.getSequence() <= anchor) {
            return null;
        }
        return oldest.getId();
    }

    /**
     * Records a sequenced room event and backfills when it skips ahead of the watermark.
     *
     * @return true if a gap was detected
     */
    public boolean observeSequence(String chatId, long sequence) {
        boolean gap;
        synchronized (this) {
            Long watermark = state.getWatermarks().get(chatId);
            gap = watermark != null && state.getLoadedChats().contains(chatId) && sequence > watermark + 1;
            dispatch(new StoreActions.SequenceObserved(chatId, sequence));
        }
        if (gap) {
            log.info("Sequence gap in chatId={} at {}, backfilling", chatId, sequence);
            backfillLatest(chatId);
        }
        return gap;
    }

    /** Reloads the chat list and merges the newest page of every cached chat. */
    public CompletableFuture<Void> resyncAfterReconnect() {
        List<String> cached;
        synchronized (this) {
            cached = new ArrayList<>(state.getLoadedChats());
        }
        log.info("Resynchronizing {} cached chats after reconnect", cached.size());
        List<CompletableFuture<Void>> calls = new ArrayList<>();
        calls.add(loadChats());
        cached.forEach(chatId -> calls.add(backfillLatest(chatId)));
        return CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<Void> fetchPage(String chatId, String cursor, StoreActions.PageMode mode) {
        return api.getMessages(chatId, cursor, pageSize)
                .thenAccept(page -> dispatch(new StoreActions.PageLoaded(chatId, page, mode)))
                .exceptionally(e -> {
                    log.warn("Loading messages failed for chatId={} cursor={}: {}", chatId, cursor, e.getMessage());
                    return null;
                });
    }

    // ── Sending ───────────────────────────────────────────────────────────

    /** Sends to the active chat. */
    public String sendMessage(String content, String replyToId) {
        String chatId = activeChatId()
                .orElseThrow(() -> new IllegalStateException("No active chat"));
        return sendMessage(chatId, content, replyToId);
    }

    /**
     * Appends an optimistic {@code sending} copy and sends it. The copy is replaced by
     * the canonical message on acknowledgment, or marked {@code failed}.
     *
     * @return local identity of the optimistic copy
     * @throws com.chatflow.realtime.protocol.MessageValidationException for empty or
     *                                                                   over-long content
     */
    public String sendMessage(String chatId, String content, String replyToId) {
        String trimmed = ContentRules.requireValidContent(content);
        if (chat(chatId).isEmpty()) {
            throw new IllegalArgumentException("Unknown chat: " + chatId);
        }
        String clientMessageId = UUID.randomUUID().toString();
        MessageDto local = MessageDto.builder()
                .id(LOCAL_ID_PREFIX + clientMessageId)
                .clientMessageId(clientMessageId)
                .chatId(chatId)
                .senderId(state.getCurrentUserId())
                .content(trimmed)
                .replyToId(replyToId)
                .status(DeliveryStatus.SENDING)
                .createdAt(Instant.now(clock))
                .build();
        dispatch(new StoreActions.LocalMessageAdded(local));
        attemptSend(local.getId(), toRequest(local));
        return local.getId();
    }

    /**
     * Resends a {@code failed} message as a new attempt on the same local entry.
     *
     * @return false if the entry is unknown or not failed
     */
    public boolean retryMessage(String localId) {
        SendMessageRequest request;
        synchronized (this) {
            MessageDto local = state.getMessages().get(localId);
            if (local == null || local.getStatus() != DeliveryStatus.FAILED) {
                log.debug("Retry of {} ignored", localId);
                return false;
            }
            dispatch(new StoreActions.RetryStarted(localId));
            request = toRequest(local);
        }
        attemptSend(localId, request);
        return true;
    }

    private void attemptSend(String localId, SendMessageRequest request) {
        CompletableFuture<MessageDto> call;
        try {
            call = api.sendMessage(request);
        } catch (RuntimeException e) {
            dispatch(new StoreActions.SendFailed(localId, e.getMessage()));
            return;
        }
        call.handle((message, error) -> {
            if (error != null) {
                dispatch(new StoreActions.SendFailed(localId, error.getMessage()));
            } else {
                dispatch(new StoreActions.SendAcknowledged(localId, message));
            }
            return null;
        });
    }

    private static SendMessageRequest toRequest(MessageDto local) {
        return SendMessageRequest.builder()
                .chatId(local.getChatId())
                .content(local.getContent())
                .replyToId(local.getReplyToId())
                .clientMessageId(local.getClientMessageId())
                .build();
    }

    // ── Live events ───────────────────────────────────────────────────────

    public void addNewMessage(MessageDto message) {
        dispatch(new StoreActions.MessageReceived(message));
    }

    public void updateMessage(MessageUpdatePayload patch) {
        dispatch(new StoreActions.MessageUpdated(patch));
    }

    public void deleteMessage(String chatId, String messageId) {
        dispatch(new StoreActions.MessageDeleted(chatId, messageId));
    }

    public void applyReaction(ReactionPayload reaction) {
        dispatch(new StoreActions.ReactionApplied(reaction));
    }

    public void applyReadReceipt(ReadReceiptPayload receipt) {
        dispatch(new StoreActions.ReadReceiptApplied(receipt));
    }

    public void setTyping(String chatId, String userId, boolean typing) {
        dispatch(new StoreActions.TypingSet(chatId, userId, typing, Instant.now(clock).plus(typingTtl)));
    }

    public void expireTyping() {
        dispatch(new StoreActions.TypingExpired(Instant.now(clock)));
    }

    // ── Queries ───────────────────────────────────────────────────────────

    /** Messages of a chat: canonical by ascending sequence, then pending sends. */
    public synchronized List<MessageDto> messages(String chatId) {
        ChatTimeline timeline = state.getTimelines().get(chatId);
        if (timeline == null) {
            return Collections.emptyList();
        }
        return timeline.orderedIds().stream()
                .map(id -> copy(state.getMessages().get(id)))
                .collect(Collectors.toList());
    }

    public synchronized Optional<MessageDto> message(String messageId) {
        return Optional.ofNullable(state.getMessages().get(messageId)).map(ChatSyncStore::copy);
    }

    public synchronized List<ChatSummaryDto> chats() {
        return state.getChats().values().stream()
                .map(c -> c.toBuilder().build())
                .collect(Collectors.toList());
    }

    public synchronized Optional<ChatSummaryDto> chat(String chatId) {
        return Optional.ofNullable(state.getChats().get(chatId)).map(c -> c.toBuilder().build());
    }

    public synchronized Optional<String> activeChatId() {
        return Optional.ofNullable(state.getActiveChatId());
    }

    public synchronized int totalUnread() {
        return state.getTotalUnread();
    }

    public synchronized boolean hasMoreMessages(String chatId) {
        return state.getHasMore().getOrDefault(chatId, true);
    }

    public synchronized Set<String> typingUsers(String chatId) {
        TypingTimers<String> timers = state.getTyping().get(chatId);
        return timers == null ? Collections.emptySet() : new TreeSet<>(timers.activeKeys());
    }

    public synchronized Optional<Long> watermark(String chatId) {
        return Optional.ofNullable(state.getWatermarks().get(chatId));
    }

    private static MessageDto copy(MessageDto message) {
        return message.toBuilder()
                .reactions(message.getReactions().stream()
                        .map(r -> r.toBuilder().userIds(new ArrayList<>(r.getUserIds())).build())
                        .collect(Collectors.toList()))
                .attachments(new ArrayList<>(message.getAttachments()))
                .build();
    }

    public String currentUserId() {
        return state.getCurrentUserId();
    }
}
