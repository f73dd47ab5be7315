package com.chatflow.realtime.client.store;

import com.chatflow.realtime.client.typing.TypingTimers;
import com.chatflow.realtime.protocol.ChatKind;
import com.chatflow.realtime.protocol.DeliveryStatus;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.protocol.dto.MessagePreview;
import com.chatflow.realtime.protocol.dto.ReactionSummary;
import com.chatflow.realtime.protocol.event.MessageUpdatePayload;
import com.chatflow.realtime.protocol.event.ReactionPayload;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Transition functions of the store, one per {@link ActionType}.
 *
 * Every merge is keyed by message identity and room sequence, never by list position,
 * so transitions commute: a backfilled page and a live message may be applied in either
 * order with the same result. Identities that are unknown or tombstoned are ignored.
 */
@Slf4j
public class StateReducer {

    private final Map<ActionType, BiConsumer<StoreState, StoreAction>> transitions = new EnumMap<>(ActionType.class);

    public StateReducer() {
        register(ActionType.CHATS_LOADED, StoreActions.ChatsLoaded.class, this::chatsLoaded);
        register(ActionType.CHAT_SELECTED, StoreActions.ChatSelected.class, this::chatSelected);
        register(ActionType.ACTIVE_CHAT_CLEARED, StoreActions.ActiveChatCleared.class, (s, a) -> s.setActiveChatId(null));
        register(ActionType.CHAT_ADDED, StoreActions.ChatAdded.class, this::chatAdded);
        register(ActionType.CHAT_RENAMED, StoreActions.ChatRenamed.class, this::chatRenamed);
        register(ActionType.CHAT_REMOVED, StoreActions.ChatRemoved.class, (s, a) -> removeChat(s, a.getChatId()));
        register(ActionType.MEMBERSHIP_CHANGED, StoreActions.MembershipChanged.class, this::membershipChanged);
        register(ActionType.PRESENCE_CHANGED, StoreActions.PresenceChanged.class, this::presenceChanged);
        register(ActionType.PAGE_LOADED, StoreActions.PageLoaded.class, this::pageLoaded);
        register(ActionType.LOCAL_MESSAGE_ADDED, StoreActions.LocalMessageAdded.class, this::localMessageAdded);
        register(ActionType.SEND_ACKNOWLEDGED, StoreActions.SendAcknowledged.class, this::sendAcknowledged);
        register(ActionType.SEND_FAILED, StoreActions.SendFailed.class, this::sendFailed);
        register(ActionType.RETRY_STARTED, StoreActions.RetryStarted.class, this::retryStarted);
        register(ActionType.MESSAGE_RECEIVED, StoreActions.MessageReceived.class, this::messageReceived);
        register(ActionType.MESSAGE_UPDATED, StoreActions.MessageUpdated.class, this::messageUpdated);
        register(ActionType.MESSAGE_DELETED, StoreActions.MessageDeleted.class, this::messageDeleted);
        register(ActionType.REACTION_APPLIED, StoreActions.ReactionApplied.class, this::reactionApplied);
        register(ActionType.READ_RECEIPT_APPLIED, StoreActions.ReadReceiptApplied.class, this::readReceiptApplied);
        register(ActionType.SEQUENCE_OBSERVED, StoreActions.SequenceObserved.class,
                (s, a) -> raiseWatermark(s, a.getChatId(), a.getSequence()));
        register(ActionType.TYPING_SET, StoreActions.TypingSet.class, this::typingSet);
        register(ActionType.TYPING_EXPIRED, StoreActions.TypingExpired.class, this::typingExpired);

        for (ActionType type : ActionType.values()) {
            if (!transitions.containsKey(type)) {
                throw new IllegalStateException("No transition registered for " + type);
            }
        }
    }

    public void apply(StoreState state, StoreAction action) {
        transitions.get(action.type()).accept(state, action);
    }

    private <A extends StoreAction> void register(ActionType type, Class<A> actionClass, BiConsumer<StoreState, A> fn) {
        transitions.put(type, (state, action) -> fn.accept(state, actionClass.cast(action)));
    }

    // ── Chats ─────────────────────────────────────────────────────────────

    private void chatsLoaded(StoreState state, StoreActions.ChatsLoaded action) {
        Set<String> incoming = new HashSet<>();
        action.getChats().forEach(c -> incoming.add(c.getId()));
        for (String chatId : new ArrayList<>(state.getChats().keySet())) {
            if (!incoming.contains(chatId)) {
                removeChat(state, chatId);
            }
        }

        state.getChats().clear();
        for (ChatSummaryDto chat : action.getChats()) {
            ChatSummaryDto copy = chat.toBuilder().build();
            if (copy.getId().equals(state.getActiveChatId())) {
                copy.setUnreadCount(0);
            }
            state.getChats().put(copy.getId(), copy);
        }
        recomputeTotalUnread(state);
    }

    private void chatSelected(StoreState state, StoreActions.ChatSelected action) {
        ChatSummaryDto chat = state.getChats().get(action.getChatId());
        if (chat == null) {
            log.debug("Select of unknown chatId={} ignored", action.getChatId());
            return;
        }
        state.setActiveChatId(chat.getId());
        setUnread(state, chat, 0);
    }

    private void chatAdded(StoreState state, StoreActions.ChatAdded action) {
        ChatSummaryDto copy = action.getChat().toBuilder().build();
        if (copy.getId().equals(state.getActiveChatId())) {
            copy.setUnreadCount(0);
        }
        state.getChats().put(copy.getId(), copy);
        recomputeTotalUnread(state);
    }

    private void chatRenamed(StoreState state, StoreActions.ChatRenamed action) {
        ChatSummaryDto chat = state.getChats().get(action.getChatId());
        if (chat == null) {
            log.debug("Rename of unknown chatId={} ignored", action.getChatId());
            return;
        }
        chat.setName(action.getName());
    }

    private void membershipChanged(StoreState state, StoreActions.MembershipChanged action) {
        if (!action.isJoined() && state.getCurrentUserId().equals(action.getUserId())) {
            removeChat(state, action.getChatId());
            return;
        }
        ChatSummaryDto chat = state.getChats().get(action.getChatId());
        if (chat == null) {
            log.debug("Membership change for unknown chatId={} ignored", action.getChatId());
            return;
        }
        chat.setMemberCount(action.getMemberCount());
    }

    private void presenceChanged(StoreState state, StoreActions.PresenceChanged action) {
        for (ChatSummaryDto chat : state.getChats().values()) {
            if (chat.getKind() == ChatKind.PRIVATE && action.getUserId().equals(chat.getCounterpartId())) {
                chat.setOnline(action.isOnline());
            }
        }
    }

    private void removeChat(StoreState state, String chatId) {
        ChatSummaryDto removed = state.getChats().remove(chatId);
        ChatTimeline timeline = state.getTimelines().remove(chatId);
        if (timeline != null) {
            timeline.orderedIds().forEach(id -> state.getMessages().remove(id));
        }
        state.getLoadedChats().remove(chatId);
        state.getHasMore().remove(chatId);
        state.getWatermarks().remove(chatId);
        state.getTombstones().remove(chatId);
        state.getTyping().remove(chatId);
        if (chatId.equals(state.getActiveChatId())) {
            state.setActiveChatId(null);
        }
        if (removed != null) {
            state.setTotalUnread(state.getTotalUnread() - removed.getUnreadCount());
        }
    }

    // ── Pages ─────────────────────────────────────────────────────────────

    private void pageLoaded(StoreState state, StoreActions.PageLoaded action) {
        String chatId = action.getChatId();
        if (!state.getChats().containsKey(chatId)) {
            log.debug("Page for unknown chatId={} ignored", chatId);
            return;
        }
        MessagePage page = action.getPage();
        List<MessageDto> messages = page.getMessages() == null ? List.of() : page.getMessages();
        ChatTimeline timeline = state.timeline(chatId);

        long newestInPage = 0L;
        Set<String> pageIds = new HashSet<>();
        for (MessageDto message : messages) {
            pageIds.add(message.getId());
            if (message.getSequence() != null) {
                newestInPage = Math.max(newestInPage, message.getSequence());
            }
        }

        if (action.getMode() == StoreActions.PageMode.REPLACE) {
            // cached messages inside the page's range that the page lacks are stale
            Iterator<Map.Entry<Long, String>> it = timeline.sequenced().entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Long, String> entry = it.next();
                if (entry.getKey() <= newestInPage && !pageIds.contains(entry.getValue())) {
                    state.getMessages().remove(entry.getValue());
                    it.remove();
                }
            }
        }

        for (MessageDto message : messages) {
            insertCanonical(state, normalize(state, message.toBuilder().build()));
        }

        boolean firstPage = state.getLoadedChats().add(chatId);
        if (action.getMode() != StoreActions.PageMode.MERGE || firstPage) {
            state.getHasMore().put(chatId, page.isHasMore());
        }
        long watermark = page.getLastSequence() != null ? page.getLastSequence() : newestInPage;
        raiseWatermark(state, chatId, watermark);
        refreshPreview(state, chatId);
    }

    // ── Optimistic sends ──────────────────────────────────────────────────

    private void localMessageAdded(StoreState state, StoreActions.LocalMessageAdded action) {
        MessageDto local = action.getMessage();
        if (!state.getChats().containsKey(local.getChatId())) {
            log.debug("Local message for unknown chatId={} ignored", local.getChatId());
            return;
        }
        state.getMessages().put(local.getId(), local);
        state.timeline(local.getChatId()).addPending(local.getId());
    }

    private void sendAcknowledged(StoreState state, StoreActions.SendAcknowledged action) {
        MessageDto local = state.getMessages().get(action.getLocalId());
        if (local != null && state.timeline(local.getChatId()).removePending(local.getId())) {
            state.getMessages().remove(local.getId());
        }
        MessageDto canonical = action.getMessage().toBuilder().build();
        if (!state.getChats().containsKey(canonical.getChatId())) {
            log.debug("Acknowledgment for unknown chatId={} ignored", canonical.getChatId());
            return;
        }
        insertCanonical(state, normalize(state, canonical));
    }

    private void sendFailed(StoreState state, StoreActions.SendFailed action) {
        MessageDto local = state.getMessages().get(action.getLocalId());
        if (local == null || local.getStatus() != DeliveryStatus.SENDING) {
            return;
        }
        local.setStatus(DeliveryStatus.FAILED);
        log.warn("Send failed: localId={} chatId={} reason={}", local.getId(), local.getChatId(), action.getReason());
    }

    private void retryStarted(StoreState state, StoreActions.RetryStarted action) {
        MessageDto local = state.getMessages().get(action.getLocalId());
        if (local != null && local.getStatus() == DeliveryStatus.FAILED) {
            local.setStatus(DeliveryStatus.SENDING);
        }
    }

    // ── Live message events ───────────────────────────────────────────────

    private void messageReceived(StoreState state, StoreActions.MessageReceived action) {
        MessageDto message = normalize(state, action.getMessage().toBuilder().build());
        ChatSummaryDto chat = state.getChats().get(message.getChatId());
        if (chat == null) {
            log.debug("Message {} for unknown chatId={} ignored", message.getId(), message.getChatId());
            return;
        }
        if (!insertCanonical(state, message)) {
            return;
        }
        if (!state.isOwn(message) && !chat.getId().equals(state.getActiveChatId())) {
            setUnread(state, chat, chat.getUnreadCount() + 1);
        }
        if (message.getSenderId() != null) {
            TypingTimers<String> timers = state.getTyping().get(chat.getId());
            if (timers != null) {
                timers.deactivate(message.getSenderId());
            }
        }
    }

    private void messageUpdated(StoreState state, StoreActions.MessageUpdated action) {
        MessageUpdatePayload patch = action.getPatch();
        MessageDto message = state.getMessages().get(patch.getId());
        if (message == null) {
            log.debug("Update of unknown message {} ignored", patch.getId());
            return;
        }
        if (patch.getContent() != null) {
            message.setContent(patch.getContent());
        }
        if (patch.getEdited() != null) {
            message.setEdited(patch.getEdited());
        }
        if (patch.getEditedAt() != null) {
            message.setEditedAt(patch.getEditedAt());
        }
        if (patch.getPinned() != null) {
            message.setPinned(patch.getPinned());
        }
        refreshPreview(state, message.getChatId());
    }

    private void messageDeleted(StoreState state, StoreActions.MessageDeleted action) {
        String messageId = action.getMessageId();
        MessageDto removed = state.getMessages().get(messageId);
        String chatId = removed != null ? removed.getChatId() : action.getChatId();
        if (chatId == null || !state.getChats().containsKey(chatId)) {
            log.debug("Delete of message {} in unknown chatId={} ignored", messageId, chatId);
            return;
        }
        state.tombstone(chatId, messageId);
        if (removed == null) {
            log.debug("Delete of unknown message {} recorded as tombstone", messageId);
            return;
        }
        state.getMessages().remove(messageId);
        ChatTimeline timeline = state.getTimelines().get(removed.getChatId());
        if (timeline != null && removed.getSequence() != null
                && messageId.equals(timeline.sequenced().get(removed.getSequence()))) {
            timeline.removeSequenced(removed.getSequence());
        }
        refreshPreview(state, removed.getChatId());
    }

    private void reactionApplied(StoreState state, StoreActions.ReactionApplied action) {
        ReactionPayload reaction = action.getReaction();
        MessageDto message = state.getMessages().get(reaction.getMessageId());
        if (message == null) {
            log.debug("Reaction on unknown message {} ignored", reaction.getMessageId());
            return;
        }
        List<ReactionSummary> summaries = message.getReactions();
        ReactionSummary summary = null;
        for (ReactionSummary candidate : summaries) {
            if (candidate.getEmoji().equals(reaction.getEmoji())) {
                summary = candidate;
                break;
            }
        }
        if (reaction.isAdd()) {
            if (summary == null) {
                summary = ReactionSummary.builder().emoji(reaction.getEmoji()).build();
                summaries.add(summary);
            }
            if (!summary.getUserIds().contains(reaction.getUserId())) {
                summary.getUserIds().add(reaction.getUserId());
            }
        } else if (summary != null) {
            summary.getUserIds().remove(reaction.getUserId());
            if (summary.getUserIds().isEmpty()) {
                summaries.remove(summary);
            }
        }
    }

    private void readReceiptApplied(StoreState state, StoreActions.ReadReceiptApplied action) {
        ReadReceiptPayload receipt = action.getReceipt();
        ChatSummaryDto chat = state.getChats().get(receipt.getChatId());
        if (chat == null) {
            log.debug("Receipt for unknown chatId={} ignored", receipt.getChatId());
            return;
        }
        if (state.getCurrentUserId().equals(receipt.getUserId())) {
            // read on another device
            setUnread(state, chat, 0);
            return;
        }
        Long upTo = receipt.getSequence();
        if (upTo == null && receipt.getMessageId() != null) {
            MessageDto target = state.getMessages().get(receipt.getMessageId());
            upTo = target == null ? null : target.getSequence();
        }
        ChatTimeline timeline = state.getTimelines().get(chat.getId());
        if (upTo == null || timeline == null) {
            return;
        }
        for (String id : timeline.sequenced().headMap(upTo, true).values()) {
            MessageDto message = state.getMessages().get(id);
            if (message != null && state.isOwn(message) && message.getStatus().canAdvanceTo(DeliveryStatus.READ)) {
                message.setStatus(DeliveryStatus.READ);
            }
        }
    }

    // ── Typing ────────────────────────────────────────────────────────────

    private void typingSet(StoreState state, StoreActions.TypingSet action) {
        if (state.getCurrentUserId().equals(action.getUserId())) {
            return;
        }
        if (action.isTyping()) {
            state.getTyping().computeIfAbsent(action.getChatId(), id -> new TypingTimers<>())
                    .activate(action.getUserId(), action.getExpiresAt());
            return;
        }
        TypingTimers<String> timers = state.getTyping().get(action.getChatId());
        if (timers != null) {
            timers.deactivate(action.getUserId());
            if (timers.isEmpty()) {
                state.getTyping().remove(action.getChatId());
            }
        }
    }

    private void typingExpired(StoreState state, StoreActions.TypingExpired action) {
        Iterator<Map.Entry<String, TypingTimers<String>>> it = state.getTyping().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, TypingTimers<String>> entry = it.next();
            List<String> expired = entry.getValue().expire(action.getNow());
            if (!expired.isEmpty()) {
                log.debug("Typing expired in chatId={}: {}", entry.getKey(), expired);
            }
            if (entry.getValue().isEmpty()) {
                it.remove();
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /**
     * Adds or merges a canonical message. Folds the matching optimistic entry of an own
     * message into it.
     *
     * @return true if the identity was not known before
     */
    private boolean insertCanonical(StoreState state, MessageDto message) {
        if (state.isTombstoned(message.getChatId(), message.getId())) {
            log.debug("Tombstoned message {} ignored", message.getId());
            return false;
        }
        if (message.getSequence() == null) {
            log.debug("Message {} without sequence ignored", message.getId());
            return false;
        }
        if (message.isDeleted()) {
            state.tombstone(message.getChatId(), message.getId());
            return false;
        }

        MessageDto existing = state.getMessages().get(message.getId());
        if (existing != null) {
            mergeInto(existing, message);
            return false;
        }

        ChatTimeline timeline = state.timeline(message.getChatId());
        foldPending(state, timeline, message);
        state.getMessages().put(message.getId(), message);
        String displaced = timeline.put(message.getSequence(), message.getId());
        if (displaced != null && !displaced.equals(message.getId())) {
            log.warn("Sequence {} of chatId={} reassigned from {} to {}",
                    message.getSequence(), message.getChatId(), displaced, message.getId());
            state.getMessages().remove(displaced);
        }
        if (message.getId().equals(timeline.newestId())) {
            refreshPreview(state, message.getChatId());
        }
        return true;
    }

    private void foldPending(StoreState state, ChatTimeline timeline, MessageDto canonical) {
        if (!state.isOwn(canonical) || canonical.getClientMessageId() == null) {
            return;
        }
        for (String localId : new ArrayList<>(timeline.pending())) {
            MessageDto local = state.getMessages().get(localId);
            if (local != null && canonical.getClientMessageId().equals(local.getClientMessageId())) {
                timeline.removePending(localId);
                state.getMessages().remove(localId);
            }
        }
    }

    private static void mergeInto(MessageDto existing, MessageDto incoming) {
        existing.setContent(incoming.getContent());
        existing.setEdited(incoming.isEdited());
        existing.setEditedAt(incoming.getEditedAt());
        existing.setPinned(incoming.isPinned());
        existing.setReactions(incoming.getReactions());
        existing.setAttachments(incoming.getAttachments());
        if (existing.getStatus() == null || existing.getStatus().canAdvanceTo(incoming.getStatus())) {
            existing.setStatus(incoming.getStatus());
        }
    }

    /**
     * Takes ownership of a copy: collections are copied. Server copies carry
     * {@code sent}; messages of other users that reached this client are
     * {@code delivered}.
     */
    private static MessageDto normalize(StoreState state, MessageDto message) {
        List<ReactionSummary> reactions = new ArrayList<>();
        if (message.getReactions() != null) {
            message.getReactions().forEach(r -> reactions.add(r.toBuilder().userIds(new ArrayList<>(r.getUserIds())).build()));
        }
        message.setReactions(reactions);
        message.setAttachments(message.getAttachments() == null
                ? new ArrayList<>() : new ArrayList<>(message.getAttachments()));
        if (state.isOwn(message)) {
            if (message.getStatus() == null || message.getStatus() == DeliveryStatus.SENDING) {
                message.setStatus(DeliveryStatus.SENT);
            }
        } else if (message.getStatus() == null || message.getStatus().canAdvanceTo(DeliveryStatus.DELIVERED)) {
            message.setStatus(DeliveryStatus.DELIVERED);
        }
        return message;
    }

    private static void refreshPreview(StoreState state, String chatId) {
        ChatSummaryDto chat = state.getChats().get(chatId);
        ChatTimeline timeline = state.getTimelines().get(chatId);
        if (chat == null || timeline == null) {
            return;
        }
        String newestId = timeline.newestId();
        if (newestId == null) {
            if (chat.getLastMessage() != null && state.isTombstoned(chatId, chat.getLastMessage().getId())) {
                chat.setLastMessage(null);
            }
            return;
        }
        MessageDto newest = state.getMessages().get(newestId);
        chat.setLastMessage(MessagePreview.of(newest));
        chat.setLastMessageAt(newest.getCreatedAt());
    }

    private static void raiseWatermark(StoreState state, String chatId, long sequence) {
        state.getWatermarks().merge(chatId, sequence, Math::max);
    }

    private static void setUnread(StoreState state, ChatSummaryDto chat, int unread) {
        state.setTotalUnread(state.getTotalUnread() - chat.getUnreadCount() + unread);
        chat.setUnreadCount(unread);
    }

    private static void recomputeTotalUnread(StoreState state) {
        int total = 0;
        for (ChatSummaryDto chat : state.getChats().values()) {
            total += chat.getUnreadCount();
        }
        state.setTotalUnread(total);
    }
}
