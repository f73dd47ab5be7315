package com.chatflow.realtime.client.store;

import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.protocol.event.MessageUpdatePayload;
import com.chatflow.realtime.protocol.event.ReactionPayload;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/** Concrete store actions. Payload objects are owned by the store once dispatched. */
public final class StoreActions {

    private StoreActions() {
    }

    /** How a loaded page is merged into the cached timeline. */
    public enum PageMode {
        /** First page for the chat: the cache becomes the page plus newer live and pending messages. */
        REPLACE,
        /** Older page fetched with the oldest cached message as cursor. */
        PREPEND,
        /** Newest page fetched to close a sequence gap; merged by identity only. */
        MERGE
    }

    // ── Chats ─────────────────────────────────────────────────────────────

    @Value
    public static class ChatsLoaded implements StoreAction {
        List<ChatSummaryDto> chats;

        @Override
        public ActionType type() {
            return ActionType.CHATS_LOADED;
        }
    }

    @Value
    public static class ChatSelected implements StoreAction {
        String chatId;

        @Override
        public ActionType type() {
            return ActionType.CHAT_SELECTED;
        }
    }

    @Value
    public static class ActiveChatCleared implements StoreAction {
        @Override
        public ActionType type() {
            return ActionType.ACTIVE_CHAT_CLEARED;
        }
    }

    @Value
    public static class ChatAdded implements StoreAction {
        ChatSummaryDto chat;

        @Override
        public ActionType type() {
            return ActionType.CHAT_ADDED;
        }
    }

    @Value
    public static class ChatRenamed implements StoreAction {
        String chatId;
        String name;

        @Override
        public ActionType type() {
            return ActionType.CHAT_RENAMED;
        }
    }

    @Value
    public static class ChatRemoved implements StoreAction {
        String chatId;

        @Override
        public ActionType type() {
            return ActionType.CHAT_REMOVED;
        }
    }

    @Value
    public static class MembershipChanged implements StoreAction {
        String chatId;
        String userId;
        boolean joined;
        int memberCount;

        @Override
        public ActionType type() {
            return ActionType.MEMBERSHIP_CHANGED;
        }
    }

    @Value
    public static class PresenceChanged implements StoreAction {
        String userId;
        boolean online;

        @Override
        public ActionType type() {
            return ActionType.PRESENCE_CHANGED;
        }
    }

    // ── Messages ──────────────────────────────────────────────────────────

    @Value
    public static class PageLoaded implements StoreAction {
        String chatId;
        MessagePage page;
        PageMode mode;

        @Override
        public ActionType type() {
            return ActionType.PAGE_LOADED;
        }
    }

    @Value
    public static class LocalMessageAdded implements StoreAction {
        MessageDto message;

        @Override
        public ActionType type() {
            return ActionType.LOCAL_MESSAGE_ADDED;
        }
    }

    @Value
    public static class SendAcknowledged implements StoreAction {
        String localId;
        MessageDto message;

        @Override
        public ActionType type() {
            return ActionType.SEND_ACKNOWLEDGED;
        }
    }

    @Value
    public static class SendFailed implements StoreAction {
        String localId;
        String reason;

        @Override
        public ActionType type() {
            return ActionType.SEND_FAILED;
        }
    }

    @Value
    public static class RetryStarted implements StoreAction {
        String localId;

        @Override
        public ActionType type() {
            return ActionType.RETRY_STARTED;
        }
    }

    @Value
    public static class MessageReceived implements StoreAction {
        MessageDto message;

        @Override
        public ActionType type() {
            return ActionType.MESSAGE_RECEIVED;
        }
    }

    @Value
    public static class MessageUpdated implements StoreAction {
        MessageUpdatePayload patch;

        @Override
        public ActionType type() {
            return ActionType.MESSAGE_UPDATED;
        }
    }

    @Value
    public static class MessageDeleted implements StoreAction {
        String chatId;
        String messageId;

        @Override
        public ActionType type() {
            return ActionType.MESSAGE_DELETED;
        }
    }

    @Value
    public static class ReactionApplied implements StoreAction {
        ReactionPayload reaction;

        @Override
        public ActionType type() {
            return ActionType.REACTION_APPLIED;
        }
    }

    @Value
    public static class ReadReceiptApplied implements StoreAction {
        ReadReceiptPayload receipt;

        @Override
        public ActionType type() {
            return ActionType.READ_RECEIPT_APPLIED;
        }
    }

    @Value
    public static class SequenceObserved implements StoreAction {
        String chatId;
        long sequence;

        @Override
        public ActionType type() {
            return ActionType.SEQUENCE_OBSERVED;
        }
    }

    // ── Typing ────────────────────────────────────────────────────────────

    @Value
    public static class TypingSet implements StoreAction {
        String chatId;
        String userId;
        boolean typing;
        Instant expiresAt;

        @Override
        public ActionType type() {
            return ActionType.TYPING_SET;
        }
    }

    @Value
    public static class TypingExpired implements StoreAction {
        Instant now;

        @Override
        public ActionType type() {
            return ActionType.TYPING_EXPIRED;
        }
    }
}
