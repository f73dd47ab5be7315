package com.chatflow.realtime.client.store;

import com.chatflow.realtime.client.dispatch.ClientEventDispatcher;
import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.event.ChatUpdatePayload;
import com.chatflow.realtime.protocol.event.ErrorPayload;
import com.chatflow.realtime.protocol.event.MemberPayload;
import com.chatflow.realtime.protocol.event.MessageDeletePayload;
import com.chatflow.realtime.protocol.event.MessageUpdatePayload;
import com.chatflow.realtime.protocol.event.NotificationPayload;
import com.chatflow.realtime.protocol.event.PresencePayload;
import com.chatflow.realtime.protocol.event.ReactionPayload;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import com.chatflow.realtime.protocol.event.TypingPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Connects dispatcher events to store operations. Every sequenced envelope is first
 * observed for gaps, then applied by its kind-specific handler.
 */
@Slf4j
@RequiredArgsConstructor
public class StoreEventBinder {

    private final ChatSyncStore store;
    private final ObjectMapper mapper;
    private final List<Runnable> registrations = new ArrayList<>();

    public void bind(ClientEventDispatcher dispatcher) {
        registrations.add(dispatcher.onAny(envelope -> {
            if (envelope.isSequenced()) {
                store.observeSequence(envelope.getChatId(), envelope.getSequence());
            }
        }));

        registrations.add(dispatcher.on(EventKind.MESSAGE_NEW,
                e -> store.addNewMessage(read(e, MessageDto.class))));
        registrations.add(dispatcher.on(EventKind.MESSAGE_UPDATE,
                e -> store.updateMessage(read(e, MessageUpdatePayload.class))));
        registrations.add(dispatcher.on(EventKind.MESSAGE_DELETE, e -> {
            MessageDeletePayload payload = read(e, MessageDeletePayload.class);
            store.deleteMessage(chatIdOf(e, payload.getChatId()), payload.getId());
        }));
        registrations.add(dispatcher.on(EventKind.MESSAGE_REACTION,
                e -> store.applyReaction(read(e, ReactionPayload.class))));
        registrations.add(dispatcher.on(EventKind.MESSAGE_READ,
                e -> store.applyReadReceipt(read(e, ReadReceiptPayload.class))));

        registrations.add(dispatcher.on(EventKind.TYPING_START, e -> typing(e, true)));
        registrations.add(dispatcher.on(EventKind.TYPING_STOP, e -> typing(e, false)));

        registrations.add(dispatcher.on(EventKind.USER_ONLINE, this::presence));
        registrations.add(dispatcher.on(EventKind.USER_OFFLINE, this::presence));
        registrations.add(dispatcher.on(EventKind.USER_STATUS, this::presence));

        registrations.add(dispatcher.on(EventKind.CHAT_NEW,
                e -> store.onChatAdded(read(e, ChatSummaryDto.class))));
        registrations.add(dispatcher.on(EventKind.CHAT_UPDATE, e -> {
            ChatUpdatePayload payload = read(e, ChatUpdatePayload.class);
            if (payload.getName() != null) {
                store.onChatRenamed(chatIdOf(e, payload.getChatId()), payload.getName());
            }
        }));
        registrations.add(dispatcher.on(EventKind.CHAT_DELETE, e -> {
            ChatUpdatePayload payload = read(e, ChatUpdatePayload.class);
            store.onChatRemoved(chatIdOf(e, payload.getChatId()));
        }));
        registrations.add(dispatcher.on(EventKind.CHAT_MEMBER_JOIN,
                e -> store.onMembershipChanged(read(e, MemberPayload.class), true)));
        registrations.add(dispatcher.on(EventKind.CHAT_MEMBER_LEAVE,
                e -> store.onMembershipChanged(read(e, MemberPayload.class), false)));

        registrations.add(dispatcher.on(EventKind.NOTIFICATION, e -> {
            NotificationPayload payload = read(e, NotificationPayload.class);
            log.info("Notification: {} ({})", payload.getTitle(), payload.getBody());
        }));
        registrations.add(dispatcher.on(EventKind.ERROR, e -> {
            ErrorPayload payload = read(e, ErrorPayload.class);
            log.warn("Server error [{}]: {}", payload.getCode(), payload.getMessage());
        }));
    }

    public void unbind() {
        registrations.forEach(Runnable::run);
        registrations.clear();
    }

    private void typing(Envelope envelope, boolean typing) {
        TypingPayload payload = read(envelope, TypingPayload.class);
        store.setTyping(chatIdOf(envelope, payload.getChatId()), payload.getUserId(), typing);
    }

    private void presence(Envelope envelope) {
        PresencePayload payload = read(envelope, PresencePayload.class);
        if (!PresencePayload.ONLINE.equals(payload.getStatus()) && !PresencePayload.OFFLINE.equals(payload.getStatus())) {
            log.debug("Status {} of userId={} carries no presence change", payload.getStatus(), payload.getUserId());
            return;
        }
        store.updateOnlineStatus(payload.getUserId(), payload.isOnline());
    }

    private <T> T read(Envelope envelope, Class<T> type) {
        return mapper.convertValue(envelope.getData(), type);
    }

    private static String chatIdOf(Envelope envelope, String fromPayload) {
        return fromPayload != null ? fromPayload : envelope.getChatId();
    }
}
