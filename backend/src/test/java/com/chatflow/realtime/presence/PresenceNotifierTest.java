package com.chatflow.realtime.presence;

import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.model.Chat;
import com.chatflow.realtime.model.ChatMember;
import com.chatflow.realtime.protocol.ChatKind;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.event.PresencePayload;
import com.chatflow.realtime.repository.ChatRepository;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PresenceNotifierTest {

    @Test
    void announcesOncePerCoMemberAndNeverToTheUserItself() {
        ChatRepository chats = new ChatRepository();
        chats.save(chat("c1", ChatKind.PRIVATE, "alice", "bob"));
        chats.save(chat("c2", ChatKind.GROUP, "alice", "bob", "carol"));
        chats.save(chat("c3", ChatKind.GROUP, "dave", "erin"));
        FanoutHub hub = mock(FanoutHub.class);

        PresencePayload payload = PresencePayload.builder().userId("alice").status(PresencePayload.ONLINE).build();
        new PresenceNotifier(chats, hub).announce(EventKind.USER_ONLINE, payload);

        verify(hub, times(1)).sendToUser(eq("bob"), eq(EventKind.USER_ONLINE), isNull(), eq(payload));
        verify(hub, times(1)).sendToUser(eq("carol"), eq(EventKind.USER_ONLINE), isNull(), eq(payload));
        verify(hub, never()).sendToUser(eq("alice"), any(), any(), any());
        verify(hub, never()).sendToUser(eq("dave"), any(), any(), any());
    }

    private static Chat chat(String id, ChatKind kind, String... members) {
        Chat chat = Chat.builder().id(id).kind(kind).name(id).createdAt(Instant.EPOCH).lastActivityAt(Instant.EPOCH).build();
        for (String member : members) {
            chat.getMembers().put(member, ChatMember.builder().chatId(id).userId(member).build());
        }
        return chat;
    }
}
