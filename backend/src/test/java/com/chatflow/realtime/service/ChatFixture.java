package com.chatflow.realtime.service;

import com.chatflow.realtime.backfill.BackfillService;
import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.hub.RecordingSessionSink;
import com.chatflow.realtime.hub.SubscriptionRegistry;
import com.chatflow.realtime.presence.PresenceNotifier;
import com.chatflow.realtime.presence.PresenceTracker;
import com.chatflow.realtime.protocol.ChatKind;
import com.chatflow.realtime.protocol.ProtocolMapper;
import com.chatflow.realtime.protocol.dto.CreateChatRequest;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;
import com.chatflow.realtime.repository.ChatRepository;
import com.chatflow.realtime.repository.MessageRepository;
import com.chatflow.realtime.security.ChatPrincipal;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.mockito.Mockito.mock;

/** The server's services wired together over in-memory storage and a recording sink. */
public class ChatFixture {

    public final Clock clock = Clock.fixed(Instant.parse("2026-01-15T09:00:00Z"), ZoneOffset.UTC);
    public final ChatRepository chatRepository = new ChatRepository();
    public final MessageRepository messageRepository = new MessageRepository();
    public final SubscriptionRegistry registry = new SubscriptionRegistry();
    public final RecordingSessionSink sink = new RecordingSessionSink();
    public final FanoutHub hub = new FanoutHub(registry, sink, messageRepository, ProtocolMapper.create(), clock);
    public final PresenceTracker presenceTracker = new PresenceTracker(mock(PresenceNotifier.class), clock);
    public final ChatService chatService =
            new ChatService(chatRepository, messageRepository, hub, registry, presenceTracker, clock);
    public final MessageService messageService = new MessageService(chatService, messageRepository, hub, clock);
    public final BackfillService backfillService = new BackfillService(chatService, messageRepository, 50, 100);

    public static ChatPrincipal user(String userId) {
        return new ChatPrincipal(userId, Character.toUpperCase(userId.charAt(0)) + userId.substring(1));
    }

    public String group(String owner, String... members) {
        return chatService.createChat(user(owner), CreateChatRequest.builder()
                .kind(ChatKind.GROUP)
                .name("team")
                .memberIds(Arrays.asList(members))
                .build()).getId();
    }

    public String privateChat(String owner, String other) {
        return chatService.createChat(user(owner), CreateChatRequest.builder()
                .kind(ChatKind.PRIVATE)
                .memberIds(Arrays.asList(other))
                .build()).getId();
    }

    public MessageDto send(String userId, String chatId, String content) {
        return messageService.send(user(userId), SendMessageRequest.builder()
                .chatId(chatId)
                .content(content)
                .build());
    }

    /** Registers a session for the user and subscribes it to the chat. */
    public String connect(String sessionId, String userId, String chatId) {
        registry.registerSession(sessionId, userId);
        registry.subscribe(sessionId, chatId);
        return sessionId;
    }
}
