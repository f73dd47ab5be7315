package com.chatflow.realtime.client.store;

import com.chatflow.realtime.client.ClientSettings;
import com.chatflow.realtime.client.FakeChatApi;
import com.chatflow.realtime.client.ManualScheduler;
import com.chatflow.realtime.client.MutableClock;
import com.chatflow.realtime.client.channel.SyncChannel;
import com.chatflow.realtime.client.dispatch.ClientEventDispatcher;
import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.ProtocolMapper;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.event.ChatUpdatePayload;
import com.chatflow.realtime.protocol.event.ErrorPayload;
import com.chatflow.realtime.protocol.event.MessageDeletePayload;
import com.chatflow.realtime.protocol.event.PresencePayload;
import com.chatflow.realtime.protocol.event.TypingPayload;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.Collectors;

import static com.chatflow.realtime.client.store.StoreFixtures.T0;
import static com.chatflow.realtime.client.store.StoreFixtures.direct;
import static com.chatflow.realtime.client.store.StoreFixtures.group;
import static com.chatflow.realtime.client.store.StoreFixtures.msg;
import static com.chatflow.realtime.client.store.StoreFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class StoreEventBinderTest {

    private final ObjectMapper mapper = ProtocolMapper.create();
    private final FakeChatApi api = new FakeChatApi();
    private final ClientEventDispatcher dispatcher = new ClientEventDispatcher();
    private ChatSyncStore store;
    private StoreEventBinder binder;

    @BeforeEach
    void setUp() {
        store = new ChatSyncStore(api, mock(SyncChannel.class), "me", new ManualScheduler().executor,
                new MutableClock(T0), ClientSettings.builder().invariantChecks(true).build());
        binder = new StoreEventBinder(store, mapper);
        binder.bind(dispatcher);

        store.loadChats();
        api.chatCalls.get(0).complete(Arrays.asList(group("c1", 0), direct("d1", "bob")));
    }

    private Envelope envelope(EventKind kind, String chatId, Long sequence, Object payload) {
        return Envelope.builder()
                .event(kind)
                .chatId(chatId)
                .sequence(sequence)
                .data(mapper.valueToTree(payload))
                .timestamp(T0)
                .build();
    }

    @Test
    void duplicateMessageNewYieldsOneMessage() {
        MessageDto message = msg("m1", "c1", 1, "bob");
        Envelope event = envelope(EventKind.MESSAGE_NEW, "c1", 1L, message);

        dispatcher.dispatch(event);
        dispatcher.dispatch(event);

        assertThat(store.messages("c1")).extracting(MessageDto::getId).containsExactly("m1");
        assertThat(store.totalUnread()).isEqualTo(1);
        assertThat(store.watermark("c1")).contains(1L);
    }

    @Test
    void gapInRoomSequenceRequestsNewestPage() {
        store.selectChat("c1");
        api.lastPageCall().result.complete(page(false, msg("m1", "c1", 1, "bob")));
        int before = api.pageCalls.size();

        dispatcher.dispatch(envelope(EventKind.MESSAGE_NEW, "c1", 4L, msg("m4", "c1", 4, "bob")));

        assertThat(api.pageCalls).hasSize(before + 1);
        assertThat(store.messages("c1")).extracting(MessageDto::getId).containsExactly("m1", "m4");
    }

    @Test
    void typingStartThenStopLeavesNobodyTyping() {
        TypingPayload typing = TypingPayload.builder().chatId("c1").userId("bob").username("Bob").build();

        dispatcher.dispatch(envelope(EventKind.TYPING_START, "c1", null, typing));
        dispatcher.dispatch(envelope(EventKind.TYPING_START, "c1", null, typing));
        assertThat(store.typingUsers("c1")).containsExactly("bob");

        dispatcher.dispatch(envelope(EventKind.TYPING_STOP, "c1", null, typing));
        assertThat(store.typingUsers("c1")).isEmpty();
    }

    @Test
    void deleteAndRenameEventsUseEnvelopeChatWhenPayloadOmitsIt() {
        dispatcher.dispatch(envelope(EventKind.MESSAGE_NEW, "c1", 1L, msg("m1", "c1", 1, "bob")));

        dispatcher.dispatch(envelope(EventKind.MESSAGE_DELETE, "c1", 2L,
                MessageDeletePayload.builder().id("m1").deletedForEveryone(true).build()));
        dispatcher.dispatch(envelope(EventKind.CHAT_UPDATE, "c1", 3L,
                ChatUpdatePayload.builder().name("weekend plans").build()));

        assertThat(store.messages("c1")).isEmpty();
        assertThat(store.chat("c1").orElseThrow().getName()).isEqualTo("weekend plans");
    }

    @Test
    void presenceEventsTogglePrivateChatStatus() {
        dispatcher.dispatch(envelope(EventKind.USER_ONLINE, null, null,
                PresencePayload.builder().userId("bob").status(PresencePayload.ONLINE).build()));
        assertThat(store.chat("d1").orElseThrow().isOnline()).isTrue();

        dispatcher.dispatch(envelope(EventKind.USER_STATUS, null, null,
                PresencePayload.builder().userId("bob").status("away").statusMessage("lunch").build()));
        assertThat(store.chat("d1").orElseThrow().isOnline()).isTrue();

        dispatcher.dispatch(envelope(EventKind.USER_OFFLINE, null, null,
                PresencePayload.builder().userId("bob").status(PresencePayload.OFFLINE).lastSeen(T0).build()));
        assertThat(store.chat("d1").orElseThrow().isOnline()).isFalse();
    }

    @Test
    void chatNewAddsChat() {
        ChatSummaryDto created = group("c9", 0);

        dispatcher.dispatch(envelope(EventKind.CHAT_NEW, "c9", null, created));

        assertThat(store.chats().stream().map(ChatSummaryDto::getId).collect(Collectors.toList()))
                .containsExactly("c1", "d1", "c9");
    }

    @Test
    void malformedPayloadAndErrorEventsDoNotBreakLaterEvents() {
        dispatcher.dispatch(Envelope.builder().event(EventKind.MESSAGE_NEW).chatId("c1")
                .data(TextNode.valueOf("not an object")).build());
        dispatcher.dispatch(envelope(EventKind.ERROR, null, null,
                ErrorPayload.builder().code("CHAT_ACCESS_DENIED").message("not a member").build()));

        dispatcher.dispatch(envelope(EventKind.MESSAGE_NEW, "c1", 1L, msg("m1", "c1", 1, "bob")));

        assertThat(store.messages("c1")).hasSize(1);
    }

    @Test
    void unbindDetachesEveryHandler() {
        binder.unbind();

        dispatcher.dispatch(envelope(EventKind.MESSAGE_NEW, "c1", 1L, msg("m1", "c1", 1, "bob")));

        assertThat(store.messages("c1")).isEmpty();
        assertThat(dispatcher.handlerCount(EventKind.MESSAGE_NEW)).isZero();
    }
}
