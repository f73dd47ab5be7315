package com.chatflow.realtime.client.store;

import com.chatflow.realtime.protocol.DeliveryStatus;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.chatflow.realtime.client.store.StoreFixtures.group;
import static com.chatflow.realtime.client.store.StoreFixtures.msg;
import static com.chatflow.realtime.client.store.StoreFixtures.page;
import static org.assertj.core.api.Assertions.assertThat;

class StateReducerTest {

    private final StateReducer reducer = new StateReducer();
    private StoreState state;

    @BeforeEach
    void setUp() {
        state = new StoreState("me");
        reducer.apply(state, new StoreActions.ChatsLoaded(Arrays.asList(group("c1", 0), group("c2", 0))));
    }

    @Test
    void receiptMarksOwnMessagesUpToItsSequenceRead() {
        reducer.apply(state, new StoreActions.PageLoaded("c1", page(false,
                msg("m1", "c1", 1, "me"), msg("m2", "c1", 2, "bob"), msg("m3", "c1", 3, "me"),
                msg("m4", "c1", 4, "me")), StoreActions.PageMode.REPLACE));

        reducer.apply(state, new StoreActions.ReadReceiptApplied(ReadReceiptPayload.builder()
                .chatId("c1").userId("bob").sequence(3L).build()));

        assertThat(state.getMessages().get("m1").getStatus()).isEqualTo(DeliveryStatus.READ);
        assertThat(state.getMessages().get("m2").getStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(state.getMessages().get("m3").getStatus()).isEqualTo(DeliveryStatus.READ);
        assertThat(state.getMessages().get("m4").getStatus()).isEqualTo(DeliveryStatus.SENT);
        StateInvariants.check(state);
    }

    @Test
    void tombstonesAreKeptPerChatAndDroppedWithTheChat() {
        reducer.apply(state, new StoreActions.PageLoaded("c1", page(false, msg("m1", "c1", 1, "bob")),
                StoreActions.PageMode.REPLACE));
        reducer.apply(state, new StoreActions.MessageDeleted("c1", "m1"));
        reducer.apply(state, new StoreActions.MessageDeleted("c2", "m9"));
        reducer.apply(state, new StoreActions.MessageDeleted("gone", "m5"));

        assertThat(state.isTombstoned("c1", "m1")).isTrue();
        assertThat(state.isTombstoned("c2", "m9")).isTrue();
        assertThat(state.getTombstones()).containsOnlyKeys("c1", "c2");

        reducer.apply(state, new StoreActions.ChatRemoved("c1"));

        assertThat(state.getTombstones()).containsOnlyKeys("c2");
        assertThat(state.isTombstoned("c1", "m1")).isFalse();
        StateInvariants.check(state);
    }
}
