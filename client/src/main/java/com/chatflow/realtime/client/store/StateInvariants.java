package com.chatflow.realtime.client.store;

import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Structural checks of {@link StoreState}, run after each transition when enabled. */
public final class StateInvariants {

    private StateInvariants() {
    }

    /**
     * @throws IllegalStateException naming the first violated rule
     */
    public static void check(StoreState state) {
        int sum = 0;
        for (ChatSummaryDto chat : state.getChats().values()) {
            if (chat.getUnreadCount() < 0) {
                fail("negative unread count in chat " + chat.getId());
            }
            sum += chat.getUnreadCount();
        }
        if (sum != state.getTotalUnread()) {
            fail("total unread " + state.getTotalUnread() + " != sum of chats " + sum);
        }

        String active = state.getActiveChatId();
        if (active != null && !state.getChats().containsKey(active)) {
            fail("active chat " + active + " is not in the chat list");
        }

        Set<String> indexed = new HashSet<>();
        for (Map.Entry<String, ChatTimeline> entry : state.getTimelines().entrySet()) {
            String chatId = entry.getKey();
            long previous = Long.MIN_VALUE;
            for (Map.Entry<Long, String> seq : entry.getValue().sequenced().entrySet()) {
                MessageDto message = state.getMessages().get(seq.getValue());
                if (message == null) {
                    fail("index of chat " + chatId + " points to missing message " + seq.getValue());
                }
                if (!seq.getKey().equals(message.getSequence())) {
                    fail("message " + message.getId() + " indexed at " + seq.getKey() + " but has sequence " + message.getSequence());
                }
                if (seq.getKey() <= previous) {
                    fail("sequences of chat " + chatId + " are not strictly increasing");
                }
                previous = seq.getKey();
                if (!indexed.add(seq.getValue())) {
                    fail("message " + seq.getValue() + " is indexed twice");
                }
            }
            for (String localId : entry.getValue().pending()) {
                if (!state.getMessages().containsKey(localId)) {
                    fail("pending entry " + localId + " has no message");
                }
                if (!indexed.add(localId)) {
                    fail("message " + localId + " is indexed twice");
                }
            }
        }
        if (indexed.size() != state.getMessages().size()) {
            fail(state.getMessages().size() - indexed.size() + " messages are not in any timeline");
        }
        for (Set<String> deleted : state.getTombstones().values()) {
            for (String tombstone : deleted) {
                if (state.getMessages().containsKey(tombstone)) {
                    fail("tombstoned message " + tombstone + " is still stored");
                }
            }
        }
    }

    private static void fail(String rule) {
        throw new IllegalStateException("Store invariant violated: " + rule);
    }
}
