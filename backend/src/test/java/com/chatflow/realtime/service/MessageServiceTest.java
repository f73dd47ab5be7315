package com.chatflow.realtime.service;

import com.chatflow.realtime.exception.ChatAccessDeniedException;
import com.chatflow.realtime.exception.ResourceNotFoundException;
import com.chatflow.realtime.protocol.Envelope;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.MessageValidationException;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.ReactionRequest;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.chatflow.realtime.service.ChatFixture.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageServiceTest {

    private ChatFixture fx;
    private MessageService messages;
    private String chatId;

    @BeforeEach
    void setUp() {
        fx = new ChatFixture();
        messages = fx.messageService;
        chatId = fx.group("alice", "bob", "carol");
        fx.connect("bob-1", "bob", chatId);
    }

    @Test
    void sendAssignsRoomSequenceAndPublishesMessageNew() {
        MessageDto first = fx.send("alice", chatId, "  hello  ");
        MessageDto second = fx.send("bob", chatId, "hi");

        assertThat(first.getSequence()).isEqualTo(1L);
        assertThat(second.getSequence()).isEqualTo(2L);
        assertThat(first.getContent()).isEqualTo("hello");
        assertThat(first.getSenderName()).isEqualTo("Alice");

        Envelope event = fx.sink.to("bob-1", EventKind.MESSAGE_NEW).get(0);
        assertThat(event.getSequence()).isEqualTo(1L);
        assertThat(event.getData().get("id").asText()).isEqualTo(first.getId());
        assertThat(event.getData().get("sequence").asLong()).isEqualTo(1L);
    }

    @Test
    void retriedSendWithSameClientMessageIdIsNotPublishedTwice() {
        SendMessageRequest request = SendMessageRequest.builder()
                .chatId(chatId)
                .content("only once")
                .clientMessageId("local-7")
                .build();

        MessageDto first = messages.send(user("alice"), request);
        MessageDto retry = messages.send(user("alice"), request);

        assertThat(retry.getId()).isEqualTo(first.getId());
        assertThat(retry.getClientMessageId()).isEqualTo("local-7");
        assertThat(fx.hub.currentSequence(chatId)).isEqualTo(1L);
        assertThat(fx.sink.to("bob-1", EventKind.MESSAGE_NEW)).hasSize(1);

        MessageDto fromBob = messages.send(user("bob"), SendMessageRequest.builder()
                .chatId(chatId)
                .content("same id, other sender")
                .clientMessageId("local-7")
                .build());
        assertThat(fromBob.getId()).isNotEqualTo(first.getId());
    }

    @Test
    void sendRejectsBlankContentAndNonMembers() {
        assertThatThrownBy(() -> fx.send("alice", chatId, "   "))
                .isInstanceOf(MessageValidationException.class);
        assertThatThrownBy(() -> fx.send("mallory", chatId, "hey"))
                .isInstanceOf(ChatAccessDeniedException.class);
        assertThat(fx.hub.currentSequence(chatId)).isZero();
    }

    @Test
    void replyMustReferenceMessageInSameChat() {
        String otherChat = fx.group("alice", "dave");
        MessageDto elsewhere = fx.send("alice", otherChat, "elsewhere");

        assertThatThrownBy(() -> messages.send(user("alice"), SendMessageRequest.builder()
                .chatId(chatId).content("re").replyToId(elsewhere.getId()).build()))
                .isInstanceOf(MessageValidationException.class);
    }

    @Test
    void editIsOwnerOnlyAndPublishesUpdate() {
        MessageDto original = fx.send("alice", chatId, "helo");

        assertThatThrownBy(() -> messages.edit("bob", original.getId(), "hacked"))
                .isInstanceOf(ChatAccessDeniedException.class);

        MessageDto edited = messages.edit("alice", original.getId(), "hello");

        assertThat(edited.isEdited()).isTrue();
        assertThat(edited.getContent()).isEqualTo("hello");
        Envelope update = fx.sink.to("bob-1", EventKind.MESSAGE_UPDATE).get(0);
        assertThat(update.getSequence()).isEqualTo(2L);
        assertThat(update.getData().get("content").asText()).isEqualTo("hello");
    }

    @Test
    void deletedMessageCannotBeEditedAndDeleteIsIdempotent() {
        MessageDto message = fx.send("bob", chatId, "oops");

        messages.delete("bob", message.getId());
        messages.delete("bob", message.getId());

        assertThat(fx.sink.to("bob-1", EventKind.MESSAGE_DELETE)).hasSize(1);
        assertThat(fx.messageRepository.findById(message.getId()).orElseThrow().getContent()).isNull();
        assertThatThrownBy(() -> messages.edit("bob", message.getId(), "again"))
                .isInstanceOf(MessageValidationException.class);
        assertThat(fx.hub.currentSequence(chatId)).isEqualTo(2L);
    }

    @Test
    void ownerMayDeleteOthersMessagesButMembersMayNot() {
        MessageDto fromBob = fx.send("bob", chatId, "hi");

        assertThatThrownBy(() -> messages.delete("carol", fromBob.getId()))
                .isInstanceOf(ChatAccessDeniedException.class);

        messages.delete("alice", fromBob.getId());
        assertThat(fx.messageRepository.findById(fromBob.getId()).orElseThrow().isDeleted()).isTrue();
    }

    @Test
    void reactionsAddAndRemove() {
        MessageDto message = fx.send("alice", chatId, "ship it");

        messages.react("bob", message.getId(), new ReactionRequest("👍", "add"));
        MessageDto afterCarol = messages.react("carol", message.getId(), new ReactionRequest("👍", "add"));
        assertThat(afterCarol.getReactions()).hasSize(1);
        assertThat(afterCarol.getReactions().get(0).getCount()).isEqualTo(2);

        MessageDto afterRemove = messages.react("bob", message.getId(), new ReactionRequest("👍", "remove"));
        assertThat(afterRemove.getReactions().get(0).getUserIds()).containsExactly("carol");
        assertThat(fx.sink.to("bob-1", EventKind.MESSAGE_REACTION)).hasSize(3);
    }

    @Test
    void pinIsAdminOnly() {
        MessageDto message = fx.send("bob", chatId, "rules");

        assertThatThrownBy(() -> messages.togglePin("bob", message.getId()))
                .isInstanceOf(ChatAccessDeniedException.class);

        assertThat(messages.togglePin("alice", message.getId()).isPinned()).isTrue();
        assertThat(messages.pinned("carol", chatId)).extracting(MessageDto::getId).containsExactly(message.getId());
    }

    @Test
    void markReadMovesMarkerForwardOnlyAndClearsUnread() {
        MessageDto m1 = fx.send("alice", chatId, "one");
        MessageDto m2 = fx.send("alice", chatId, "two");
        assertThat(fx.chatService.getChat("bob", chatId).getUnreadCount()).isEqualTo(2);

        ReadReceiptPayload receipt = messages.markRead("bob", chatId, m2.getId());
        messages.markRead("bob", chatId, m1.getId());

        assertThat(receipt.getSequence()).isEqualTo(m2.getSequence());
        assertThat(fx.chatService.getChat("bob", chatId).getUnreadCount()).isZero();
        assertThat(fx.sink.to("bob-1", EventKind.MESSAGE_READ)).hasSize(2);
    }

    @Test
    void markReadWithForeignMessageIsNotFound() {
        String otherChat = fx.group("alice", "bob");
        MessageDto elsewhere = fx.send("alice", otherChat, "x");

        assertThatThrownBy(() -> messages.markRead("bob", chatId, elsewhere.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
