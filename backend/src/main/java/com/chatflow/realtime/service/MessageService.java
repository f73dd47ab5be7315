package com.chatflow.realtime.service;

import com.chatflow.realtime.exception.ChatAccessDeniedException;
import com.chatflow.realtime.exception.ResourceNotFoundException;
import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.model.Chat;
import com.chatflow.realtime.model.ChatMember;
import com.chatflow.realtime.model.Message;
import com.chatflow.realtime.protocol.ContentRules;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.MessageValidationException;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.ReactionRequest;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;
import com.chatflow.realtime.protocol.event.MessageDeletePayload;
import com.chatflow.realtime.protocol.event.MessageUpdatePayload;
import com.chatflow.realtime.protocol.event.ReactionPayload;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import com.chatflow.realtime.repository.MessageRepository;
import com.chatflow.realtime.security.ChatPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * MessageService accepts message mutations and turns each into one room event.
 *
 * <pre>
 *  POST /api/messages ──► send()  ──► hub.publish(chatId, message.new, seq → store message with seq)
 *  PUT  /api/messages ──► edit()  ──► hub.publish(chatId, message.update, ...)
 *  DELETE             ──► delete()──► hub.publish(chatId, message.delete, ...)
 *  reactions / pin / read ──────────► message.reaction / message.update / message.read
 * </pre>
 *
 * Every mutation of a stored message runs inside the publish factory, i.e. under the
 * room lock, so concurrent edits, deletes and reactions on one chat apply in the same
 * order their events are sequenced. Checks that depend on message state are repeated
 * inside the factory; a failing check throws before a sequence is consumed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private final ChatService chatService;
    private final MessageRepository messageRepository;
    private final FanoutHub hub;
    private final Clock clock;

    // ── Send ──────────────────────────────────────────────────────────────

    /**
     * Accepts a new message. A retried send carrying a {@code clientMessageId} already
     * stored for this sender and chat returns the stored message without publishing
     * again.
     */
    public MessageDto send(ChatPrincipal sender, SendMessageRequest request) {
        String content = ContentRules.requireValidContent(request.getContent());
        Chat chat = chatService.requireMember(request.getChatId(), sender.getUserId());
        String clientMessageId = request.getClientMessageId();

        Optional<Message> duplicate = messageRepository
                .findByClientMessageId(chat.getId(), sender.getUserId(), clientMessageId);
        if (duplicate.isPresent()) {
            log.debug("Duplicate send ignored: clientMessageId={} chatId={}", clientMessageId, chat.getId());
            return duplicate.get().toDto();
        }

        if (request.getReplyToId() != null) {
            Message parent = messageRepository.findById(request.getReplyToId())
                    .orElseThrow(() -> ResourceNotFoundException.message(request.getReplyToId()));
            if (!parent.getChatId().equals(chat.getId())) {
                throw new MessageValidationException("Replies must reference a message in the same chat");
            }
        }

        String messageId = UUID.randomUUID().toString();
        long sequence;
        try {
            sequence = hub.publish(chat.getId(), EventKind.MESSAGE_NEW, seq -> {
                if (messageRepository.findByClientMessageId(chat.getId(), sender.getUserId(), clientMessageId).isPresent()) {
                    throw new DuplicateSendException();
                }
                Instant now = Instant.now(clock);
                Message message = Message.builder()
                        .id(messageId)
                        .chatId(chat.getId())
                        .senderId(sender.getUserId())
                        .senderName(sender.getDisplayName())
                        .content(content)
                        .replyToId(request.getReplyToId())
                        .clientMessageId(clientMessageId)
                        .sequence(seq)
                        .createdAt(now)
                        .build();
                messageRepository.save(message);
                chat.setLastActivityAt(now);
                chat.member(sender.getUserId()).ifPresent(m -> advanceReadMarker(m, seq));
                return message.toDto();
            });
        } catch (DuplicateSendException e) {
            log.debug("Concurrent duplicate send ignored: clientMessageId={}", clientMessageId);
            return messageRepository.findByClientMessageId(chat.getId(), sender.getUserId(), clientMessageId)
                    .map(Message::toDto)
                    .orElseThrow(() -> new IllegalStateException("Duplicate send without stored message"));
        }

        log.info("Message accepted: id={} chatId={} seq={} senderId={}",
                messageId, chat.getId(), sequence, sender.getUserId());
        return requireMessage(messageId).toDto();
    }

    // ── Edit / delete ─────────────────────────────────────────────────────

    public MessageDto edit(String userId, String messageId, String newContent) {
        String content = ContentRules.requireValidContent(newContent);
        Message message = requireMessage(messageId);
        chatService.requireMember(message.getChatId(), userId);
        if (!userId.equals(message.getSenderId())) {
            throw new ChatAccessDeniedException("You can only edit your own messages");
        }

        hub.publish(message.getChatId(), EventKind.MESSAGE_UPDATE, seq -> {
            if (message.isDeleted()) {
                throw new MessageValidationException("Cannot edit a deleted message");
            }
            Instant now = Instant.now(clock);
            message.setContent(content);
            message.setEdited(true);
            message.setEditedAt(now);
            return MessageUpdatePayload.builder()
                    .id(messageId)
                    .chatId(message.getChatId())
                    .content(content)
                    .edited(true)
                    .editedAt(now)
                    .build();
        });
        return message.toDto();
    }

    /**
     * Deletes for everyone: the content is cleared and the message is excluded from
     * backfill. Authors may delete their own messages, owners and admins any message.
     * Deleting an already deleted message is a no-op.
     */
    public void delete(String userId, String messageId) {
        Message message = requireMessage(messageId);
        Chat chat = chatService.requireMember(message.getChatId(), userId);
        boolean admin = chat.member(userId).map(m -> m.getRole().isAdmin()).orElse(false);
        if (!userId.equals(message.getSenderId()) && !admin) {
            throw new ChatAccessDeniedException("You can only delete your own messages");
        }
        if (message.isDeleted()) {
            log.debug("Message already deleted: id={}", messageId);
            return;
        }

        hub.publish(message.getChatId(), EventKind.MESSAGE_DELETE, seq -> {
            message.setDeleted(true);
            message.setDeletedAt(Instant.now(clock));
            message.setContent(null);
            return MessageDeletePayload.builder()
                    .id(messageId)
                    .chatId(message.getChatId())
                    .deletedForEveryone(true)
                    .build();
        });
        log.info("Message deleted: id={} chatId={} by userId={}", messageId, message.getChatId(), userId);
    }

    // ── Reactions / pin ───────────────────────────────────────────────────

    public MessageDto react(String userId, String messageId, ReactionRequest request) {
        Message message = requireMessage(messageId);
        chatService.requireMember(message.getChatId(), userId);
        boolean add = !ReactionPayload.REMOVE.equals(request.getAction());

        hub.publish(message.getChatId(), EventKind.MESSAGE_REACTION, seq -> {
            if (message.isDeleted()) {
                throw new MessageValidationException("Cannot react to a deleted message");
            }
            if (add) {
                message.addReaction(request.getEmoji(), userId);
            } else {
                message.removeReaction(request.getEmoji(), userId);
            }
            return ReactionPayload.builder()
                    .messageId(messageId)
                    .chatId(message.getChatId())
                    .userId(userId)
                    .emoji(request.getEmoji())
                    .action(add ? ReactionPayload.ADD : ReactionPayload.REMOVE)
                    .build();
        });
        return message.toDto();
    }

    /** Toggles the pin flag. Owners and admins only. */
    public MessageDto togglePin(String userId, String messageId) {
        Message message = requireMessage(messageId);
        Chat chat = chatService.requireMember(message.getChatId(), userId);
        if (!chat.member(userId).map(m -> m.getRole().isAdmin()).orElse(false)) {
            throw new ChatAccessDeniedException("Only admins can pin messages");
        }

        hub.publish(message.getChatId(), EventKind.MESSAGE_UPDATE, seq -> {
            if (message.isDeleted()) {
                throw new MessageValidationException("Cannot pin a deleted message");
            }
            message.setPinned(!message.isPinned());
            return MessageUpdatePayload.builder()
                    .id(messageId)
                    .chatId(message.getChatId())
                    .pinned(message.isPinned())
                    .build();
        });
        return message.toDto();
    }

    public List<MessageDto> pinned(String userId, String chatId) {
        chatService.requireMember(chatId, userId);
        return messageRepository.findPinned(chatId).stream()
                .map(Message::toDto)
                .collect(Collectors.toList());
    }

    // ── Read receipts ─────────────────────────────────────────────────────

    /**
     * Marks everything up to {@code messageId} (or the newest message when
     * {@code null}) as read. The read marker only moves forward; a receipt is published
     * either way so the user's other devices can clear their counters.
     */
    public ReadReceiptPayload markRead(String userId, String chatId, String messageId) {
        Chat chat = chatService.requireMember(chatId, userId);
        Message target;
        if (messageId != null) {
            target = requireMessage(messageId);
            if (!target.getChatId().equals(chatId)) {
                throw new ResourceNotFoundException("Message not found in this chat: " + messageId);
            }
        } else {
            target = messageRepository.latest(chatId).orElse(null);
        }
        ChatMember member = chat.member(userId)
                .orElseThrow(() -> new ChatAccessDeniedException("You are not a member of this chat"));

        ReadReceiptPayload receipt = ReadReceiptPayload.builder()
                .chatId(chatId)
                .userId(userId)
                .messageId(target == null ? null : target.getId())
                .sequence(target == null ? null : target.getSequence())
                .readAt(Instant.now(clock))
                .build();
        if (target == null) {
            return receipt;
        }

        hub.publish(chatId, EventKind.MESSAGE_READ, seq -> {
            advanceReadMarker(member, target.getSequence());
            return receipt;
        });
        log.debug("Read marker: chatId={} userId={} seq={}", chatId, userId, member.getLastReadSequence());
        return receipt;
    }

    private static void advanceReadMarker(ChatMember member, long sequence) {
        if (sequence > member.getLastReadSequence()) {
            member.setLastReadSequence(sequence);
        }
    }

    private Message requireMessage(String messageId) {
        return messageRepository.findById(messageId)
                .orElseThrow(() -> ResourceNotFoundException.message(messageId));
    }

    /** Raised inside the publish step when a concurrent send already stored the same client id. */
    private static final class DuplicateSendException extends RuntimeException {
        private DuplicateSendException() {
            super(null, null, false, false);
        }
    }
}
