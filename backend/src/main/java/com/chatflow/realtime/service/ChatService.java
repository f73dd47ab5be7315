package com.chatflow.realtime.service;

import com.chatflow.realtime.exception.ChatAccessDeniedException;
import com.chatflow.realtime.exception.InvalidRequestException;
import com.chatflow.realtime.exception.ResourceNotFoundException;
import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.hub.SubscriptionRegistry;
import com.chatflow.realtime.model.Chat;
import com.chatflow.realtime.model.ChatMember;
import com.chatflow.realtime.model.MemberRole;
import com.chatflow.realtime.presence.PresenceTracker;
import com.chatflow.realtime.protocol.ChatKind;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.CreateChatRequest;
import com.chatflow.realtime.protocol.dto.MessagePreview;
import com.chatflow.realtime.protocol.event.ChatUpdatePayload;
import com.chatflow.realtime.protocol.event.MemberPayload;
import com.chatflow.realtime.repository.ChatRepository;
import com.chatflow.realtime.repository.MessageRepository;
import com.chatflow.realtime.security.ChatPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * ChatService administers the in-memory chat directory and answers the membership
 * questions every other operation asks.
 *
 * <h3>Events</h3>
 * <ul>
 * <li>{@code chat.new} goes to every member's sessions directly, since nobody is
 * subscribed to a chat that did not exist yet.</li>
 * <li>{@code chat.update}, {@code chat.member.join} and {@code chat.member.leave} are
 * room events and consume a room sequence.</li>
 * <li>{@code chat.delete} goes to every member's sessions, after which the room's
 * subscriptions and counter are dropped.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private final ChatRepository chatRepository;
    private final MessageRepository messageRepository;
    private final FanoutHub hub;
    private final SubscriptionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final Clock clock;

    // ── Queries ───────────────────────────────────────────────────────────

    public List<ChatSummaryDto> listChats(String userId) {
        return chatRepository.findByMember(userId).stream()
                .map(chat -> toSummary(chat, userId))
                .collect(Collectors.toList());
    }

    public ChatSummaryDto getChat(String userId, String chatId) {
        return toSummary(requireMember(chatId, userId), userId);
    }

    public Chat requireChat(String chatId) {
        return chatRepository.findById(chatId)
                .orElseThrow(() -> ResourceNotFoundException.chat(chatId));
    }

    /**
     * @throws ResourceNotFoundException  if the chat does not exist
     * @throws ChatAccessDeniedException if the user is not a member
     */
    public Chat requireMember(String chatId, String userId) {
        Chat chat = requireChat(chatId);
        if (!chat.isMember(userId)) {
            throw new ChatAccessDeniedException("You are not a member of this chat");
        }
        return chat;
    }

    // ── Administration ────────────────────────────────────────────────────

    /**
     * Creates a chat with the caller as owner. A private chat needs exactly one other
     * member; asking again for the same pair returns the existing chat.
     */
    public ChatSummaryDto createChat(ChatPrincipal creator, CreateChatRequest request) {
        String creatorId = creator.getUserId();
        Set<String> others = new LinkedHashSet<>(request.getMemberIds());
        others.remove(creatorId);
        if (others.isEmpty()) {
            throw new InvalidRequestException("A chat needs at least one other member");
        }

        if (request.getKind() == ChatKind.PRIVATE) {
            if (others.size() != 1) {
                throw new InvalidRequestException("A private chat has exactly two members");
            }
            String counterpart = others.iterator().next();
            Chat existing = chatRepository.findByMember(creatorId).stream()
                    .filter(chat -> chat.getKind() == ChatKind.PRIVATE && chat.isMember(counterpart))
                    .findFirst()
                    .orElse(null);
            if (existing != null) {
                log.debug("Private chat already exists: chatId={}", existing.getId());
                return toSummary(existing, creatorId);
            }
        } else if (request.getName() == null || request.getName().isBlank()) {
            throw new InvalidRequestException("Group and broadcast chats need a name");
        }

        Instant now = Instant.now(clock);
        Chat chat = Chat.builder()
                .id(UUID.randomUUID().toString())
                .kind(request.getKind())
                .name(request.getName() == null ? null : request.getName().trim())
                .createdBy(creatorId)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        chat.getMembers().put(creatorId, member(chat.getId(), creatorId, MemberRole.OWNER, now));
        others.forEach(id -> chat.getMembers().put(id, member(chat.getId(), id, MemberRole.MEMBER, now)));
        chatRepository.save(chat);

        for (String memberId : chat.memberIds()) {
            hub.sendToUser(memberId, EventKind.CHAT_NEW, chat.getId(), toSummary(chat, memberId));
        }
        return toSummary(chat, creatorId);
    }

    public ChatSummaryDto renameChat(String userId, String chatId, String name) {
        Chat chat = requireAdmin(chatId, userId);
        if (chat.getKind() == ChatKind.PRIVATE) {
            throw new InvalidRequestException("Private chats cannot be renamed");
        }
        hub.publish(chatId, EventKind.CHAT_UPDATE, seq -> {
            chat.setName(name.trim());
            return ChatUpdatePayload.builder().chatId(chatId).name(chat.getName()).updatedBy(userId).build();
        });
        return toSummary(chat, userId);
    }

    public void deleteChat(String userId, String chatId) {
        Chat chat = requireMember(chatId, userId);
        if (!chat.member(userId).map(m -> m.getRole() == MemberRole.OWNER).orElse(false)) {
            throw new ChatAccessDeniedException("Only the owner can delete this chat");
        }
        chatRepository.delete(chatId);
        ChatUpdatePayload payload = ChatUpdatePayload.builder().chatId(chatId).updatedBy(userId).build();
        for (String memberId : chat.memberIds()) {
            hub.sendToUser(memberId, EventKind.CHAT_DELETE, chatId, payload);
        }
        registry.unsubscribeAll(chatId);
        hub.forgetRoom(chatId);
        messageRepository.deleteChat(chatId);
    }

    public ChatSummaryDto addMember(String actorId, String chatId, String userId) {
        Chat chat = requireAdmin(chatId, actorId);
        if (chat.getKind() == ChatKind.PRIVATE) {
            throw new InvalidRequestException("Members cannot be added to a private chat");
        }
        if (chat.isMember(userId)) {
            throw new InvalidRequestException("User is already a member of this chat");
        }
        hub.publish(chatId, EventKind.CHAT_MEMBER_JOIN, seq -> {
            chat.getMembers().put(userId, member(chatId, userId, MemberRole.MEMBER, Instant.now(clock)));
            return MemberPayload.builder().chatId(chatId).userId(userId).memberCount(chat.memberCount()).build();
        });
        hub.sendToUser(userId, EventKind.CHAT_NEW, chatId, toSummary(chat, userId));
        return toSummary(chat, actorId);
    }

    /**
     * Removes a member. Members may remove themselves; removing someone else needs an
     * admin role. The owner cannot be removed. The leave event is delivered before the
     * removed user's sessions are unsubscribed, so they see it too.
     */
    public void removeMember(String actorId, String chatId, String userId) {
        Chat chat = actorId.equals(userId) ? requireMember(chatId, actorId) : requireAdmin(chatId, actorId);
        ChatMember target = chat.member(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User is not a member of this chat"));
        if (target.getRole() == MemberRole.OWNER) {
            throw new InvalidRequestException("The owner cannot leave; delete the chat instead");
        }
        hub.publish(chatId, EventKind.CHAT_MEMBER_LEAVE, seq -> {
            chat.getMembers().remove(userId);
            return MemberPayload.builder().chatId(chatId).userId(userId).memberCount(chat.memberCount()).build();
        });
        registry.unsubscribeUser(chatId, userId);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Chat requireAdmin(String chatId, String userId) {
        Chat chat = requireMember(chatId, userId);
        if (!chat.member(userId).map(m -> m.getRole().isAdmin()).orElse(false)) {
            throw new ChatAccessDeniedException("Only chat admins can do this");
        }
        return chat;
    }

    private static ChatMember member(String chatId, String userId, MemberRole role, Instant joinedAt) {
        return ChatMember.builder().chatId(chatId).userId(userId).role(role).joinedAt(joinedAt).build();
    }

    /** Chat list row from {@code userId}'s point of view. */
    ChatSummaryDto toSummary(Chat chat, String userId) {
        long lastRead = chat.member(userId).map(ChatMember::getLastReadSequence).orElse(0L);
        String counterpart = chat.counterpartOf(userId).orElse(null);

        ChatSummaryDto.ChatSummaryDtoBuilder summary = ChatSummaryDto.builder()
                .id(chat.getId())
                .name(chat.getName())
                .kind(chat.getKind())
                .memberCount(chat.memberCount())
                .unreadCount(messageRepository.countUnread(chat.getId(), lastRead, userId))
                .lastMessageAt(chat.getLastActivityAt())
                .counterpartId(counterpart)
                .online(counterpart != null && presenceTracker.isOnline(counterpart));

        messageRepository.latest(chat.getId())
                .ifPresent(message -> summary.lastMessage(MessagePreview.of(message.toDto())));
        return summary.build();
    }
}
