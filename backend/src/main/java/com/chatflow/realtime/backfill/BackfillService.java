package com.chatflow.realtime.backfill;

import com.chatflow.realtime.exception.ResourceNotFoundException;
import com.chatflow.realtime.model.Message;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.repository.MessageRepository;
import com.chatflow.realtime.service.ChatService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cursor-paginated message history.
 *
 * The cursor is a message id; a page holds messages strictly older than it, returned
 * oldest first. One extra row is fetched to decide {@code has_more} without a count
 * query. Deleted messages never appear. Read-only: no read markers move.
 */
@Slf4j
@Service
public class BackfillService {

    private final ChatService chatService;
    private final MessageRepository messageRepository;
    private final int defaultLimit;
    private final int maxLimit;

    public BackfillService(ChatService chatService,
                           MessageRepository messageRepository,
                           @Value("${chatflow.backfill.default-limit:50}") int defaultLimit,
                           @Value("${chatflow.backfill.max-limit:100}") int maxLimit) {
        this.chatService = chatService;
        this.messageRepository = messageRepository;
        this.defaultLimit = defaultLimit;
        this.maxLimit = maxLimit;
    }

    /**
     * @param before message id cursor, {@code null} for the newest page
     * @param limit  page size, {@code null} for the default; clamped to [1, max]
     * @throws ResourceNotFoundException if the cursor is not a message of this chat
     */
    public MessagePage getMessages(String userId, String chatId, String before, Integer limit) {
        chatService.requireMember(chatId, userId);
        int pageSize = clamp(limit);

        Long beforeSequence = null;
        if (before != null && !before.isBlank()) {
            Message cursor = messageRepository.findById(before)
                    .filter(m -> m.getChatId().equals(chatId))
                    .orElseThrow(() -> new ResourceNotFoundException("Unknown cursor: " + before));
            beforeSequence = cursor.getSequence();
        }

        // read before the rows so the watermark never claims events the page lacks
        long lastSequence = messageRepository.lastSequence(chatId);
        List<Message> newestFirst = messageRepository.findBefore(chatId, beforeSequence, pageSize + 1);
        boolean hasMore = newestFirst.size() > pageSize;
        List<Message> page = hasMore ? newestFirst.subList(0, pageSize) : newestFirst;

        List<MessageDto> messages = new ArrayList<>(page.size());
        for (Message message : page) {
            messages.add(message.toDto());
        }
        Collections.reverse(messages);

        log.debug("Backfill chatId={} before={} limit={} returned={} hasMore={}",
                chatId, before, pageSize, messages.size(), hasMore);
        return MessagePage.builder()
                .messages(messages)
                .hasMore(hasMore)
                .nextCursor(hasMore ? messages.get(0).getId() : null)
                .lastSequence(lastSequence)
                .build();
    }

    int clamp(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        return Math.max(1, Math.min(maxLimit, limit));
    }
}
