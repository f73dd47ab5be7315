package com.chatflow.realtime.client.api;

import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * REST operations the client store depends on. Futures complete exceptionally with the
 * underlying HTTP error; callers decide how a failure maps to state.
 */
public interface ChatApi {

    CompletableFuture<List<ChatSummaryDto>> getChats();

    /**
     * @param before identity of the oldest message already held, {@code null} for the
     *               newest page
     */
    CompletableFuture<MessagePage> getMessages(String chatId, String before, int limit);

    CompletableFuture<MessageDto> sendMessage(SendMessageRequest request);

    CompletableFuture<Void> markRead(String chatId);
}
