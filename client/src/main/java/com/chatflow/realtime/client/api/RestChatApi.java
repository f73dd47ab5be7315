package com.chatflow.realtime.client.api;

import com.chatflow.realtime.protocol.ProtocolMapper;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link ChatApi} over the server's REST endpoints using {@link WebClient}. The bearer
 * token is read from {@code tokenSupplier} on every request so a refreshed token is
 * picked up without rebuilding the client.
 */
@Slf4j
public class RestChatApi implements ChatApi {

    private static final ParameterizedTypeReference<List<ChatSummaryDto>> CHAT_LIST =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final Supplier<String> tokenSupplier;

    public RestChatApi(WebClient.Builder builder, String baseUrl, Supplier<String> tokenSupplier) {
        ObjectMapper mapper = ProtocolMapper.create();
        this.webClient = builder
                .baseUrl(baseUrl)
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                })
                .build();
        this.tokenSupplier = tokenSupplier;
    }

    @Override
    public CompletableFuture<List<ChatSummaryDto>> getChats() {
        return webClient.get()
                .uri("/api/chats")
                .headers(this::authorize)
                .retrieve()
                .bodyToMono(CHAT_LIST)
                .toFuture();
    }

    @Override
    public CompletableFuture<MessagePage> getMessages(String chatId, String before, int limit) {
        return webClient.get()
                .uri(uri -> {
                    uri.path("/api/chats/{chatId}/messages").queryParam("limit", limit);
                    if (before != null) {
                        uri.queryParam("before", before);
                    }
                    return uri.build(chatId);
                })
                .headers(this::authorize)
                .retrieve()
                .bodyToMono(MessagePage.class)
                .toFuture();
    }

    @Override
    public CompletableFuture<MessageDto> sendMessage(SendMessageRequest request) {
        return webClient.post()
                .uri("/api/messages")
                .headers(this::authorize)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(MessageDto.class)
                .toFuture();
    }

    @Override
    public CompletableFuture<Void> markRead(String chatId) {
        return webClient.post()
                .uri("/api/chats/{chatId}/read", chatId)
                .headers(this::authorize)
                .retrieve()
                .toBodilessEntity()
                .then()
                .toFuture();
    }

    private void authorize(HttpHeaders headers) {
        String token = tokenSupplier.get();
        if (token != null) {
            headers.setBearerAuth(token);
        } else {
            log.debug("No access token available; sending unauthenticated request");
        }
    }
}
