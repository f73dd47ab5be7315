package com.chatflow.realtime.controller;

import com.chatflow.realtime.exception.ChatAccessDeniedException;
import com.chatflow.realtime.exception.InvalidRequestException;
import com.chatflow.realtime.exception.ResourceNotFoundException;
import com.chatflow.realtime.hub.FanoutHub;
import com.chatflow.realtime.hub.SubscriptionRegistry;
import com.chatflow.realtime.protocol.EventKind;
import com.chatflow.realtime.protocol.MessageValidationException;
import com.chatflow.realtime.protocol.SyncDestinations;
import com.chatflow.realtime.protocol.event.ChatCommand;
import com.chatflow.realtime.protocol.event.ErrorPayload;
import com.chatflow.realtime.security.ChatPrincipal;
import com.chatflow.realtime.service.ChatService;
import com.chatflow.realtime.service.MessageService;
import com.chatflow.realtime.typing.TypingMirror;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.security.Principal;

/**
 * Client → server commands over STOMP ({@code /app/*}). Replies and failures go back
 * to the sending session only, as envelopes on {@code /user/queue/events}.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class SyncSocketController {

    private final SubscriptionRegistry registry;
    private final ChatService chatService;
    private final MessageService messageService;
    private final TypingMirror typingMirror;
    private final FanoutHub hub;

    // ── /app/chat.subscribe, /app/chat.unsubscribe ────────────────────────

    @MessageMapping(SyncDestinations.SUBSCRIBE)
    public void subscribe(@Payload ChatCommand command, SimpMessageHeaderAccessor headers, Principal principal) {
        ChatPrincipal user = chatPrincipal(principal);
        chatService.requireMember(command.getChatId(), user.getUserId());
        if (!registry.subscribe(headers.getSessionId(), command.getChatId())) {
            log.warn("Subscribe for unknown sessionId={} chatId={}", headers.getSessionId(), command.getChatId());
        }
    }

    @MessageMapping(SyncDestinations.UNSUBSCRIBE)
    public void unsubscribe(@Payload ChatCommand command, SimpMessageHeaderAccessor headers) {
        registry.unsubscribe(headers.getSessionId(), command.getChatId());
    }

    // ── /app/typing.start, /app/typing.stop ───────────────────────────────

    @MessageMapping(SyncDestinations.TYPING_START)
    public void typingStart(@Payload ChatCommand command, SimpMessageHeaderAccessor headers, Principal principal) {
        ChatPrincipal user = chatPrincipal(principal);
        chatService.requireMember(command.getChatId(), user.getUserId());
        typingMirror.start(command.getChatId(), user.getUserId(), user.getDisplayName(), headers.getSessionId());
    }

    @MessageMapping(SyncDestinations.TYPING_STOP)
    public void typingStop(@Payload ChatCommand command, Principal principal) {
        typingMirror.stop(command.getChatId(), chatPrincipal(principal).getUserId());
    }

    // ── /app/message.read ─────────────────────────────────────────────────

    @MessageMapping(SyncDestinations.MESSAGE_READ)
    public void messageRead(@Payload ChatCommand command, Principal principal) {
        messageService.markRead(chatPrincipal(principal).getUserId(), command.getChatId(), command.getMessageId());
    }

    // ── /app/ping ─────────────────────────────────────────────────────────

    @MessageMapping(SyncDestinations.PING)
    public void ping(SimpMessageHeaderAccessor headers) {
        hub.sendToSession(headers.getSessionId(), EventKind.PONG, null, null);
    }

    // ── Errors ────────────────────────────────────────────────────────────

    @MessageExceptionHandler
    public void handleError(Exception ex, SimpMessageHeaderAccessor headers) {
        String code;
        String message = ex.getMessage();
        if (ex instanceof ChatAccessDeniedException) {
            code = "CHAT_ACCESS_DENIED";
        } else if (ex instanceof ResourceNotFoundException) {
            code = "NOT_FOUND";
        } else if (ex instanceof MessageValidationException || ex instanceof InvalidRequestException) {
            code = "VALIDATION_FAILED";
        } else {
            log.error("STOMP command failed: sessionId={} destination={}",
                    headers.getSessionId(), headers.getDestination(), ex);
            code = "INTERNAL_ERROR";
            message = "An unexpected error occurred.";
        }
        log.debug("STOMP command rejected: sessionId={} code={} message={}", headers.getSessionId(), code, message);
        hub.sendToSession(headers.getSessionId(), EventKind.ERROR, null,
                ErrorPayload.builder().code(code).message(message).build());
    }

    private static ChatPrincipal chatPrincipal(Principal principal) {
        if (principal instanceof ChatPrincipal) {
            return (ChatPrincipal) principal;
        }
        throw new ChatAccessDeniedException("Not authenticated");
    }
}
