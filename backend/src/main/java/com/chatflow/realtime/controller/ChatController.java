package com.chatflow.realtime.controller;

import com.chatflow.realtime.backfill.BackfillService;
import com.chatflow.realtime.protocol.dto.AddMemberRequest;
import com.chatflow.realtime.protocol.dto.ChatSummaryDto;
import com.chatflow.realtime.protocol.dto.CreateChatRequest;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.MessagePage;
import com.chatflow.realtime.protocol.dto.RenameChatRequest;
import com.chatflow.realtime.protocol.event.ReadReceiptPayload;
import com.chatflow.realtime.security.ChatPrincipal;
import com.chatflow.realtime.service.ChatService;
import com.chatflow.realtime.service.MessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * ChatController exposes the chat list, chat administration, message history
 * (backfill) and read markers.
 */
@Slf4j
@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:3000" })
public class ChatController {

    private final ChatService chatService;
    private final MessageService messageService;
    private final BackfillService backfillService;

    // ── GET /api/chats ────────────────────────────────────────────────────

    @GetMapping
    public List<ChatSummaryDto> listChats(@AuthenticationPrincipal ChatPrincipal principal) {
        return chatService.listChats(principal.getUserId());
    }

    @GetMapping("/{chatId}")
    public ChatSummaryDto getChat(@AuthenticationPrincipal ChatPrincipal principal, @PathVariable String chatId) {
        return chatService.getChat(principal.getUserId(), chatId);
    }

    // ── POST /api/chats ───────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<ChatSummaryDto> createChat(@AuthenticationPrincipal ChatPrincipal principal,
                                                     @Valid @RequestBody CreateChatRequest request) {
        log.info("Create chat: kind={} by userId={}", request.getKind(), principal.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(chatService.createChat(principal, request));
    }

    @PatchMapping("/{chatId}")
    public ChatSummaryDto renameChat(@AuthenticationPrincipal ChatPrincipal principal,
                                     @PathVariable String chatId,
                                     @Valid @RequestBody RenameChatRequest request) {
        return chatService.renameChat(principal.getUserId(), chatId, request.getName());
    }

    @DeleteMapping("/{chatId}")
    public ResponseEntity<Void> deleteChat(@AuthenticationPrincipal ChatPrincipal principal,
                                           @PathVariable String chatId) {
        chatService.deleteChat(principal.getUserId(), chatId);
        return ResponseEntity.noContent().build();
    }

    // ── Members ───────────────────────────────────────────────────────────

    @PostMapping("/{chatId}/members")
    public ChatSummaryDto addMember(@AuthenticationPrincipal ChatPrincipal principal,
                                    @PathVariable String chatId,
                                    @Valid @RequestBody AddMemberRequest request) {
        return chatService.addMember(principal.getUserId(), chatId, request.getUserId());
    }

    @DeleteMapping("/{chatId}/members/{userId}")
    public ResponseEntity<Void> removeMember(@AuthenticationPrincipal ChatPrincipal principal,
                                             @PathVariable String chatId,
                                             @PathVariable String userId) {
        chatService.removeMember(principal.getUserId(), chatId, userId);
        return ResponseEntity.noContent().build();
    }

    // ── GET /api/chats/{chatId}/messages?before=&limit= ───────────────────

    @GetMapping("/{chatId}/messages")
    public MessagePage getMessages(@AuthenticationPrincipal ChatPrincipal principal,
                                   @PathVariable String chatId,
                                   @RequestParam(required = false) String before,
                                   @RequestParam(required = false) Integer limit) {
        return backfillService.getMessages(principal.getUserId(), chatId, before, limit);
    }

    @GetMapping("/{chatId}/pinned")
    public List<MessageDto> getPinned(@AuthenticationPrincipal ChatPrincipal principal,
                                      @PathVariable String chatId) {
        return messageService.pinned(principal.getUserId(), chatId);
    }

    // ── POST /api/chats/{chatId}/read ─────────────────────────────────────

    @PostMapping("/{chatId}/read")
    public ReadReceiptPayload markRead(@AuthenticationPrincipal ChatPrincipal principal,
                                       @PathVariable String chatId,
                                       @RequestParam(required = false) String messageId) {
        return messageService.markRead(principal.getUserId(), chatId, messageId);
    }
}
