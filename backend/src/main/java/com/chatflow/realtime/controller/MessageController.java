package com.chatflow.realtime.controller;

import com.chatflow.realtime.protocol.dto.EditMessageRequest;
import com.chatflow.realtime.protocol.dto.MessageDto;
import com.chatflow.realtime.protocol.dto.ReactionRequest;
import com.chatflow.realtime.protocol.dto.SendMessageRequest;
import com.chatflow.realtime.security.ChatPrincipal;
import com.chatflow.realtime.service.MessageService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * MessageController accepts message sends and mutations. The returned message is the
 * canonical copy (server id and room sequence); the same data reaches subscribers as a
 * room event.
 */
@RestController
@RequestMapping("/api/messages")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:3000" })
public class MessageController {

    private final MessageService messageService;

    @PostMapping
    public ResponseEntity<MessageDto> send(@AuthenticationPrincipal ChatPrincipal principal,
                                           @Valid @RequestBody SendMessageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(messageService.send(principal, request));
    }

    @PutMapping("/{messageId}")
    public MessageDto edit(@AuthenticationPrincipal ChatPrincipal principal,
                           @PathVariable String messageId,
                           @Valid @RequestBody EditMessageRequest request) {
        return messageService.edit(principal.getUserId(), messageId, request.getContent());
    }

    @DeleteMapping("/{messageId}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal ChatPrincipal principal,
                                       @PathVariable String messageId) {
        messageService.delete(principal.getUserId(), messageId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{messageId}/reactions")
    public MessageDto react(@AuthenticationPrincipal ChatPrincipal principal,
                            @PathVariable String messageId,
                            @Valid @RequestBody ReactionRequest request) {
        return messageService.react(principal.getUserId(), messageId, request);
    }

    @PostMapping("/{messageId}/pin")
    public MessageDto togglePin(@AuthenticationPrincipal ChatPrincipal principal,
                                @PathVariable String messageId) {
        return messageService.togglePin(principal.getUserId(), messageId);
    }
}
