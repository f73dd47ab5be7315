package com.chatflow.realtime.protocol.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Last-message preview shown in the chat list. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagePreview {
    private String id;
    private String content;
    private String messageType;
    private String senderId;
    private String senderName;
    private Instant createdAt;

    public static MessagePreview of(MessageDto message) {
        return MessagePreview.builder()
                .id(message.getId())
                .content(message.getContent())
                .messageType(message.getMessageType())
                .senderId(message.getSenderId())
                .senderName(message.getSenderName())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
