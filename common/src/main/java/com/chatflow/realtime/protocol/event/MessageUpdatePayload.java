package com.chatflow.realtime.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Data of {@code message.update}. Null fields are left untouched by the receiver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageUpdatePayload {
    private String id;
    private String chatId;
    private String content;
    private Boolean edited;
    private Instant editedAt;
    private Boolean pinned;
}
