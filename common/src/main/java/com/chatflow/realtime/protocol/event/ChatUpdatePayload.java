package com.chatflow.realtime.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Data of {@code chat.update} and {@code chat.delete}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatUpdatePayload {
    private String chatId;
    private String name;
    private String updatedBy;
}
