package com.chatflow.realtime.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a client command sent to {@code /app/chat.subscribe},
 * {@code /app/typing.start}, {@code /app/message.read} and friends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCommand {
    private String chatId;
    private String messageId;

    public static ChatCommand forChat(String chatId) {
        return ChatCommand.builder().chatId(chatId).build();
    }
}
