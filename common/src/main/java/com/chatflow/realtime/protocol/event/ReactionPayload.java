package com.chatflow.realtime.protocol.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Data of {@code message.reaction}; {@code action} is "add" or "remove". */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactionPayload {

    public static final String ADD = "add";
    public static final String REMOVE = "remove";

    private String messageId;
    private String chatId;
    private String userId;
    private String emoji;
    private String action;

    public boolean isAdd() {
        return ADD.equals(action);
    }
}
