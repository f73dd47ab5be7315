package com.chatflow.realtime.protocol.dto;

import com.chatflow.realtime.protocol.ChatKind;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for {@code POST /api/chats}. The caller is always added as owner, so
 * a private chat lists exactly one other member.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateChatRequest {

    @NotNull(message = "kind is required")
    private ChatKind kind;

    private String name;

    @NotEmpty(message = "memberIds must not be empty")
    @Builder.Default
    private List<String> memberIds = new ArrayList<>();
}
