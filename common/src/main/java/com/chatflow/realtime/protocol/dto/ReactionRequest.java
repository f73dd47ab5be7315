package com.chatflow.realtime.protocol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request body for {@code POST /api/messages/{id}/reactions}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReactionRequest {

    @NotBlank(message = "emoji is required")
    private String emoji;

    /** "add" or "remove". */
    @Pattern(regexp = "add|remove", message = "action must be 'add' or 'remove'")
    private String action = "add";
}
