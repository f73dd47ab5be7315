package com.chatflow.realtime.protocol.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request body for {@code PUT /api/messages/{id}}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EditMessageRequest {

    @NotBlank(message = "Message content must not be blank")
    @Size(max = SendMessageRequest.MAX_CONTENT_LENGTH, message = "Message content must be at most 4000 characters")
    private String content;
}
