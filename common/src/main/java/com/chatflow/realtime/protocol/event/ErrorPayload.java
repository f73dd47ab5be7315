package com.chatflow.realtime.protocol.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Data of {@code error}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPayload {
    private String code;
    private String message;
}
