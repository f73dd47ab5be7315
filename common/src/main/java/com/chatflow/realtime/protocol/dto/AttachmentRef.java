package com.chatflow.realtime.protocol.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Reference to media held by the external storage service. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachmentRef {
    private String id;
    private String fileName;
    private String fileUrl;
    private String fileType;
    private long fileSize;
}
