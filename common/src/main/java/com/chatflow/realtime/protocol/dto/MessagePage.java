package com.chatflow.realtime.protocol.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One backfill page, ordered oldest-to-newest.
 *
 * <pre>
 * { "messages": [...], "has_more": true, "next_cursor": "m-17", "last_sequence": 42 }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagePage {

    @Builder.Default
    private List<MessageDto> messages = new ArrayList<>();

    @JsonProperty("has_more")
    private boolean hasMore;

    /** Identity of the oldest message in this page when more history exists. */
    @JsonProperty("next_cursor")
    private String nextCursor;

    /**
     * Room sequence committed before the page was read. Every event up to it is
     * reflected in the page, so clients use it as their gap-detection watermark.
     */
    @JsonProperty("last_sequence")
    private Long lastSequence;
}
