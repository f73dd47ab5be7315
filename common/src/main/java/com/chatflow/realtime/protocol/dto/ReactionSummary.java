package com.chatflow.realtime.protocol.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Reactions on a message grouped by emoji. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = "count", allowGetters = true)
public class ReactionSummary {
    private String emoji;

    @Builder.Default
    private List<String> userIds = new ArrayList<>();

    public int getCount() {
        return userIds == null ? 0 : userIds.size();
    }
}
