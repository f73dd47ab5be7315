package com.chatflow.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatKind {
    PRIVATE,
    GROUP,
    BROADCAST;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChatKind fromWireName(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }
}
