package com.chatflow.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery lifecycle of a message: {@code sending → sent → delivered → read}, or
 * {@code failed}.
 */
public enum DeliveryStatus {
    SENDING,
    SENT,
    DELIVERED,
    READ,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DeliveryStatus fromWireName(String value) {
        return value == null ? null : valueOf(value.toUpperCase(Locale.ROOT));
    }

    /** Whether moving to {@code next} is a forward step in the lifecycle. */
    public boolean canAdvanceTo(DeliveryStatus next) {
        if (next == null || next == this) {
            return false;
        }
        if (this == FAILED) {
            return next == SENDING;
        }
        if (next == FAILED) {
            return this == SENDING;
        }
        return next.ordinal() > ordinal();
    }
}
