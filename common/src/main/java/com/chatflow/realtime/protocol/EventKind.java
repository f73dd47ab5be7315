package com.chatflow.realtime.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every event kind carried in an {@link Envelope}, keyed by its wire name.
 *
 * <p>
 * {@code CONNECT}, {@code PING} and {@code PONG} are channel-level frames; they are
 * consumed by the session channel and never reach application handlers.
 */
public enum EventKind {

    CONNECT("connect"),
    DISCONNECT("disconnect"),
    PING("ping"),
    PONG("pong"),

    MESSAGE_NEW("message.new"),
    MESSAGE_UPDATE("message.update"),
    MESSAGE_DELETE("message.delete"),
    MESSAGE_REACTION("message.reaction"),
    MESSAGE_READ("message.read"),

    TYPING_START("typing.start"),
    TYPING_STOP("typing.stop"),

    USER_ONLINE("user.online"),
    USER_OFFLINE("user.offline"),
    USER_STATUS("user.status"),

    CHAT_NEW("chat.new"),
    CHAT_UPDATE("chat.update"),
    CHAT_DELETE("chat.delete"),
    CHAT_MEMBER_JOIN("chat.member.join"),
    CHAT_MEMBER_LEAVE("chat.member.leave"),

    NOTIFICATION("notification"),
    ERROR("error");

    private static final Map<String, EventKind> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toMap(EventKind::wireName, Function.identity()));

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** True for frames that only concern the channel itself. */
    public boolean isChannelControl() {
        return this == CONNECT || this == DISCONNECT || this == PING || this == PONG;
    }

    /**
     * Resolves a wire name; unknown names map to {@code null} so that a newer server
     * never breaks an older client.
     */
    @JsonCreator
    public static EventKind fromWireName(String wireName) {
        return wireName == null ? null : BY_WIRE_NAME.get(wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
