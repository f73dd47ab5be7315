package com.chatflow.realtime.protocol;

/**
 * STOMP endpoint and destinations shared by server and client.
 *
 * <pre>
 * endpoint            /ws/sync?token=&lt;jwt&gt;
 * client → server     /app/chat.subscribe, /app/chat.unsubscribe, /app/typing.start,
 *                     /app/typing.stop, /app/message.read, /app/ping
 * server → client     /user/queue/events
 * </pre>
 */
public final class SyncDestinations {

    public static final String ENDPOINT = "/ws/sync";
    public static final String TOKEN_PARAM = "token";

    public static final String APP_PREFIX = "/app";
    public static final String USER_PREFIX = "/user";
    public static final String EVENTS_QUEUE = "/queue/events";
    public static final String USER_EVENTS = USER_PREFIX + EVENTS_QUEUE;

    public static final String SUBSCRIBE = "chat.subscribe";
    public static final String UNSUBSCRIBE = "chat.unsubscribe";
    public static final String TYPING_START = "typing.start";
    public static final String TYPING_STOP = "typing.stop";
    public static final String MESSAGE_READ = "message.read";
    public static final String PING = "ping";

    private SyncDestinations() {
    }

    public static String app(String command) {
        return APP_PREFIX + "/" + command;
    }
}
