package com.chatflow.realtime.client;

import com.chatflow.realtime.client.channel.ChannelTransport;
import com.chatflow.realtime.client.channel.TransportListener;
import com.chatflow.realtime.protocol.event.ChatCommand;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/** In-memory transport: tests complete opens, inject frames and drop the connection. */
public class FakeTransport implements ChannelTransport {

    public final List<Attempt> attempts = new ArrayList<>();
    public final List<Frame> sent = new ArrayList<>();
    public int closeCount;
    public boolean open;
    public boolean failSends;

    @Override
    public CompletableFuture<Void> open(String token, TransportListener listener) {
        Attempt attempt = new Attempt(token, listener);
        attempts.add(attempt);
        return attempt.result;
    }

    @Override
    public void send(String command, Object payload) {
        if (!open || failSends) {
            throw new IllegalStateException("transport not open");
        }
        sent.add(new Frame(command, payload));
    }

    @Override
    public void close() {
        open = false;
        closeCount++;
    }

    public Attempt lastAttempt() {
        return attempts.get(attempts.size() - 1);
    }

    /** Completes the newest open attempt successfully. */
    public void acceptLast() {
        open = true;
        lastAttempt().result.complete(null);
    }

    public void rejectLast(Throwable cause) {
        lastAttempt().result.completeExceptionally(cause);
    }

    public List<String> commands() {
        return sent.stream().map(f -> f.command).collect(Collectors.toList());
    }

    /** {@code command:chatId} for every sent frame with a chat command body. */
    public List<String> chatCommands() {
        return sent.stream()
                .filter(f -> f.payload instanceof ChatCommand)
                .map(f -> f.command + ":" + ((ChatCommand) f.payload).getChatId())
                .collect(Collectors.toList());
    }

    public static final class Attempt {
        public final String token;
        public final TransportListener listener;
        public final CompletableFuture<Void> result = new CompletableFuture<>();

        private Attempt(String token, TransportListener listener) {
            this.token = token;
            this.listener = listener;
        }
    }

    public static final class Frame {
        public final String command;
        public final Object payload;

        private Frame(String command, Object payload) {
            this.command = command;
            this.payload = payload;
        }
    }
}
