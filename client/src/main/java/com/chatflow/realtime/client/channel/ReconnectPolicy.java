package com.chatflow.realtime.client.channel;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <pre>
 *  delay(n) = min(initialDelay · multiplier^(n-1), maxDelay) · (1 ± jitterPct)
 * </pre>
 *
 * With jitter the delay never drops below 250 ms. {@code maxAttempts == 0} retries
 * forever.
 */
@Value
@Builder
public class ReconnectPolicy {

    static final long JITTER_FLOOR_MS = 250;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    double jitterPct = 0.2;

    @Builder.Default
    int maxAttempts = 0;

    public static ReconnectPolicy defaults() {
        return ReconnectPolicy.builder().build();
    }

    /** @param attempt 1 for the first reconnect attempt */
    public long computeDelayMs(long attempt) {
        double raw = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(raw, (double) maxDelay.toMillis());

        if (jitterPct <= 0) {
            return capped;
        }
        double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitterPct, jitterPct);
        long withJitter = (long) Math.max(0, capped * factor);
        return Math.max(JITTER_FLOOR_MS, withJitter);
    }

    public boolean isExhausted(int attempt) {
        return maxAttempts > 0 && attempt > maxAttempts;
    }
}
