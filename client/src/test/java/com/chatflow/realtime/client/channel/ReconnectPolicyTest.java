package com.chatflow.realtime.client.channel;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ReconnectPolicyTest {

    @Test
    void delayGrowsExponentiallyUpToTheCap() {
        ReconnectPolicy policy = ReconnectPolicy.builder()
                .initialDelay(Duration.ofMillis(500))
                .maxDelay(Duration.ofSeconds(5))
                .jitterPct(0)
                .build();

        assertThat(policy.computeDelayMs(1)).isEqualTo(500L);
        assertThat(policy.computeDelayMs(2)).isEqualTo(1000L);
        assertThat(policy.computeDelayMs(4)).isEqualTo(4000L);
        assertThat(policy.computeDelayMs(5)).isEqualTo(5000L);
        assertThat(policy.computeDelayMs(40)).isEqualTo(5000L);
    }

    @Test
    void jitterStaysWithinBoundsAndAboveFloor() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();
        for (int i = 0; i < 200; i++) {
            assertThat(policy.computeDelayMs(3)).isBetween(3200L, 4800L);
        }

        ReconnectPolicy tiny = ReconnectPolicy.builder().initialDelay(Duration.ofMillis(10)).build();
        for (int i = 0; i < 50; i++) {
            assertThat(tiny.computeDelayMs(1)).isEqualTo(ReconnectPolicy.JITTER_FLOOR_MS);
        }
    }

    @Test
    void zeroMaxAttemptsNeverExhausts() {
        assertThat(ReconnectPolicy.defaults().isExhausted(10_000)).isFalse();

        ReconnectPolicy limited = ReconnectPolicy.builder().maxAttempts(3).build();
        assertThat(limited.isExhausted(3)).isFalse();
        assertThat(limited.isExhausted(4)).isTrue();
    }
}
