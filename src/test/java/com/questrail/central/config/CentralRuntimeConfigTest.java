package com.questrail.central.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CentralRuntimeConfigTest {

    @Test
    void defaultsUseTenSecondsAndAwaitDeadline() {
        CentralRuntimeConfig config = CentralRuntimeConfig.defaults();

        assertEquals(Duration.ofSeconds(10), config.timingPolicy().scanTimeout());
        assertEquals(Duration.ofSeconds(10), config.timingPolicy().connectTimeout());
        assertEquals(Duration.ofSeconds(10), config.timingPolicy().disconnectTimeout());
        assertEquals(PendingRequestPolicy.AWAIT_DEADLINE, config.pendingRequestPolicy());
    }

    @Test
    void builderOverridesIndividualSettings() {
        CentralTimingPolicy timing = new CentralTimingPolicy(
                Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(2));

        CentralRuntimeConfig config = CentralRuntimeConfig.builder()
                .withTimingPolicy(timing)
                .withPendingRequestPolicy(PendingRequestPolicy.FAIL_FAST)
                .build();

        assertEquals(timing, config.timingPolicy());
        assertEquals(PendingRequestPolicy.FAIL_FAST, config.pendingRequestPolicy());
    }

    @Test
    void timingPolicyRejectsNegativeDurations() {
        assertThrows(IllegalArgumentException.class,
                () -> new CentralTimingPolicy(Duration.ofSeconds(-1), Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> CentralTimingPolicy.uniform(Duration.ofMillis(-5)));
        assertThrows(NullPointerException.class,
                () -> new CentralTimingPolicy(null, Duration.ZERO, Duration.ZERO));
    }

    @Test
    void zeroTimeoutIsAllowed() {
        assertDoesNotThrow(() -> CentralTimingPolicy.uniform(Duration.ZERO));
    }
}
