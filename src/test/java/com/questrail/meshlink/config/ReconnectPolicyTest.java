package com.questrail.meshlink.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReconnectPolicyTest
 * -----------------------------------------------------------------------------
 * Linear backoff and its bounds.
 */
class ReconnectPolicyTest {

    @Test
    void delayGrowsLinearlyUpToCeiling() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(5), policy.delayFor(5));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(10));
        assertEquals(Duration.ofSeconds(10), policy.delayFor(25));
    }

    @Test
    void attemptsStartAtOne() {
        assertThrows(IllegalArgumentException.class, () -> ReconnectPolicy.defaults().delayFor(0));
    }

    @Test
    void zeroBaseDelayReconnectsImmediately() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ZERO, Duration.ZERO, 1);

        assertEquals(Duration.ZERO, policy.delayFor(3));
    }

    @Test
    void rejectsInconsistentSettings() {
        assertThrows(NullPointerException.class,
                () -> new ReconnectPolicy(null, Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(-1), Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 1));
        assertThrows(IllegalArgumentException.class,
                () -> new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0));
    }
}
