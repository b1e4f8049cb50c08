package br.edu.ifba.meetingrag.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BackoffPolicyTest {

    @Test
    @DisplayName("delays grow geometrically from the base delay")
    void delaysGrowGeometrically() {
        final BackoffPolicy policy = BackoffPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.delayAfter(1));
        assertEquals(Duration.ofSeconds(2), policy.delayAfter(2));
        assertEquals(Duration.ofSeconds(4), policy.delayAfter(3));
    }

    @Test
    void delaysAreCappedAtMaxDelay() {
        final BackoffPolicy policy = new BackoffPolicy(10, Duration.ofSeconds(1), 10.0, Duration.ofSeconds(30));

        assertEquals(Duration.ofSeconds(10), policy.delayAfter(2));
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(3));
        assertEquals(Duration.ofSeconds(30), policy.delayAfter(500));
    }

    @Test
    void noDelayBeforeFirstAttempt() {
        assertEquals(Duration.ZERO, BackoffPolicy.defaults().delayAfter(0));
    }

    @Test
    void exhaustedOnceAttemptsReachCeiling() {
        final BackoffPolicy policy = BackoffPolicy.defaults();

        assertFalse(policy.isExhausted(2));
        assertTrue(policy.isExhausted(3));
        assertTrue(policy.isExhausted(4));
    }

    @Test
    void immediatePolicyNeverWaits() {
        final BackoffPolicy policy = BackoffPolicy.immediate(4);

        assertEquals(Duration.ZERO, policy.delayAfter(3));
        assertEquals(4, policy.maxAttempts());
    }

    @Test
    void rejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(0, Duration.ofSeconds(1), 2.0, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(3, Duration.ofSeconds(1), 0.5, Duration.ofMinutes(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(3, Duration.ofMinutes(2), 2.0, Duration.ofMinutes(1)));
    }
}
