package com.dealrelay.core.http;

import com.dealrelay.core.marketplace.ApiErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldRetry_onlyOnTransient_and_respect_maxAttempts_3() {
        var p = new DefaultRetryPolicy();

        assertEquals(3, p.maxAttempts(), "maxAttempts must be 3");

        assertTrue(p.shouldRetry(ApiErrorKind.TRANSIENT, 1), "first transient failure is retried");
        assertTrue(p.shouldRetry(ApiErrorKind.TRANSIENT, 2), "second transient failure is retried");
        assertFalse(p.shouldRetry(ApiErrorKind.TRANSIENT, 3), "must stop retrying at attempt=3");

        for (ApiErrorKind k : new ApiErrorKind[]{ApiErrorKind.AUTH, ApiErrorKind.BUSINESS, ApiErrorKind.MALFORMED}) {
            assertFalse(p.shouldRetry(k, 1), "must not retry " + k);
        }
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy();

        // 500 → 1000 → 2000 (ms), each with ±10% jitter
        assertBetween(p.nextDelay(1).toMillis(), 450, 550, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 900, 1100, "attempt=2 backoff");
        assertBetween(p.nextDelay(3).toMillis(), 1800, 2200, "attempt=3 backoff");
    }

    @Test
    void of_usesConfiguredBase_and_clampsAttempts() {
        var p = DefaultRetryPolicy.of(0, Duration.ofMillis(100));
        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(ApiErrorKind.TRANSIENT, 1));
        assertBetween(p.nextDelay(1).toMillis(), 90, 110, "base=100");
    }

    @Test
    void counting_tracksOnlyGrantedRetries() {
        var counting = new CountingRetryPolicy(new DefaultRetryPolicy(3, 10));
        counting.shouldRetry(ApiErrorKind.TRANSIENT, 1);
        counting.shouldRetry(ApiErrorKind.TRANSIENT, 2);
        counting.shouldRetry(ApiErrorKind.TRANSIENT, 3); // 거절
        counting.shouldRetry(ApiErrorKind.AUTH, 1);      // 거절
        assertEquals(2, counting.getRetryCount());
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}
