package com.dealrelay.core.http;

import com.dealrelay.core.marketplace.ApiErrorKind;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * TRANSIENT(전송 오류/타임아웃/비JSON/429·5xx)에서만 재시도.
 * 서명·인증·비즈니스 오류는 다시 보내도 성공하지 않고 쿼터만 소모하므로 즉시 중단.
 * 지연: base → 2·base → 4·base (±10% Jitter)
 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 500); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
    }

    public static DefaultRetryPolicy of(int maxAttempts, Duration base) {
        return new DefaultRetryPolicy(maxAttempts, base == null ? 500 : base.toMillis());
    }

    @Override public boolean shouldRetry(ApiErrorKind kind, int attempt) {
        if (attempt >= maxAttempts) return false;
        return kind == ApiErrorKind.TRANSIENT;
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(10, Math.max(0, attempt - 1));
        long raw = baseMillis * pow;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
