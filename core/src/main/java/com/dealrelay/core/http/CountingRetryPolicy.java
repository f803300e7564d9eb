package com.dealrelay.core.http;

import com.dealrelay.core.marketplace.ApiErrorKind;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/** RetryPolicy를 감싸 실행 전체의 재시도 횟수를 집계하는 얇은 데코레이터 (RunReport 용). */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final AtomicLong retries = new AtomicLong();

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(ApiErrorKind kind, int attempt) {
        boolean ok = delegate.shouldRetry(kind, attempt);
        if (ok) retries.incrementAndGet();
        return ok;
    }

    @Override
    public Duration nextDelay(int attempt) {
        return delegate.nextDelay(attempt);
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public long getRetryCount() {
        return retries.get();
    }
}
