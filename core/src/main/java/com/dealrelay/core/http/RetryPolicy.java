package com.dealrelay.core.http;

import com.dealrelay.core.marketplace.ApiErrorKind;

import java.time.Duration;

/** 재시도 조건/지연을 결정하는 정책. 서명 API 호출 전 구간이 같은 정책을 공유한다. */
public interface RetryPolicy {
    /** attempt는 1부터 시작(현재 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(ApiErrorKind kind, int attempt);
    /** attempt에 해당하는 다음 지연 시간. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). 예: 3이면 최대 3번 시도. */
    int maxAttempts();
}
