package com.dealrelay.core.marketplace;

import java.util.Objects;

/** 공급자 진단 메시지를 그대로 담는 오류 값 */
public record ApiError(ApiErrorKind kind, String code, String message, String raw) {
    public ApiError {
        Objects.requireNonNull(kind, "kind");
        code = code == null ? "" : code;
        message = message == null ? "" : message;
        raw = raw == null ? "" : raw;
    }

    public static ApiError transientError(String message) {
        return new ApiError(ApiErrorKind.TRANSIENT, "", message, "");
    }

    public boolean retryable() { return kind == ApiErrorKind.TRANSIENT; }
}
