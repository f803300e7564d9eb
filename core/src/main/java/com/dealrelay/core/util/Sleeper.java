package com.dealrelay.core.util;

import java.time.Duration;

/** 재시도 백오프/게시 간격 대기 훅. 테스트에서는 기록용 구현으로 대체. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
