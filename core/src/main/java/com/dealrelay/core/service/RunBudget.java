package com.dealrelay.core.service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/** per-run 게시 횟수/벽시계 예산. 매 반복 맨 앞에서 확인한다. */
public final class RunBudget {
    private final AtomicInteger posted = new AtomicInteger();
    private final int maxPosts;
    private final long deadlineEpochMs; // 0 이하면 시간 제한 없음
    private final Clock clock;

    public RunBudget(int maxPostsPerRun, Duration maxRunTime, Clock clock) {
        this.maxPosts = Math.max(1, maxPostsPerRun);
        this.clock = clock;
        long budgetMs = (maxRunTime == null) ? 0 : maxRunTime.toMillis();
        this.deadlineEpochMs = budgetMs > 0 ? clock.millis() + budgetMs : 0;
    }

    /** 예산이 남아 있으면 true */
    public boolean hasRoom() {
        return !postsExhausted() && !timeExhausted();
    }

    public boolean postsExhausted() { return posted.get() >= maxPosts; }

    public boolean timeExhausted() {
        return deadlineEpochMs > 0 && clock.millis() >= deadlineEpochMs;
    }

    public void onPosted() { posted.incrementAndGet(); }

    public int posted() { return posted.get(); }
    public int remaining() { return Math.max(0, maxPosts - posted()); }
}
