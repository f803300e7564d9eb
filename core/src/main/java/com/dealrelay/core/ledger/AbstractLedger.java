package com.dealrelay.core.ledger;

import com.dealrelay.core.model.DedupMode;
import com.dealrelay.core.model.ProductId;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 공통 판정 로직: id → 마지막 게시 시각(epoch ms).
 * PERMANENT 는 한 번 보면 영원히 seen, COOLDOWN 은 창이 지나면 다시 unseen.
 * 시각을 모르는 기록(레거시 줄)은 모드와 무관하게 영원히 seen.
 */
public abstract class AbstractLedger implements Ledger {

    /** 시각 미상 기록 표시 */
    protected static final long UNKNOWN_TIME = -1L;

    private final Map<String, Long> lastSeen = new HashMap<>();
    private final DedupMode mode;
    private final Duration cooldown;
    protected final Clock clock;

    protected AbstractLedger(DedupMode mode, Duration cooldown, Clock clock) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.cooldown = cooldown == null ? Duration.ZERO : cooldown;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized boolean seen(ProductId id) {
        if (id == null) return false;
        Long at = lastSeen.get(id.value());
        if (at == null) return false;
        if (mode == DedupMode.PERMANENT || at == UNKNOWN_TIME) return true;
        return clock.millis() - at < cooldown.toMillis();
    }

    @Override
    public synchronized void record(ProductId id) {
        Objects.requireNonNull(id, "id");
        long now = clock.millis();
        lastSeen.put(id.value(), now);
        if (id.stable()) persist(id, now);
    }

    @Override
    public synchronized int size() {
        return lastSeen.size();
    }

    /** 적재 시점 기록 반영 (같은 id면 더 최근 시각 유지, 레거시 표시는 유지) */
    protected synchronized void remember(String id, long epochMillis) {
        lastSeen.merge(id, epochMillis, (old, neu) -> old == UNKNOWN_TIME || neu == UNKNOWN_TIME
                ? UNKNOWN_TIME : Math.max(old, neu));
    }

    /** 영속 저장 훅. 기본은 아무것도 하지 않음(메모리 전용). */
    protected void persist(ProductId id, long epochMillis) {
    }
}
