package com.dealrelay.core.ledger;

import com.dealrelay.core.model.DedupMode;

import java.time.Clock;
import java.time.Duration;

/** 실행 범위 원장. 해시 id 를 포함한 모든 id 를 받는다. */
public final class InMemoryLedger extends AbstractLedger {

    public InMemoryLedger() {
        this(DedupMode.PERMANENT, Duration.ZERO, Clock.systemUTC());
    }

    public InMemoryLedger(DedupMode mode, Duration cooldown, Clock clock) {
        super(mode, cooldown, clock);
    }
}
