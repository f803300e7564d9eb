package com.dealrelay.core.ledger;

import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.util.ConfigException;

import java.time.Clock;
import java.util.Objects;

/** 설정 → 원장 구현 선택 */
public final class Ledgers {

    private Ledgers() {}

    public static Ledger create(RelayConfig.Ledger cfg, Clock clock) {
        return create(cfg, clock, null);
    }

    /** FEED 타입은 피드 이력 공급자가 있어야 한다. */
    public static Ledger create(RelayConfig.Ledger cfg, Clock clock, FeedHistory history) {
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(clock, "clock");
        return switch (cfg.type()) {
            case MEMORY -> new InMemoryLedger(cfg.mode(), cfg.cooldown(), clock);
            case FILE -> new FileLedger(cfg.path(), cfg.mode(), cfg.cooldown(), clock);
            case FEED -> {
                if (history == null) {
                    throw new ConfigException("ledger.type=FEED needs a feed history reader for the destination");
                }
                yield new FeedScanLedger(history, cfg.feedLookback(), cfg.mode(), cfg.cooldown(), clock);
            }
        };
    }
}
