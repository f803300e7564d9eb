package com.dealrelay.core.service;

import com.dealrelay.core.model.LinkOrigin;
import com.dealrelay.core.model.PostRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 실행 1회 집계 (스레드 세이프). */
public final class RunReport {

    /** 후보를 건너뛴 이유 */
    public enum SkipReason { NO_TEXT, NO_CANDIDATE, DUPLICATE_EARLY, NO_IDENTIFIER, DUPLICATE_FINAL }

    private final AtomicInteger scanned = new AtomicInteger();
    private final AtomicInteger posted = new AtomicInteger();
    private final AtomicInteger publishFailed = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
    private final AtomicInteger channelFailures = new AtomicInteger();
    private final AtomicLong apiRetries = new AtomicLong();
    private final Map<SkipReason, AtomicInteger> skipped = new EnumMap<>(SkipReason.class);
    private final Map<LinkOrigin, AtomicInteger> origins = new EnumMap<>(LinkOrigin.class);
    private final List<PostRecord> posts = new CopyOnWriteArrayList<>();
    private volatile String stopReason = "completed";

    public RunReport() {
        for (SkipReason r : SkipReason.values()) skipped.put(r, new AtomicInteger());
        for (LinkOrigin o : LinkOrigin.values()) origins.put(o, new AtomicInteger());
    }

    void onScanned() { scanned.incrementAndGet(); }
    void onSkipped(SkipReason reason) { skipped.get(reason).incrementAndGet(); }
    void onPosted(LinkOrigin origin, PostRecord post) {
        posted.incrementAndGet();
        origins.get(origin).incrementAndGet();
        posts.add(post);
    }
    void onPublishFailed() { publishFailed.incrementAndGet(); }
    void onError() { errors.incrementAndGet(); }
    void onChannelFailed() { channelFailures.incrementAndGet(); }
    void setApiRetries(long n) { apiRetries.set(n); }
    void stoppedBecause(String reason) { this.stopReason = reason; }

    public Snapshot snapshot() {
        Map<SkipReason, Integer> s = new EnumMap<>(SkipReason.class);
        skipped.forEach((k, v) -> s.put(k, v.get()));
        Map<LinkOrigin, Integer> o = new EnumMap<>(LinkOrigin.class);
        origins.forEach((k, v) -> o.put(k, v.get()));
        return new Snapshot(scanned.get(), posted.get(), publishFailed.get(), errors.get(),
                channelFailures.get(), apiRetries.get(), Collections.unmodifiableMap(s),
                Collections.unmodifiableMap(o), List.copyOf(posts), stopReason);
    }

    /** 불변 스냅샷 */
    public record Snapshot(int scanned,
                           int posted,
                           int publishFailed,
                           int errors,
                           int channelFailures,
                           long apiRetries,
                           Map<SkipReason, Integer> skipped,
                           Map<LinkOrigin, Integer> postedByOrigin,
                           List<PostRecord> posts,
                           String stopReason) {

        public int skipped(SkipReason reason) { return skipped.getOrDefault(reason, 0); }

        public int skippedTotal() {
            return skipped.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
