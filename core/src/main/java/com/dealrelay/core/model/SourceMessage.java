package com.dealrelay.core.model;

import java.time.Instant;

/**
 * 소스 채널에서 읽어 온 원본 메시지 1건.
 * 파이프라인은 text만 해석하고 mediaRef는 배달 쪽으로 그대로 넘긴다.
 */
public record SourceMessage(String channel, String text, String mediaRef, long viewCount, Instant timestamp) {

    public boolean hasText() { return text != null && !text.isBlank(); }

    public boolean hasMedia() { return mediaRef != null && !mediaRef.isBlank(); }

    public static SourceMessage text(String channel, String text) {
        return new SourceMessage(channel, text, null, 0L, Instant.EPOCH);
    }
}
