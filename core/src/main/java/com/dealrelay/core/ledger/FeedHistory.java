package com.dealrelay.core.ledger;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/** 목적지 피드의 최근 게시물 (HTML 본문 + 게시 시각). 최신순, 최대 limit 개. */
@FunctionalInterface
public interface FeedHistory {

    record FeedPost(String html, Instant postedAt) {}

    List<FeedPost> recent(int limit) throws IOException;
}
