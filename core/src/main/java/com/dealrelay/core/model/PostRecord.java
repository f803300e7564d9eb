package com.dealrelay.core.model;

import java.time.Instant;

/** 게시 성공 1건 (상품 ID, 게시 시각, 출처 채널). 실행 보고서에 쌓인다. */
public record PostRecord(String productId, Instant postedAt, String channel) {}
