package com.dealrelay.core.model;

import java.util.Objects;

/** 게시글에 들어갈 최종 링크 + 생성 전략 태그 */
public record AffiliateLink(String url, LinkOrigin origin) {
    public AffiliateLink {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(origin, "origin");
    }

    public boolean commissioned() { return origin != LinkOrigin.FALLBACK; }
}
