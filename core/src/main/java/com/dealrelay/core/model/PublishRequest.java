package com.dealrelay.core.model;

/** 배달 협력자에게 넘기는 최종 게시 요청 */
public record PublishRequest(String text, String mediaRef, ProductId productId, AffiliateLink link) {
    public boolean hasMedia() { return mediaRef != null && !mediaRef.isBlank(); }
}
