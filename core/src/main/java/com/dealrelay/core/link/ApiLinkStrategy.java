package com.dealrelay.core.link;

import com.dealrelay.core.marketplace.MarketplaceApi;
import com.dealrelay.core.model.LinkOrigin;

import java.util.Objects;
import java.util.Optional;

/** 서명 API(link.generate)로 추적 링크를 받아 온다. */
public final class ApiLinkStrategy implements LinkStrategy {

    private final MarketplaceApi api;

    public ApiLinkStrategy(MarketplaceApi api) {
        this.api = Objects.requireNonNull(api, "api");
    }

    @Override
    public Optional<String> attempt(String cleanUrl) throws InterruptedException {
        return api.generatePromotionLink(cleanUrl);
    }

    @Override
    public LinkOrigin origin() { return LinkOrigin.API; }
}
