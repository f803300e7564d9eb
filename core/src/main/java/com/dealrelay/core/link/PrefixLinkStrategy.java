package com.dealrelay.core.link;

import com.dealrelay.core.model.LinkOrigin;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/** 고정 접두어 + 퍼센트 인코딩한 상품 URL */
public final class PrefixLinkStrategy implements LinkStrategy {

    private final String prefix;

    public PrefixLinkStrategy(String prefix) {
        this.prefix = prefix == null ? "" : prefix.trim();
    }

    @Override
    public boolean usable() { return !prefix.isEmpty(); }

    @Override
    public Optional<String> attempt(String cleanUrl) {
        if (!usable() || cleanUrl == null || cleanUrl.isBlank()) return Optional.empty();
        return Optional.of(prefix + URLEncoder.encode(cleanUrl, StandardCharsets.UTF_8));
    }

    @Override
    public LinkOrigin origin() { return LinkOrigin.PREFIX; }
}
