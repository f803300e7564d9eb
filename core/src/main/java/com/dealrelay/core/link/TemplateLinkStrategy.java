package com.dealrelay.core.link;

import com.dealrelay.core.model.LinkOrigin;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * 제휴 포털 템플릿: {@code {url}} 자리에 퍼센트 인코딩한 상품 URL을 끼운다.
 * 자리표시자가 없는 템플릿은 쓸 수 없음(usable=false).
 */
public final class TemplateLinkStrategy implements LinkStrategy {

    static final String PLACEHOLDER = "{url}";

    private final String template;

    public TemplateLinkStrategy(String template) {
        this.template = template == null ? "" : template.trim();
    }

    @Override
    public boolean usable() {
        return template.contains(PLACEHOLDER);
    }

    @Override
    public Optional<String> attempt(String cleanUrl) {
        if (!usable() || cleanUrl == null || cleanUrl.isBlank()) return Optional.empty();
        return Optional.of(template.replace(PLACEHOLDER, URLEncoder.encode(cleanUrl, StandardCharsets.UTF_8)));
    }

    @Override
    public LinkOrigin origin() { return LinkOrigin.TEMPLATE; }
}
