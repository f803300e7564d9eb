package com.dealrelay.core.link;

import com.dealrelay.core.model.AffiliateLink;
import com.dealrelay.core.model.LinkOrigin;
import com.dealrelay.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 전략 체인: API → 템플릿 → 접두어 → (마지막) 정리된 원본 URL.
 * 각 전략의 후보는 상품 링크 검사를 통과해야 채택된다. 한 전략의 실패/거절은 다음 전략을 막지 않으며
 * 결과는 절대 비어 있지 않다.
 */
public final class AffiliateLinkBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AffiliateLinkBuilder.class);
    private static final StructuredLog SLOG = StructuredLog.get(AffiliateLinkBuilder.class);

    private final List<LinkStrategy> strategies;
    private final ProductLinkValidator validator;

    public AffiliateLinkBuilder(List<LinkStrategy> strategies, ProductLinkValidator validator) {
        Objects.requireNonNull(strategies, "strategies");
        this.validator = Objects.requireNonNull(validator, "validator");
        List<LinkStrategy> active = new ArrayList<>();
        for (LinkStrategy s : strategies) {
            if (s == null) continue;
            if (s.usable()) {
                active.add(s);
            } else {
                LOG.warn("Link strategy {} is not configured; skipping it", s.origin());
            }
        }
        this.strategies = List.copyOf(active);
    }

    public List<LinkOrigin> activeOrigins() {
        return strategies.stream().map(LinkStrategy::origin).toList();
    }

    public AffiliateLink build(String cleanUrl) throws InterruptedException {
        Objects.requireNonNull(cleanUrl, "cleanUrl");
        for (LinkStrategy s : strategies) {
            Optional<String> candidate;
            try {
                candidate = s.attempt(cleanUrl);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (RuntimeException e) {
                SLOG.warn("strategy-failed", "strategy", s.origin().name(), "url", cleanUrl,
                        "error", e.getClass().getSimpleName(), "message", e.getMessage());
                continue;
            }
            if (candidate.isEmpty()) {
                SLOG.debug("strategy-empty", "strategy", s.origin().name(), "url", cleanUrl);
                continue;
            }
            String link = candidate.get();
            if (!validator.isProductLink(link)) {
                SLOG.warn("strategy-rejected", "strategy", s.origin().name(), "url", cleanUrl, "candidate", link);
                continue;
            }
            return new AffiliateLink(link, s.origin());
        }
        SLOG.warn("link-fallback", "url", cleanUrl, "tried", strategies.size());
        return new AffiliateLink(cleanUrl, LinkOrigin.FALLBACK);
    }
}
