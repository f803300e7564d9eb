package com.dealrelay.core.marketplace;

import com.dealrelay.core.model.RelayConfig;
import com.dealrelay.core.util.StructuredLog;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 마켓플레이스 제휴 API 호출 2종.
 *  - link.generate : 정리된 상품 URL → 추적 가능한 제휴 링크
 *  - productdetail.get : 상품 ID → 제목/가격 (캡션 사실 힌트)
 * 결과 목록이 비면 "없음"(empty)으로 본다. 오류 분류/재시도는 {@link SignedRequestClient} 담당.
 */
public class MarketplaceApi {

    private static final StructuredLog SLOG = StructuredLog.get(MarketplaceApi.class);

    static final String LINK_GENERATE = "aliexpress.affiliate.link.generate";
    static final String PRODUCT_DETAIL = "aliexpress.affiliate.productdetail.get";

    private final SignedRequestClient client;
    private final RelayConfig.Api cfg;

    public MarketplaceApi(SignedRequestClient client, RelayConfig.Api cfg) {
        this.client = Objects.requireNonNull(client, "client");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public Optional<String> generatePromotionLink(String cleanUrl) throws InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("promotion_link_type", cfg.promotionLinkType());
        params.put("source_values", cleanUrl);
        params.put("tracking_id", cfg.trackingId());

        ApiResult result = client.call(LINK_GENERATE, params);
        if (!(result instanceof ApiResult.Ok ok)) return Optional.empty();

        for (JsonNode link : items(ok.payload(), "promotion_links", "promotion_link")) {
            String url = text(link, "promotion_link");
            if (url != null && !url.isBlank()) return Optional.of(url.trim());
        }
        SLOG.info("api-no-link", "url", cleanUrl, "trackingId", cfg.trackingId());
        return Optional.empty();
    }

    public Optional<ProductDetails> productDetails(String productId) throws InterruptedException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("product_ids", productId);
        params.put("target_currency", cfg.targetCurrency());
        params.put("target_language", cfg.targetLanguage());
        params.put("tracking_id", cfg.trackingId());

        ApiResult result = client.call(PRODUCT_DETAIL, params);
        if (!(result instanceof ApiResult.Ok ok)) return Optional.empty();

        List<JsonNode> products = items(ok.payload(), "products", "product");
        if (products.isEmpty()) return Optional.empty();
        JsonNode p = products.get(0);
        return Optional.of(new ProductDetails(
                firstNonNull(text(p, "product_id"), productId),
                text(p, "product_title"),
                firstNonNull(text(p, "target_sale_price"), text(p, "sale_price")),
                firstNonNull(text(p, "target_sale_price_currency"), text(p, "sale_price_currency")),
                text(p, "promotion_link") != null ? text(p, "promotion_link") : text(p, "product_detail_url")));
    }

    /**
     * 응답 목록 모양 흡수:
     * {@code {outer:{inner:[...]}}}, {@code {outer:[...]}}, {@code {outer:{inner:{...}}}}(단건).
     */
    static List<JsonNode> items(JsonNode payload, String outer, String inner) {
        List<JsonNode> out = new ArrayList<>();
        if (payload == null || payload.isNull()) return out;
        JsonNode o = payload.path(outer);
        JsonNode list = o.isArray() ? o : o.path(inner);
        if (list.isArray()) {
            list.forEach(out::add);
        } else if (list.isObject()) {
            out.add(list);
        }
        return out;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isBlank() ? null : s;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
