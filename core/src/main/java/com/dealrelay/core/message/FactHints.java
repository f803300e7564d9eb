package com.dealrelay.core.message;

import com.dealrelay.core.marketplace.ProductDetails;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 캡션 작성기에 넘기는 사실 힌트 (가격/상품명).
 * 원문에 보이는 가격(₪, $, €)을 우선하고, 상품 상세 조회 결과가 있으면 빈 칸만 채운다.
 */
public record FactHints(String price, String title) {

    public static final FactHints NONE = new FactHints(null, null);

    private static final Pattern PRICE = Pattern.compile(
            "(?:[₪$€]\\s?\\d+(?:[.,]\\d{1,2})?)|(?:\\d+(?:[.,]\\d{1,2})?\\s?[₪$€])");

    public static FactHints fromText(String text) {
        if (text == null || text.isBlank()) return NONE;
        Matcher m = PRICE.matcher(text);
        return m.find() ? new FactHints(m.group().replaceAll("\\s+", ""), null) : NONE;
    }

    public FactHints withDetails(ProductDetails details) {
        if (details == null) return this;
        String p = price != null ? price : blankToNull(details.priceHint());
        String t = title != null ? title : blankToNull(details.title());
        return new FactHints(p, t);
    }

    public boolean isEmpty() { return price == null && title == null; }

    /** 프롬프트용 key → value (비어 있는 값은 뺀다) */
    public Map<String, String> asMap() {
        Map<String, String> m = new LinkedHashMap<>();
        if (price != null) m.put("price", price);
        if (title != null) m.put("title", title);
        return m;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
