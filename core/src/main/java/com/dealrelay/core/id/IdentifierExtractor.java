package com.dealrelay.core.id;

import com.dealrelay.core.model.ProductId;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL → 상품 식별자. 규칙은 순서대로 적용하고 첫 번째 매치를 쓴다.
 * <ol>
 *   <li>정식 상품 경로 /item/&lt;digits&gt;</li>
 *   <li>단축 링크 토큰 (s.click.../e/_TOKEN, a.aliexpress.com/_TOKEN)</li>
 *   <li>URL 어디든 10자리 이상 연속 숫자</li>
 * </ol>
 * 같은 입력이면 항상 같은 값 (중복 판정 정합성의 전제).
 */
public final class IdentifierExtractor {

    private record Rule(Pattern pattern, ProductId.Kind kind) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("/item/(\\d+)"), ProductId.Kind.ITEM_ID),
            new Rule(Pattern.compile("(?i)click\\.aliexpress\\.com/e/_?([A-Za-z0-9][A-Za-z0-9_-]*)"), ProductId.Kind.SHORT_TOKEN),
            new Rule(Pattern.compile("(?i)a\\.aliexpress\\.com/_([A-Za-z0-9][A-Za-z0-9_-]*)"), ProductId.Kind.SHORT_TOKEN),
            new Rule(Pattern.compile("(\\d{10,})"), ProductId.Kind.DIGITS)
    );

    public Optional<ProductId> extract(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        for (Rule rule : RULES) {
            Matcher m = rule.pattern().matcher(url);
            if (m.find()) {
                String value = m.group(1);
                if (!value.isEmpty()) return Optional.of(new ProductId(value, rule.kind()));
            }
        }
        return Optional.empty();
    }

    /**
     * 마지막 수단: 정규화 URL의 SHA-256 앞 16자리. 실행 범위 중복 방지 전용이며
     * {@link ProductId#stable()} 이 false 라서 영속 원장에는 기록되지 않는다.
     */
    public ProductId hashOf(String normalizedUrl) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(String.valueOf(normalizedUrl).getBytes(StandardCharsets.UTF_8));
            return new ProductId("h:" + HexFormat.of().formatHex(digest).substring(0, 16), ProductId.Kind.HASH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
