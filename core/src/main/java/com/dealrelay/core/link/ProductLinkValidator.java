package com.dealrelay.core.link;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 후보 링크가 "상품/공유 링크"인지 판정.
 * 호스트가 있어야 하고, 한 번 디코딩한 path+query 에 설정된 마커 중 하나가 들어 있어야 한다.
 * 추적 ID가 틀려 API가 홈페이지/검색 링크를 돌려준 경우를 여기서 거른다.
 */
public final class ProductLinkValidator {

    private final List<String> markers;

    public ProductLinkValidator(List<String> markers) {
        Objects.requireNonNull(markers, "markers");
        List<String> lower = new ArrayList<>();
        for (String m : markers) {
            if (m != null && !m.isBlank()) lower.add(m.toLowerCase(Locale.ROOT));
        }
        this.markers = List.copyOf(lower);
    }

    public boolean isProductLink(String url) {
        if (url == null || url.isBlank()) return false;
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) return false;

        String raw = (uri.getRawPath() == null ? "" : uri.getRawPath())
                + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery());
        String decoded = decodeOnce(raw).toLowerCase(Locale.ROOT);
        for (String m : markers) {
            if (decoded.contains(m)) return true;
        }
        return false;
    }

    private static String decodeOnce(String s) {
        try {
            return URLDecoder.decode(s.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s; // 깨진 %xx 시퀀스
        }
    }
}
