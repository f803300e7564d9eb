package com.dealrelay.core.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 메시지 본문에서 후보 링크를 등장 순서대로 뽑는다. 마켓플레이스 마커가 없는 링크는 버림. */
public final class LinkScanner {

    private static final Pattern ABSOLUTE_URL =
            Pattern.compile("https?://[^\\s<>\"]+", Pattern.CASE_INSENSITIVE);

    private final List<String> markers;

    public LinkScanner(List<String> markers) {
        Objects.requireNonNull(markers, "markers");
        List<String> lower = new ArrayList<>();
        for (String m : markers) {
            if (m != null && !m.isBlank()) lower.add(m.trim().toLowerCase(Locale.ROOT));
        }
        this.markers = List.copyOf(lower);
    }

    public List<String> candidates(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> out = new LinkedHashSet<>();
        Matcher m = ABSOLUTE_URL.matcher(text);
        while (m.find()) {
            String url = UrlNormalizer.trimWrapping(m.group());
            if (isCandidate(url)) out.add(url);
        }
        return List.copyOf(out);
    }

    public boolean isCandidate(String url) {
        if (url == null) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        for (String marker : markers) {
            if (lower.contains(marker)) return true;
        }
        return false;
    }
}
