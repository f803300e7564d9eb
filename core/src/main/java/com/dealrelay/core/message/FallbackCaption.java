package com.dealrelay.core.message;

import java.util.regex.Pattern;

/** 캡션 작성기가 없거나 실패했을 때 쓰는 결정적 캡션: 원문의 첫 의미 있는 줄, 길이 제한. */
public final class FallbackCaption {

    private static final Pattern URL = Pattern.compile("(?i)https?://\\S+");

    private final int maxChars;

    public FallbackCaption(int maxChars) {
        this.maxChars = Math.max(20, maxChars);
    }

    public String from(String sourceText) {
        if (sourceText == null) return "";
        for (String line : sourceText.split("\\R")) {
            String l = URL.matcher(line).replaceAll("").replaceAll("\\s{2,}", " ").strip();
            if (l.isEmpty() || !hasLetterOrDigit(l)) continue;
            return truncate(l);
        }
        return "";
    }

    private String truncate(String s) {
        if (s.codePointCount(0, s.length()) <= maxChars) return s;
        int end = s.offsetByCodePoints(0, maxChars - 1);
        return s.substring(0, end).stripTrailing() + "…";
    }

    private static boolean hasLetterOrDigit(String s) {
        return s.codePoints().anyMatch(Character::isLetterOrDigit);
    }
}
