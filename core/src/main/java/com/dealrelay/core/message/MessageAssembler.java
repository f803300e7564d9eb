package com.dealrelay.core.message;

import com.dealrelay.core.model.RelayConfig;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 캡션 + 제휴 링크 → 게시 본문.
 * 결과에는 제휴 링크가 정확히 한 번 들어가고 다른 절대 URL(평문/퍼센트 인코딩)은 남지 않는다.
 * 캡션에 링크가 없으면 "여기서 구매" 블록을 뒤에 붙인다.
 */
public final class MessageAssembler {

    private static final Pattern ABSOLUTE_URL = Pattern.compile("(?i)https?://\\S+");
    private static final Pattern ENCODED_URL = Pattern.compile("(?i)https?%3A%2F%2F\\S+");
    private static final String TRAILING_PUNCT = ".,;:!?)]}>\"'»”’";

    // 유지할 링크 자리표시 (URL 패턴에 걸리지 않는 문자만 사용)
    private static final String KEEP = "\u0000KEEP\u0000";

    private final String buyHereLabel;

    public MessageAssembler(RelayConfig.Message cfg) {
        this(Objects.requireNonNull(cfg, "cfg").buyHereLabel());
    }

    public MessageAssembler(String buyHereLabel) {
        this.buyHereLabel = buyHereLabel == null ? "" : buyHereLabel;
    }

    public String assemble(String caption, String link) {
        Objects.requireNonNull(link, "link");
        String text = caption == null ? "" : caption.replace(KEEP, "");

        boolean kept = false;
        String prev;
        do {
            prev = text;
            StringBuilder sb = new StringBuilder(text.length());
            Matcher m = ABSOLUTE_URL.matcher(text);
            int last = 0;
            while (m.find()) {
                sb.append(text, last, m.start());
                String token = m.group();
                String tail = trailingPunct(token);
                String core = token.substring(0, token.length() - tail.length());
                if (!kept && (core.equals(link) || token.equals(link))) {
                    sb.append(KEEP).append(token.equals(link) ? "" : tail);
                    kept = true;
                } else {
                    sb.append(tail);
                }
                last = m.end();
            }
            sb.append(text, last, text.length());
            text = ENCODED_URL.matcher(sb.toString()).replaceAll("");
        } while (!text.equals(prev));

        text = tidy(text);
        if (!kept) {
            String block = buyHereLabel.isBlank() ? link : buyHereLabel + "\n" + link;
            text = text.isEmpty() ? block : text + "\n\n" + block;
            return text;
        }
        return text.replace(KEEP, link);
    }

    private static String trailingPunct(String token) {
        int end = token.length();
        while (end > 0 && TRAILING_PUNCT.indexOf(token.charAt(end - 1)) >= 0) end--;
        return token.substring(end);
    }

    /** URL 제거로 생긴 빈 칸/빈 줄 정리 */
    private static String tidy(String s) {
        String[] lines = s.split("\n", -1);
        StringBuilder sb = new StringBuilder(s.length());
        int blankRun = 0;
        for (String line : lines) {
            String l = line.replaceAll("[ \\t]{2,}", " ").strip();
            if (l.isEmpty()) {
                if (++blankRun > 1) continue;
            } else {
                blankRun = 0;
            }
            sb.append(l).append('\n');
        }
        return sb.toString().strip();
    }
}
