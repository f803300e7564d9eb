package com.dealrelay.core.util;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL 정규화 (네트워크 I/O 없음).
 * <ul>
 *   <li>메시지 포맷팅이 붙인 괄호/따옴표/문장부호/공백 제거</li>
 *   <li>scheme + host + path 만 남기고 query/fragment 전부 제거 (경쟁 제휴 태그가 API로 새지 않도록)</li>
 *   <li>scheme/host 소문자, 기본 포트 제거, 호스트 별칭(m. → www.) 적용</li>
 * </ul>
 * normalize(normalize(x)) == normalize(x) 를 보장한다.
 */
public final class UrlNormalizer {

    private static final Pattern HTTP_URL =
            Pattern.compile("^([A-Za-z][A-Za-z0-9+.-]*)://([^/?#\\s]*)([^?#\\s]*)");

    private static final String LEADING_JUNK = "<([{\"'`*_\u201C\u201D\u2018\u2019\u00AB";
    private static final String TRAILING_JUNK = ">)]}\"'`*.,;:!?\u201C\u201D\u2018\u2019\u00BB";

    private final Map<String, String> hostAliases;

    public UrlNormalizer(Map<String, String> hostAliases) {
        this.hostAliases = Map.copyOf(Objects.requireNonNull(hostAliases, "hostAliases"));
    }

    public String normalize(String raw) {
        if (raw == null) return "";
        String s = trimWrapping(raw);
        Matcher m = HTTP_URL.matcher(s);
        if (!m.find()) return s;

        String scheme = m.group(1).toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return s;

        String authority = m.group(2);
        int at = authority.lastIndexOf('@');
        if (at >= 0) authority = authority.substring(at + 1); // userinfo 제거

        String host = authority;
        String port = "";
        int colon = authority.lastIndexOf(':');
        if (colon >= 0 && authority.indexOf(']') < colon) {
            host = authority.substring(0, colon);
            port = authority.substring(colon + 1);
        }
        host = canonicalHost(host);
        if (host.isEmpty()) return s;
        if (isDefaultPort(scheme, port)) port = "";

        StringBuilder sb = new StringBuilder(s.length());
        sb.append(scheme).append("://").append(host);
        if (!port.isEmpty()) sb.append(':').append(port);
        sb.append(m.group(3));
        return trimWrapping(sb.toString());
    }

    /** 호스트만 뽑아 정규화. URL이 아니면 빈 문자열. */
    public String hostOf(String url) {
        String n = normalize(url);
        Matcher m = HTTP_URL.matcher(n);
        if (!m.find()) return "";
        String authority = m.group(2);
        int colon = authority.lastIndexOf(':');
        return colon >= 0 ? authority.substring(0, colon) : authority;
    }

    private String canonicalHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        while (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        // 별칭 체인(a→b→c)도 고정점까지 따라간다. 순환 대비 상한.
        for (int i = 0; i < 8; i++) {
            String next = hostAliases.get(h);
            if (next == null || next.equals(h)) break;
            h = next.toLowerCase(Locale.ROOT);
        }
        return h;
    }

    private static boolean isDefaultPort(String scheme, String port) {
        if (port.isEmpty()) return true;
        return (scheme.equals("http") && port.equals("80")) || (scheme.equals("https") && port.equals("443"));
    }

    static String trimWrapping(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end) {
            char c = raw.charAt(start);
            if (isBlankish(c) || LEADING_JUNK.indexOf(c) >= 0) start++;
            else break;
        }
        while (end > start) {
            char c = raw.charAt(end - 1);
            if (isBlankish(c) || TRAILING_JUNK.indexOf(c) >= 0) end--;
            else break;
        }
        return raw.substring(start, end);
    }

    // 텔레그램 본문에 흔한 zero-width/방향 표시 문자 포함
    private static boolean isBlankish(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c)
                || c == '\u200B' || c == '\u200C' || c == '\u200D'
                || c == '\u200E' || c == '\u200F' || c == '\uFEFF';
    }
}
