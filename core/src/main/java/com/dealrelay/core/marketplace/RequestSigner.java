package com.dealrelay.core.marketplace;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 공유 시크릿 서명: 키 사전순 정렬 → key+value 이어붙임 → secret 으로 앞뒤 감쌈 → MD5 → 대문자 hex.
 * 바이트 단위로 정확해야 한다. sign 자신은 서명 대상에서 제외.
 */
public final class RequestSigner {

    public static final String SIGN = "sign";

    private final String secret;

    public RequestSigner(String secret) {
        this.secret = Objects.requireNonNull(secret, "secret");
    }

    public String sign(Map<String, String> params) {
        StringBuilder sb = new StringBuilder(secret);
        for (Map.Entry<String, String> e : new TreeMap<>(params).entrySet()) {
            if (SIGN.equals(e.getKey()) || e.getValue() == null) continue;
            sb.append(e.getKey()).append(e.getValue());
        }
        sb.append(secret);
        return md5UpperHex(sb.toString());
    }

    /** 서명을 붙인 새 정렬 맵 반환 (전송 집합 == 서명 집합) */
    public TreeMap<String, String> signed(Map<String, String> params) {
        TreeMap<String, String> out = new TreeMap<>();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (e.getValue() != null && !SIGN.equals(e.getKey())) out.put(e.getKey(), e.getValue());
        }
        out.put(SIGN, sign(out));
        return out;
    }

    static String md5UpperHex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).toUpperCase(Locale.ROOT);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
