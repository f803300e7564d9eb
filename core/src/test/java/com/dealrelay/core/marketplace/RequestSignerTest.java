package com.dealrelay.core.marketplace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RequestSignerTest {

    @Test
    @DisplayName("정렬된 key+value 를 secret 으로 감싼 MD5 대문자 hex")
    void knownVector() {
        Map<String, String> p = new LinkedHashMap<>();
        p.put("b", "2");
        p.put("a", "1");
        assertThat(new RequestSigner("s").sign(p)).isEqualTo("5EE29085AF57D942F21F1C5BA3C2A90A");
    }

    @Test
    @DisplayName("시스템 파라미터 전체 집합 서명 벡터")
    void systemParamsVector() {
        Map<String, String> p = new HashMap<>();
        p.put("app_key", "12345");
        p.put("timestamp", "1700000000000");
        p.put("format", "json");
        p.put("sign_method", "md5");
        p.put("v", "2.0");
        p.put("method", "aliexpress.affiliate.link.generate");
        assertThat(new RequestSigner("secret").sign(p)).isEqualTo("3D074B2D9D700018753B9EE353B808CA");
    }

    @Test
    @DisplayName("삽입 순서와 무관, 값 하나만 바꿔도 서명이 달라짐")
    void deterministicAndSensitive() {
        var signer = new RequestSigner("k");
        Map<String, String> a = new LinkedHashMap<>();
        a.put("x", "1");
        a.put("y", "2");
        Map<String, String> b = new LinkedHashMap<>();
        b.put("y", "2");
        b.put("x", "1");
        assertThat(signer.sign(a)).isEqualTo(signer.sign(b));

        b.put("y", "3");
        assertThat(signer.sign(a)).isNotEqualTo(signer.sign(b));
        assertThat(new RequestSigner("other").sign(a)).isNotEqualTo(signer.sign(a));
    }

    @Test
    @DisplayName("signed(): 기존 sign 은 버리고 다시 계산, null 값은 전송/서명 모두 제외")
    void signedDropsStaleSignAndNulls() {
        var signer = new RequestSigner("s");
        Map<String, String> p = new HashMap<>();
        p.put("a", "1");
        p.put("b", "2");
        p.put("sign", "STALE");
        p.put("c", null);

        var out = signer.signed(p);
        assertThat(out).containsOnlyKeys("a", "b", "sign");
        assertThat(out.get("sign")).isEqualTo("5EE29085AF57D942F21F1C5BA3C2A90A");
        assertThat(out.firstKey()).isEqualTo("a");
    }
}
