package com.dealrelay.core.marketplace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * 응답 본문 → {@link ResponseEnvelope}.
 * 판별 순서: error_response → 메서드별 중첩 성공 → 게이트웨이 오류 → 평평한 성공 → 미인식.
 */
public final class EnvelopeParser {

    private final ObjectMapper mapper;

    public EnvelopeParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ResponseEnvelope parse(String method, String body) {
        if (body == null || body.isBlank()) return new ResponseEnvelope.NotJson("");
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            return new ResponseEnvelope.NotJson(body);
        }
        if (root == null || !root.isObject()) return new ResponseEnvelope.NotJson(body);

        JsonNode err = root.get("error_response");
        if (err != null && err.isObject()) {
            return new ResponseEnvelope.ErrorResponse(
                    text(err, "code"), firstText(err, "msg", "message"),
                    text(err, "sub_code"), text(err, "sub_msg"), text(err, "request_id"));
        }

        JsonNode nested = root.get(responseKey(method));
        if (nested == null) nested = anyResponseKey(root);
        if (nested != null && nested.isObject()) {
            JsonNode rr = nested.get("resp_result");
            if (rr != null && rr.isObject()) {
                return new ResponseEnvelope.NestedSuccess(
                        text(rr, "resp_code"), text(rr, "resp_msg"), rr.path("result"));
            }
            if (nested.has("result")) {
                return new ResponseEnvelope.NestedSuccess(null, null, nested.path("result"));
            }
        }

        if (root.has("code") && !root.has("result") && !root.has("resp_result")) {
            String code = text(root, "code");
            if (code != null && !code.equals("0")) {
                return new ResponseEnvelope.GatewayError(code, firstText(root, "message", "msg"), text(root, "request_id"));
            }
        }

        JsonNode flatRr = root.get("resp_result");
        if (flatRr != null && flatRr.isObject()) {
            return new ResponseEnvelope.FlatSuccess(
                    text(flatRr, "resp_code"), text(flatRr, "resp_msg"), flatRr.path("result"));
        }
        if (root.has("result")) {
            return new ResponseEnvelope.FlatSuccess(null, null, root.path("result"));
        }
        return new ResponseEnvelope.Unrecognized(body);
    }

    /** aliexpress.affiliate.link.generate → aliexpress_affiliate_link_generate_response */
    static String responseKey(String method) {
        return String.valueOf(method).replace('.', '_') + "_response";
    }

    // 메서드명과 다른 *_response 키로 오는 변종 대응
    private static JsonNode anyResponseKey(JsonNode root) {
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getKey().endsWith("_response") && !e.getKey().equals("error_response")) return e.getValue();
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static String firstText(JsonNode node, String a, String b) {
        String v = text(node, a);
        return v != null ? v : text(node, b);
    }
}
