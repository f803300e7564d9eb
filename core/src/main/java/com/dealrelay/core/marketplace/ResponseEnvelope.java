package com.dealrelay.core.marketplace;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 공급자 버전별로 공존하는 응답 봉투 모양. {@link EnvelopeParser} 가 우선순위대로 판별한다.
 */
public interface ResponseEnvelope {

    /** {@code <method>_response.resp_result.{resp_code, resp_msg, result}} */
    record NestedSuccess(String respCode, String respMsg, JsonNode result) implements ResponseEnvelope {}

    /** {@code resp_result.result} 또는 최상위 {@code result} */
    record FlatSuccess(String respCode, String respMsg, JsonNode result) implements ResponseEnvelope {}

    /** {@code error_response: {code, msg, sub_code, sub_msg, request_id}} */
    record ErrorResponse(String code, String message, String subCode, String subMessage, String requestId)
            implements ResponseEnvelope {}

    /** 게이트웨이 수준 {@code {code, message, request_id}} */
    record GatewayError(String code, String message, String requestId) implements ResponseEnvelope {}

    /** JSON 객체가 아님 (HTML 오류 페이지, 빈 본문 등) */
    record NotJson(String raw) implements ResponseEnvelope {}

    /** JSON 이지만 아는 모양이 아님 */
    record Unrecognized(String raw) implements ResponseEnvelope {}
}
