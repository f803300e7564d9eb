package com.dealrelay.core.marketplace;

import com.fasterxml.jackson.databind.JsonNode;

/** 서명 API 호출 결과: 성공 payload 또는 분류된 오류 */
public interface ApiResult {

    record Ok(JsonNode payload) implements ApiResult {}

    record Err(ApiError error) implements ApiResult {}

    default boolean ok() { return this instanceof Ok; }

    static ApiResult ok(JsonNode payload) { return new Ok(payload); }

    static ApiResult err(ApiError error) { return new Err(error); }
}
