package com.dealrelay.core.marketplace;

/**
 * 서명 API 실패 분류.
 * TRANSIENT 만 재시도 대상이고 나머지는 해당 호출 경로만 중단한 뒤 다음 전략으로 넘어간다.
 */
public enum ApiErrorKind {
    /** 전송 오류, 타임아웃, 429/5xx, JSON 아닌 본문 */
    TRANSIENT,
    /** 서명/앱키/세션 오류 */
    AUTH,
    /** 공급자 비즈니스 오류 (잘못된 tracking id, 상품 없음, 지역 제한 등) */
    BUSINESS,
    /** 알 수 없는 응답 모양. 원본 payload 를 남긴다. */
    MALFORMED
}
