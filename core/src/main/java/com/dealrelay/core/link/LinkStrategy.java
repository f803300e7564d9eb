package com.dealrelay.core.link;

import com.dealrelay.core.model.LinkOrigin;

import java.util.Optional;

/**
 * 제휴 링크 생성 전략 1개. 실패/해당 없음은 empty 로 돌려주고 예외를 던지지 않는다.
 * 반환된 후보는 {@link AffiliateLinkBuilder} 가 {@link ProductLinkValidator} 로 다시 검사한다.
 */
public interface LinkStrategy {

    Optional<String> attempt(String cleanUrl) throws InterruptedException;

    LinkOrigin origin();

    /** 설정이 비어 있는 등 애초에 쓸 수 없는 전략이면 false (빌더가 목록에서 뺀다) */
    default boolean usable() { return true; }
}
