package com.dealrelay.core.ledger;

import com.dealrelay.core.model.ProductId;

/**
 * 게시 이력 원장. seen → (게시 성공) → record 순서로만 쓴다.
 * 각 연산은 스레드 세이프하지만 seen 과 record 는 별개 호출이다.
 * 후보는 한 스레드에서 하나씩 처리되므로 그 사이에 다른 기록이 끼지 않는다.
 */
public interface Ledger {

    boolean seen(ProductId id);

    /** 게시가 확인된 뒤에만 호출. 영속 실패 시 {@link LedgerException} (메모리 상태는 이미 반영됨). */
    void record(ProductId id);

    int size();
}
