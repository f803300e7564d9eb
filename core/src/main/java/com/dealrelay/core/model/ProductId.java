package com.dealrelay.core.model;

import java.util.Objects;

/**
 * 중복 판정에 쓰는 상품 식별자.
 * HASH 종류는 URL 비의미 부분이 바뀌면 값도 바뀌므로 실행 범위 메모리에만 둔다.
 */
public record ProductId(String value, Kind kind) {

    public enum Kind { ITEM_ID, SHORT_TOKEN, DIGITS, HASH }

    public ProductId {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
        if (value.isBlank()) throw new IllegalArgumentException("product id must not be blank");
    }

    /** 영속 원장에 기록해도 되는지 여부 */
    public boolean stable() { return kind != Kind.HASH; }

    @Override public String toString() { return value; }
}
