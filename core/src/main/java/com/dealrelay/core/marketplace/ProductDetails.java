package com.dealrelay.core.marketplace;

/** 상품 상세 조회 결과. 캡션 작성용 사실 힌트로만 쓴다. */
public record ProductDetails(String productId, String title, String salePrice, String currency, String detailUrl) {

    public String priceHint() {
        if (salePrice == null || salePrice.isBlank()) return "";
        return (currency == null || currency.isBlank()) ? salePrice : salePrice + " " + currency;
    }
}
