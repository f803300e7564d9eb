package com.dealrelay.core.api;

import com.dealrelay.core.message.FactHints;

/** 원문 → 게시용 캡션. 실패하면 {@link CaptionException}, 호출 측이 결정적 캡션으로 대체한다. */
public interface ICaptionWriter {
    String rewrite(String rawText, String affiliateLink, FactHints hints) throws CaptionException;
}
