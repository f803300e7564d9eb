package com.dealrelay.core.model;

/** PERMANENT: 한 번 게시한 상품은 다시 올리지 않음. COOLDOWN: 창이 지나면 재게시 허용. */
public enum DedupMode { PERMANENT, COOLDOWN }
