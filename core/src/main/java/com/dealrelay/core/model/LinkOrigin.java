package com.dealrelay.core.model;

/** 최종 링크를 만들어 낸 전략 (진단 로그용) */
public enum LinkOrigin { API, TEMPLATE, PREFIX, FALLBACK }
