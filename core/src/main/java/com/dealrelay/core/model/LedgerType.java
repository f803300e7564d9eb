package com.dealrelay.core.model;

public enum LedgerType { MEMORY, FILE, FEED }
