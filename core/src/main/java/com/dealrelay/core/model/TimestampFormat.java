package com.dealrelay.core.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 서명 대상 timestamp 파라미터 형식. 공급자 버전에 따라 두 형식이 모두 관측됨. */
public enum TimestampFormat {
    EPOCH_MILLIS {
        @Override public String format(Instant now, ZoneId zone) {
            return Long.toString(now.toEpochMilli());
        }
    },
    FORMATTED {
        @Override public String format(Instant now, ZoneId zone) {
            return PATTERN.format(now.atZone(zone));
        }
    };

    private static final DateTimeFormatter PATTERN =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT);

    public abstract String format(Instant now, ZoneId zone);
}
