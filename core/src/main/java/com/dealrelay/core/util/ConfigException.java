package com.dealrelay.core.util;

/** relay.yml 로딩/검증 실패. 기동 단계에서만 던지며 치명적이다. */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
