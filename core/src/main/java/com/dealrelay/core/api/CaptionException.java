package com.dealrelay.core.api;

public class CaptionException extends Exception {
    public CaptionException(String message) {
        super(message);
    }

    public CaptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
