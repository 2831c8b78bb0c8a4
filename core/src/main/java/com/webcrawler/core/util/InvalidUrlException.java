package com.webcrawler.core.util;

/** 비어 있거나 허용되지 않은 스킴의 URL. 해당 URL만 건너뛰고 크롤은 계속된다. */
public class InvalidUrlException extends IllegalArgumentException {

    private final String rawUrl;

    public InvalidUrlException(String message, String rawUrl) {
        super(message);
        this.rawUrl = rawUrl;
    }

    public InvalidUrlException(String message, String rawUrl, Throwable cause) {
        super(message, cause);
        this.rawUrl = rawUrl;
    }

    public String getRawUrl() { return rawUrl; }
}
