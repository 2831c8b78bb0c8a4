package com.webcrawler.core.api;

import java.io.IOException;

/** 네트워크/전송 실패 또는 HTML이 아닌 응답. 해당 페이지만 failed 처리. */
public class FetchException extends IOException {

    private final String url;
    private final int statusCode; // 알 수 없으면 -1

    public FetchException(String url, String message) {
        this(url, -1, message, null);
    }

    public FetchException(String url, String message, Throwable cause) {
        this(url, -1, message, cause);
    }

    public FetchException(String url, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
}
