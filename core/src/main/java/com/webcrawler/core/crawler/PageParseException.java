package com.webcrawler.core.crawler;

/** 파서 실패. fetch는 성공했으므로 페이지는 여전히 succeeded로 집계된다. */
public class PageParseException extends Exception {

    private final String url;

    public PageParseException(String url, Throwable cause) {
        super("failed to parse " + url + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.url = url;
    }

    public String getUrl() { return url; }
}
