package com.webcrawler.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 페처 호출 단위. url + 페처 선택 힌트 + (옵션) 요청 헤더/타임아웃 */
public final class FetchRequest {
    private final String url;
    private final String fetcher;
    private final Map<String, String> headers;
    private final Duration timeout;   // null이면 페처 기본값

    private FetchRequest(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.fetcher = (b.fetcher == null || b.fetcher.isBlank()) ? "http" : b.fetcher;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.timeout = b.timeout;
    }

    public String getUrl() { return url; }
    public String getFetcher() { return fetcher; }
    public Map<String, String> getHeaders() { return headers; }
    public Duration getTimeout() { return timeout; }

    public static FetchRequest of(String url) { return builder().url(url).build(); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String fetcher;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;

        public Builder url(String url) { this.url = url; return this; }
        public Builder fetcher(String fetcher) { this.fetcher = fetcher; return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder headers(Map<String, String> h) { if (h != null) this.headers.putAll(h); return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public FetchRequest build() { return new FetchRequest(this); }
    }

    @Override
    public String toString() {
        return "FetchRequest{url=" + url + ", fetcher=" + fetcher + "}";
    }
}
