package com.webcrawler.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 페처 결과(본문은 텍스트 기준).
 * 캐시 히트로 합성된 응답은 url + html만 채워진다(status 0, 헤더/링크 없음).
 */
public final class FetchResponse {
    private final String url;
    private final int statusCode;
    private final Map<String, String> headers;
    private final String html;
    private final String title;
    private final List<PageLink> links;

    private FetchResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.html = (b.html == null) ? "" : b.html;
        this.title = (b.title == null) ? "" : b.title;
        this.links = (b.links == null) ? null : List.copyOf(b.links);
    }

    public String getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, String> getHeaders() { return headers; }
    public String getHtml() { return html; }
    public String getTitle() { return title; }

    /** 링크 목록. 추출하지 않은 응답(캐시 히트 등)은 null */
    public List<PageLink> getLinks() { return links; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            if (e.getKey() != null && e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    /** 캐시 본문만으로 응답 합성 */
    public static FetchResponse fromCache(String url, String html) {
        return builder().url(url).html(html).build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private Map<String, String> headers;
        private String html;
        private String title;
        private List<PageLink> links;

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, String> headers) { this.headers = headers; return this; }
        public Builder html(String html) { this.html = html; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder links(List<PageLink> links) { this.links = links; return this; }
        public FetchResponse build() { return new FetchResponse(this); }
    }
}
