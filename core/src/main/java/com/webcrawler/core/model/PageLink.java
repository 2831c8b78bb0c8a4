package com.webcrawler.core.model;

/** 페이지에서 발견된 링크 후보. url은 원문(href) 그대로일 수 있다. */
public record PageLink(String url, String text) {
    public PageLink {
        text = (text == null) ? "" : text;
    }

    public static PageLink of(String url) { return new PageLink(url, ""); }
}
