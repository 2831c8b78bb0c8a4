package com.webcrawler.core.crawler;

import com.webcrawler.core.model.PageLink;

import java.util.List;

/** 마크업에서 링크 후보({url, text})를 뽑는 전략 인터페이스. url은 href 원문. */
public interface LinkExtractor {
    /**
     * @param html    페이지 마크업
     * @param pageUrl 페이지 URL (상대 경로 해석 힌트, 구현에 따라 무시)
     */
    List<PageLink> extract(String html, String pageUrl);
}
