package com.webcrawler.core.crawler;

/** 실행 중인 Crawler에 crawl()을 다시 호출. 상태는 건드리지 않는다. */
public class CrawlerAlreadyRunningException extends IllegalStateException {
    public CrawlerAlreadyRunningException(String message) {
        super(message);
    }
}
