package com.webcrawler.core.crawler;

/** IDLE → RUNNING → STOPPING → IDLE */
public enum CrawlState {
    IDLE,
    RUNNING,
    STOPPING
}
