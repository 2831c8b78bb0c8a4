package com.webcrawler.core.util;

import com.webcrawler.core.model.CrawlStats;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param stats  현재 카운터 스냅샷
     * @param queued 대기 큐 길이
     * @param maxUrls 처리 상한
     */
    void onProgress(CrawlStats.Snapshot stats, int queued, int maxUrls);

    ProgressListener NONE = (s, q, m) -> {};
}
