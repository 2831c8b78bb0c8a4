package com.webcrawler.core.crawler;

import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.util.ProgressListener;
import com.webcrawler.core.util.StructuredLog;

/** showProgress=true 일 때 주기적으로 진행 상황을 로그 + 리스너로 */
final class ProgressReporter implements Runnable {

    private static final StructuredLog SLOG = StructuredLog.get(ProgressReporter.class);

    private final CrawlStats stats;
    private final Frontier frontier;
    private final ProgressListener listener;
    private final int maxUrls;

    ProgressReporter(CrawlStats stats, Frontier frontier, ProgressListener listener, int maxUrls) {
        this.stats = stats;
        this.frontier = frontier;
        this.listener = listener;
        this.maxUrls = maxUrls;
    }

    @Override
    public void run() {
        CrawlStats.Snapshot s = stats.snapshot();
        int queued = frontier.size();
        SLOG.info("crawl-progress",
                "processed", s.processed,
                "succeeded", s.succeeded,
                "failed", s.failed,
                "queued", queued,
                "active", s.activeWorkers);
        try {
            listener.onProgress(s, queued, maxUrls);
        } catch (RuntimeException e) {
            SLOG.warn("progress-listener-failed", e);
        }
    }
}
