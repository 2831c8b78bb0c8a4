package com.webcrawler.core.crawler;

import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.util.Sleeper;
import com.webcrawler.core.util.StructuredLog;

import java.time.Duration;

/**
 * 워커 루프: 꺼내기(취소/close까지 대기) → 상한 확인 → active 표시 → 처리 → 해제 → 요청 간 대기.
 * 취소는 협조적이다. 처리 중인 URL은 끝까지 마치고 다음 루프 경계에서 종료한다.
 */
final class CrawlWorker implements Runnable {

    private static final StructuredLog SLOG = StructuredLog.get(CrawlWorker.class);
    static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private final int id;
    private final Frontier frontier;
    private final PageProcessor processor;
    private final CrawlStats stats;
    private final CrawlContext ctx;
    private final int maxUrls;
    private final Duration requestDelay;
    private final Sleeper sleeper;

    CrawlWorker(int id, Frontier frontier, PageProcessor processor, CrawlStats stats, CrawlContext ctx,
                int maxUrls, Duration requestDelay, Sleeper sleeper) {
        this.id = id;
        this.frontier = frontier;
        this.processor = processor;
        this.stats = stats;
        this.ctx = ctx;
        this.maxUrls = maxUrls;
        this.requestDelay = requestDelay;
        this.sleeper = sleeper;
    }

    @Override
    public void run() {
        try {
            while (!ctx.isCancelled()) {
                String url = frontier.take(POLL_INTERVAL, ctx::isCancelled);
                if (url == null) return;
                try {
                    if (stats.getProcessed() >= maxUrls) {
                        SLOG.debug("worker-cap-reached", "worker", id, "processed", stats.getProcessed());
                        return;
                    }
                    stats.workerStarted();
                    try {
                        processor.process(url);
                    } catch (RuntimeException e) {
                        SLOG.error("page-crashed", e, "worker", id, "url", url);
                    } finally {
                        stats.workerFinished();
                    }
                } finally {
                    frontier.complete();
                }
                if (!requestDelay.isZero()) sleeper.sleep(requestDelay);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
