package com.webcrawler.core.crawler;

import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.util.StructuredLog;

/**
 * 주기 점검: active 워커 0 + 대기 큐 비어 있음 → "도달 가능한 작업 없음"으로 보고 취소.
 * 꺼낸 직후 active 표시 전의 틈은 Frontier의 inFlight 카운트로 막는다.
 * 호출자 취소 플래그도 여기서 감지해 내부 취소로 승격한다.
 */
final class IdleMonitor implements Runnable {

    private static final StructuredLog SLOG = StructuredLog.get(IdleMonitor.class);

    private final Frontier frontier;
    private final CrawlStats stats;
    private final CrawlContext ctx;
    private final Runnable onStop;

    IdleMonitor(Frontier frontier, CrawlStats stats, CrawlContext ctx, Runnable onStop) {
        this.frontier = frontier;
        this.stats = stats;
        this.ctx = ctx;
        this.onStop = onStop;
    }

    @Override
    public void run() {
        if (ctx.isExternallyCancelled()) {
            if (ctx.cancel()) {
                SLOG.info("crawl-cancelled", "processed", stats.getProcessed());
                onStop.run();
            }
            return;
        }
        if (stats.getActiveWorkers() == 0 && frontier.isDrained()) {
            if (ctx.cancel()) {
                SLOG.info("crawl-idle", "msg", "no more work available, stopping crawler",
                        "processed", stats.getProcessed());
                onStop.run();
            }
        }
    }
}
