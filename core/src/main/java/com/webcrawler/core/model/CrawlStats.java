package com.webcrawler.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 크롤 진행 카운터 (스레드 세이프).
 * 카운터끼리는 독립적으로 원자적이다. 스냅샷 사이에 processed=5, succeeded=3, failed=1 같은
 * 과도 상태가 보일 수 있다(마지막 페이지 처리 중).
 */
public final class CrawlStats {
    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicLong succeeded = new AtomicLong(0);
    private final AtomicLong failed    = new AtomicLong(0);
    private final AtomicInteger activeWorkers = new AtomicInteger(0); // 유휴 판정 신호 전용
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public long incrementProcessed() { return processed.incrementAndGet(); }
    public long incrementSucceeded() { return succeeded.incrementAndGet(); }
    public long incrementFailed()    { return failed.incrementAndGet(); }

    public long getProcessed() { return processed.get(); }
    public long getSucceeded() { return succeeded.get(); }
    public long getFailed()    { return failed.get(); }

    public int workerStarted() {
        int cur = activeWorkers.incrementAndGet();
        maxObservedConcurrency.accumulateAndGet(cur, Math::max);
        return cur;
    }
    public int workerFinished() { return activeWorkers.decrementAndGet(); }
    public int getActiveWorkers() { return activeWorkers.get(); }

    public Snapshot snapshot() {
        return new Snapshot(processed.get(), succeeded.get(), failed.get(),
                activeWorkers.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long processed;
        public final long succeeded;
        public final long failed;
        public final int  activeWorkers;
        public final int  maxObservedConcurrency;
        public Snapshot(long p, long s, long f, int a, int m) {
            this.processed = p;
            this.succeeded = s;
            this.failed = f;
            this.activeWorkers = a;
            this.maxObservedConcurrency = m;
        }

        @Override public String toString() {
            return "processed=" + processed + ", succeeded=" + succeeded + ", failed=" + failed
                    + ", active=" + activeWorkers;
        }
    }
}
