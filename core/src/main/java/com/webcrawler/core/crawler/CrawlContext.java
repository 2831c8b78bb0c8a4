package com.webcrawler.core.crawler;

import java.util.concurrent.atomic.AtomicBoolean;

/** 한 번의 실행이 공유하는 취소 신호. 내부 취소(유휴/종료) 또는 호출자 플래그. */
final class CrawlContext {
    private final AtomicBoolean stop = new AtomicBoolean(false);
    private final AtomicBoolean external; // null 허용

    CrawlContext(AtomicBoolean external) {
        this.external = external;
    }

    boolean isCancelled() {
        return stop.get() || isExternallyCancelled();
    }

    boolean isExternallyCancelled() {
        return external != null && external.get();
    }

    /** @return 이번 호출로 처음 취소됐으면 true */
    boolean cancel() {
        return stop.compareAndSet(false, true);
    }
}
