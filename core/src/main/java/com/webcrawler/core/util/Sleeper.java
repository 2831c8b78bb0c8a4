package com.webcrawler.core.util;

import java.time.Duration;

/** 워커 요청 간 대기. 테스트에서 기록용 구현으로 교체한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
