package com.webcrawler.core.api;

import com.webcrawler.core.model.FetchRequest;
import com.webcrawler.core.model.FetchResponse;

/**
 * 페이지 페처 계약. 워커 스레드에서 동기 호출된다.
 * 타임아웃은 페처 책임(스케줄러는 진행 중인 fetch를 끊지 않음).
 */
@FunctionalInterface
public interface IFetcher {
    FetchResponse fetch(FetchRequest request) throws Exception;
}
