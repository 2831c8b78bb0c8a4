package com.webcrawler.core.api;

import com.webcrawler.core.model.FetchRequest;

/**
 * 처리된 URL마다 정확히 한 번, 워커 스레드에서 동기 호출된다.
 * 여러 워커가 동시에 부르므로 공유 상태를 쥔 구현은 스스로 스레드 세이프해야 한다.
 */
@FunctionalInterface
public interface PageCallback {
    /**
     * @param request 원 요청
     * @param parsed  파서 결과 (파서 없음/실패/fetch 실패 시 null)
     * @param error   fetch 실패 또는 파싱 실패 (정상이면 null)
     */
    void onPage(FetchRequest request, Object parsed, Throwable error);

    PageCallback NONE = (r, p, e) -> {};
}
