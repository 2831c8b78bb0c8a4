package com.webcrawler.core.api;

import com.webcrawler.core.model.FetchResponse;

/** 도메인별 페이지 파서. 결과 타입은 호출자 자유. 예외는 페이지 실패가 아니라 콜백으로 전달된다. */
@FunctionalInterface
public interface IPageParser {
    Object parse(FetchResponse page) throws Exception;
}
