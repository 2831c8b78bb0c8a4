package com.webcrawler.core.api;

import java.io.IOException;
import java.util.Optional;

/** 바이트 캐시. 키는 파이프라인이 쓰는 URL 문자열 그대로. 여러 워커가 동시에 호출한다. */
public interface IPageCache {

    /** 없으면 Optional.empty() (NotFound) */
    Optional<byte[]> get(String key) throws IOException;

    void set(String key, byte[] value) throws IOException;
}
