package com.webcrawler.core.cache;

import com.webcrawler.core.api.IPageCache;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** 프로세스 내 캐시(테스트/단발 실행용). 값은 복사본으로 보관/반환. */
public final class InMemoryPageCache implements IPageCache {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] v = entries.get(Objects.requireNonNull(key, "key"));
        return (v == null) ? Optional.empty() : Optional.of(v.clone());
    }

    @Override
    public void set(String key, byte[] value) {
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value").clone());
    }

    public int size() { return entries.size(); }

    public boolean contains(String key) { return entries.containsKey(key); }

    public void clear() { entries.clear(); }
}
