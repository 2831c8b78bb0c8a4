package com.webcrawler.core.util;

import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.FollowBehavior;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml을 읽어 CrawlConfig로 변환. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * maxUrls: 100
 * workers: 5
 * requestDelayMs: 0
 * queueSize: 10000
 * follow: same-host | none | any | related-subdomains
 * fetcher: "http"
 * idleCheckMs: 1000
 * seeds: ["https://example.com"]   # 또는 "a,b,c"
 * progress:
 *   enabled: false
 *   intervalMs: 30000
 * http:
 *   timeoutMs: 30000
 *   maxBodyBytes: 10485760
 *   userAgent: "webcrawler/0.3 (+crawler)"
 *   followRedirects: true
 *   headers:
 *     Accept-Language: "en"
 * cache:
 *   dir: ".cache/pages"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "crawl.yml";

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromRoot(newYaml().load(in));
        }
    }

    /** 문자열 YAML (테스트/임베드용) */
    public static CrawlConfig parse(String yamlText) {
        try (Reader r = new StringReader(yamlText == null ? "" : yamlText)) {
            return fromRoot(newYaml().load(r));
        } catch (IOException e) {
            throw new IllegalStateException(e); // StringReader는 IO 실패 없음
        }
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static CrawlConfig fromRoot(Object root) {
        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setInt(map, "maxUrls", cfg::setMaxUrls);
        setInt(map, "workers", cfg::setWorkers);
        setLong(map, "requestDelayMs", cfg::setRequestDelayMs);
        setInt(map, "queueSize", cfg::setQueueSize);
        setString(map, "follow", s -> {
            try {
                cfg.setFollowBehavior(FollowBehavior.parse(s));
            } catch (IllegalArgumentException ignore) {
                // 무시(사용자 오타 시 기본값 유지)
            }
        });
        setString(map, "fetcher", cfg::setFetcherName);
        setMsAsDuration(map, "idleCheckMs", cfg::setIdleCheckInterval);
        setStringList(map, "seeds", cfg::setSeeds);

        // 2) progress.*
        Map<String, Object> progress = getMap(map, "progress");
        if (progress != null) {
            setBoolean(progress, "enabled", cfg::setShowProgress);
            setMsAsDuration(progress, "intervalMs", cfg::setProgressInterval);
        }

        // 3) http.*
        Map<String, Object> http = getMap(map, "http");
        if (http != null) {
            CrawlConfig.HttpCfg h = cfg.getHttp();
            setMsAsDuration(http, "timeoutMs", h::setTimeout);
            setLong(http, "maxBodyBytes", h::setMaxBodyBytes);
            setString(http, "userAgent", h::setUserAgent);
            setBoolean(http, "followRedirects", h::setFollowRedirects);
            Map<String, Object> headers = getMap(http, "headers");
            if (headers != null) {
                Map<String, String> out = new LinkedHashMap<>();
                headers.forEach((k, v) -> { if (k != null && v != null) out.put(k, String.valueOf(v)); });
                h.setHeaders(out);
            }
        }

        // 4) cache.dir
        Map<String, Object> cache = getMap(map, "cache");
        if (cache != null) {
            setPath(cache, "dir", cfg.getCache()::setDir);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setMsAsDuration(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null && !String.valueOf(v).isBlank()) setter.accept(Path.of(String.valueOf(v)));
    }
}
