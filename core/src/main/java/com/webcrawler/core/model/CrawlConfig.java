package com.webcrawler.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상): 순수 설정 보관용.
 * 페처/캐시/파서 같은 협력 객체는 여기 두지 않고 Crawler.Builder로 주입한다.
 */
public final class CrawlConfig {

    public static final int DEFAULT_QUEUE_SIZE = 10_000;
    public static final Duration DEFAULT_PROGRESS_INTERVAL = Duration.ofSeconds(30);

    /** HTTP 페처 하위 설정: YAML의 `http:` 섹션과 매핑 */
    public static final class HttpCfg {
        private Duration timeout = Duration.ofSeconds(30);
        private long maxBodyBytes = 10L * 1024 * 1024; // 10MB
        private String userAgent = "webcrawler/0.3 (+crawler)";
        private boolean followRedirects = true;
        private Map<String, String> headers = new LinkedHashMap<>();

        public Duration getTimeout() { return timeout; }
        public HttpCfg setTimeout(Duration timeout) { this.timeout = timeout; return this; }
        public long getTimeoutMs() { return timeout.toMillis(); }

        public long getMaxBodyBytes() { return maxBodyBytes; }
        public HttpCfg setMaxBodyBytes(long v) { this.maxBodyBytes = v; return this; }

        public String getUserAgent() { return userAgent; }
        public HttpCfg setUserAgent(String ua) { this.userAgent = ua; return this; }

        public boolean isFollowRedirects() { return followRedirects; }
        public HttpCfg setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

        public Map<String, String> getHeaders() { return headers; }
        public HttpCfg setHeaders(Map<String, String> h) {
            this.headers = (h == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(h);
            return this;
        }
    }

    /** 캐시 하위 설정: dir == null 이면 파일 캐시 미사용 */
    public static final class CacheCfg {
        private Path dir;

        public Path getDir() { return dir; }
        public CacheCfg setDir(Path dir) { this.dir = dir; return this; }
    }

    // ---------- 기본 필드 ----------
    private int maxUrls = 100;                 // 처리 상한(소프트 캡)
    private int workers = 5;                   // 고정 워커 수
    private Duration requestDelay = Duration.ZERO; // 워커별 요청 간 대기
    private int queueSize = DEFAULT_QUEUE_SIZE;
    private FollowBehavior followBehavior = FollowBehavior.SAME_HOST;
    private String fetcherName = "http";
    private boolean showProgress = false;
    private Duration progressInterval;         // null이면 showProgress 시 30초
    private Duration idleCheckInterval = Duration.ofSeconds(1);
    private List<String> seeds = new ArrayList<>();

    private HttpCfg http = new HttpCfg();
    private CacheCfg cache = new CacheCfg();

    // ---------- getters ----------
    public int getMaxUrls() { return maxUrls; }
    public int getWorkers() { return workers; }
    public Duration getRequestDelay() { return requestDelay; }
    public int getQueueSize() { return queueSize; }
    public FollowBehavior getFollowBehavior() { return followBehavior; }
    public String getFetcherName() { return fetcherName; }
    public boolean isShowProgress() { return showProgress; }
    public Duration getIdleCheckInterval() { return idleCheckInterval; }
    public List<String> getSeeds() { return seeds; }
    public HttpCfg getHttp() { return http; }
    public CacheCfg getCache() { return cache; }

    /** 진행 보고가 켜졌는데 간격이 없으면 기본 30초 */
    public Duration getProgressInterval() {
        if (progressInterval == null || progressInterval.isZero() || progressInterval.isNegative()) {
            return DEFAULT_PROGRESS_INTERVAL;
        }
        return progressInterval;
    }

    // ---------- fluent setters ----------
    public CrawlConfig setMaxUrls(int maxUrls) { this.maxUrls = maxUrls; return this; }
    public CrawlConfig setWorkers(int workers) { this.workers = Math.max(1, workers); return this; }
    public CrawlConfig setRequestDelay(Duration d) { this.requestDelay = (d == null ? Duration.ZERO : d); return this; }
    public CrawlConfig setRequestDelayMs(long ms) { return setRequestDelay(Duration.ofMillis(Math.max(0, ms))); }

    /** 0 이하이면 기본 10000 */
    public CrawlConfig setQueueSize(int queueSize) {
        this.queueSize = (queueSize <= 0) ? DEFAULT_QUEUE_SIZE : queueSize;
        return this;
    }
    public CrawlConfig setFollowBehavior(FollowBehavior b) {
        this.followBehavior = (b != null ? b : FollowBehavior.SAME_HOST);
        return this;
    }
    public CrawlConfig setFetcherName(String name) {
        this.fetcherName = (name == null || name.isBlank()) ? "http" : name;
        return this;
    }
    public CrawlConfig setShowProgress(boolean v) { this.showProgress = v; return this; }
    public CrawlConfig setProgressInterval(Duration d) { this.progressInterval = d; return this; }
    public CrawlConfig setIdleCheckInterval(Duration d) { this.idleCheckInterval = d; return this; }
    public CrawlConfig setSeeds(List<String> seeds) {
        this.seeds = (seeds == null) ? new ArrayList<>() : new ArrayList<>(seeds);
        return this;
    }
    public CrawlConfig setHttp(HttpCfg http) { this.http = (http != null ? http : new HttpCfg()); return this; }
    public CrawlConfig setCache(CacheCfg cache) { this.cache = (cache != null ? cache : new CacheCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (maxUrls < 1) throw new IllegalArgumentException("maxUrls must be >= 1");
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        Objects.requireNonNull(requestDelay, "requestDelay");
        if (requestDelay.isNegative()) throw new IllegalArgumentException("requestDelay must be >= 0");
        if (queueSize < 1) throw new IllegalArgumentException("queueSize must be >= 1");
        Objects.requireNonNull(followBehavior, "followBehavior");
        if (idleCheckInterval == null || idleCheckInterval.isZero() || idleCheckInterval.isNegative())
            throw new IllegalArgumentException("idleCheckInterval must be > 0");

        Objects.requireNonNull(http, "http");
        if (http.getTimeout() == null || http.getTimeout().isZero() || http.getTimeout().isNegative())
            throw new IllegalArgumentException("http.timeout must be > 0");
        if (http.getMaxBodyBytes() < 1) throw new IllegalArgumentException("http.maxBodyBytes must be >= 1");
        Objects.requireNonNull(cache, "cache");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }
}
