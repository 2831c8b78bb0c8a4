package com.webcrawler.core.crawler;

import com.webcrawler.core.api.IFetcher;
import com.webcrawler.core.api.IPageCache;
import com.webcrawler.core.api.IPageParser;
import com.webcrawler.core.api.PageCallback;
import com.webcrawler.core.cache.FileSystemPageCache;
import com.webcrawler.core.http.HttpFetcher;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.util.DefaultSleeper;
import com.webcrawler.core.util.InvalidUrlException;
import com.webcrawler.core.util.NamedThreadFactory;
import com.webcrawler.core.util.ProgressListener;
import com.webcrawler.core.util.Sleeper;
import com.webcrawler.core.util.StructuredLog;
import com.webcrawler.core.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 크롤 오케스트레이터:
 *  - 시드 입장 → 고정 워커 풀이 fetch/parse/확장 → 콜백
 *  - 유휴 감시(기본 1초 주기)가 "active 0 + 큐 비어 있음"을 보면 자동 종료
 *  - 단일 실행 가드: 실행 중 crawl() 재호출은 CrawlerAlreadyRunningException
 *
 * 한 실행의 seen/pending/stats/active 카운트는 crawl() 시작 시 만들고 끝나면 버린다.
 * getStats()는 마지막(또는 진행 중) 실행의 카운터를 돌려준다.
 */
public final class Crawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final CrawlConfig config;
    private final IFetcher fetcher;
    private final IPageCache cache;
    private final ParserRegistry parsers;
    private final LinkExtractor markupLinks;
    private final FollowPolicy followPolicy;
    private final ProgressListener progressListener;
    private final Sleeper sleeper;

    private final AtomicReference<CrawlState> state = new AtomicReference<>(CrawlState.IDLE);
    private volatile CrawlStats stats = new CrawlStats();

    private Crawler(Builder b) {
        this.config = b.config;
        this.fetcher = b.fetcher;
        this.cache = b.cache;
        this.parsers = new ParserRegistry(b.parsers, b.rules, b.defaultParser);
        this.markupLinks = b.linkExtractor;
        this.followPolicy = new FollowPolicy(config.getFollowBehavior());
        this.progressListener = b.progressListener;
        this.sleeper = b.sleeper;
    }

    /* =========================
       실행 API
       ========================= */

    /** 설정의 seeds로 실행 */
    public void crawl(PageCallback callback) {
        crawl(config.getSeeds(), callback, null);
    }

    public void crawl(List<String> urls, PageCallback callback) {
        crawl(urls, callback, null);
    }

    /**
     * 시드를 크롤하고 처리된 페이지마다 콜백. 작업이 더 없거나 취소되면 반환.
     * 개별 페이지 실패는 콜백/통계로만 보인다.
     *
     * @param cancelFlag 호출자 취소 플래그(옵션). 스레드 인터럽트도 취소로 본다.
     * @throws CrawlerAlreadyRunningException 이미 실행 중
     * @throws CancellationException URL이 하나도 입장하기 전에 취소됨
     */
    public void crawl(List<String> urls, PageCallback callback, AtomicBoolean cancelFlag) {
        if (!state.compareAndSet(CrawlState.IDLE, CrawlState.RUNNING)) {
            throw new CrawlerAlreadyRunningException("crawler is already running");
        }
        try {
            runOnce(urls == null ? List.of() : urls,
                    callback == null ? PageCallback.NONE : callback,
                    new CrawlContext(cancelFlag));
        } finally {
            state.set(CrawlState.IDLE);
        }
    }

    private void runOnce(List<String> urls, PageCallback callback, CrawlContext ctx) {
        if (ctx.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("crawl cancelled before start");
        }

        final int workers = config.getWorkers();
        final int maxUrls = config.getMaxUrls();
        final CrawlStats runStats = new CrawlStats();
        final Frontier runFrontier = new Frontier(config.getQueueSize());
        this.stats = runStats;

        LOG.info("Crawl start: seeds={}, maxUrls={}, workers={}, follow={}",
                urls.size(), maxUrls, workers, followPolicy.behavior());
        SLOG.info("crawl-start",
                "seeds", urls.size(),
                "maxUrls", maxUrls,
                "workers", workers,
                "follow", String.valueOf(followPolicy.behavior()),
                "queueSize", runFrontier.capacity());

        PageProcessor processor = new PageProcessor(fetcher, config.getFetcherName(), cache, parsers,
                markupLinks, followPolicy, runFrontier, runStats, callback, maxUrls);

        // ---- 1) 고정 워커 풀 ----
        ExecutorService exec = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));
        ScheduledExecutorService monitor = Executors.newSingleThreadScheduledExecutor(
                new NamedThreadFactory("crawl-monitor"));

        long t0 = System.nanoTime();
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(exec.submit(new CrawlWorker(i, runFrontier, processor, runStats, ctx,
                        maxUrls, config.getRequestDelay(), sleeper)));
            }

            // ---- 2) 시드 입장 (블로킹, 취소 가능) ----
            int queued = enqueueSeeds(runFrontier, urls, ctx);
            if (queued == 0) {
                LOG.info("Crawl done. nothing queued");
                SLOG.info("crawl-done", "processed", 0, "succeeded", 0, "failed", 0, "elapsedMs", 0);
                return;
            }

            // ---- 3) 유휴 감시 + 진행 보고 ----
            long idleMs = config.getIdleCheckInterval().toMillis();
            monitor.scheduleAtFixedRate(new IdleMonitor(runFrontier, runStats, ctx, runFrontier::close),
                    idleMs, idleMs, TimeUnit.MILLISECONDS);
            if (config.isShowProgress()) {
                long pMs = config.getProgressInterval().toMillis();
                monitor.scheduleAtFixedRate(new ProgressReporter(runStats, runFrontier, progressListener, maxUrls),
                        pMs, pMs, TimeUnit.MILLISECONDS);
            }

            // ---- 4) 워커 종료 대기 ----
            awaitWorkers(futures, ctx);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            CrawlStats.Snapshot s = runStats.snapshot();
            LOG.info("Crawl done. processed={}, succeeded={}, failed={}, elapsedMs={}",
                    s.processed, s.succeeded, s.failed, elapsedMs);
            SLOG.info("crawl-done",
                    "processed", s.processed,
                    "succeeded", s.succeeded,
                    "failed", s.failed,
                    "seen", runFrontier.seenCount(),
                    "maxObservedCC", s.maxObservedConcurrency,
                    "elapsedMs", elapsedMs);
        } finally {
            // ---- 5) 종료: 취소 신호 → 큐 close → 워커 퇴장 대기 ----
            state.set(CrawlState.STOPPING);
            ctx.cancel();
            runFrontier.close();
            monitor.shutdownNow();
            exec.shutdown();
            try {
                if (!exec.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("Workers did not stop within {}s, interrupting", SHUTDOWN_GRACE_SECONDS);
                    exec.shutdownNow();
                }
            } catch (InterruptedException ie) {
                exec.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /** @return 새로 입장한 시드 수 */
    private int enqueueSeeds(Frontier f, List<String> urls, CrawlContext ctx) {
        int queued = 0;
        for (String raw : urls) {
            String url;
            try {
                url = UrlNormalizer.normalize(raw);
            } catch (InvalidUrlException e) {
                SLOG.warn("seed-invalid", "url", String.valueOf(raw), "error", e.getMessage());
                continue;
            }
            try {
                if (ctx.isCancelled()) throw new CancellationException("cancelled while queueing seeds");
                if (f.admitBlocking(url, ctx::isCancelled)) queued++;
            } catch (CancellationException ce) {
                if (queued == 0) throw ce;
                SLOG.info("seed-cancelled", "queued", queued);
                return queued;
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                ctx.cancel();
                if (queued == 0) throw new CancellationException("interrupted while queueing seeds");
                return queued;
            }
        }
        return queued;
    }

    private void awaitWorkers(List<Future<?>> futures, CrawlContext ctx) {
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (ExecutionException e) {
                Throwable cause = (e.getCause() != null ? e.getCause() : e);
                LOG.warn("Crawl worker failed: {}", cause.toString());
                SLOG.error("worker-failed", cause, "cause", cause.toString());
            } catch (InterruptedException ie) {
                // 호출자 인터럽트 = 취소. 워커는 현재 URL을 마치고 빠진다
                Thread.currentThread().interrupt();
                ctx.cancel();
                SLOG.info("crawl-cancelled", "reason", "interrupted");
                return;
            } catch (CancellationException ce) {
                return;
            }
        }
    }

    /* =========================
       게터
       ========================= */

    public CrawlStats getStats() { return stats; }

    public CrawlState getState() { return state.get(); }

    public boolean isRunning() { return state.get() != CrawlState.IDLE; }

    /* =========================
       빌더
       ========================= */

    public static Builder builder(CrawlConfig config) { return new Builder(config); }

    public static final class Builder {
        private final CrawlConfig config;
        private IFetcher fetcher;
        private IPageCache cache;
        private final Map<String, IPageParser> parsers = new LinkedHashMap<>();
        private final List<ParserRule> rules = new ArrayList<>();
        private IPageParser defaultParser;
        private LinkExtractor linkExtractor = new JsoupLinkExtractor();
        private ProgressListener progressListener = ProgressListener.NONE;
        private Sleeper sleeper = DefaultSleeper.INSTANCE;

        private Builder(CrawlConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /** 없으면 설정 기반 HttpFetcher */
        public Builder fetcher(IFetcher fetcher) { this.fetcher = fetcher; return this; }

        /** 없으면 cache.dir 설정 시 FileSystemPageCache, 아니면 캐시 없음 */
        public Builder cache(IPageCache cache) { this.cache = cache; return this; }

        /** host 정확 일치 파서 */
        public Builder parser(String host, IPageParser parser) {
            this.parsers.put(Objects.requireNonNull(host, "host"), Objects.requireNonNull(parser, "parser"));
            return this;
        }
        public Builder parsers(Map<String, IPageParser> byHost) {
            if (byHost != null) byHost.forEach(this::parser);
            return this;
        }
        public Builder parserRule(ParserRule rule) { this.rules.add(Objects.requireNonNull(rule, "rule")); return this; }
        public Builder defaultParser(IPageParser parser) { this.defaultParser = parser; return this; }

        /** 링크가 비어 온 응답(캐시 히트)에서 마크업을 다시 읽을 추출기. null이면 추출 안 함 */
        public Builder linkExtractor(LinkExtractor extractor) { this.linkExtractor = extractor; return this; }

        public Builder progressListener(ProgressListener l) {
            this.progressListener = (l != null ? l : ProgressListener.NONE);
            return this;
        }
        public Builder sleeper(Sleeper s) { this.sleeper = (s != null ? s : DefaultSleeper.INSTANCE); return this; }

        public Crawler build() {
            config.validate();
            if (fetcher == null) fetcher = new HttpFetcher(config.getHttp());
            if (cache == null && config.getCache().getDir() != null) {
                cache = new FileSystemPageCache(config.getCache().getDir());
            }
            return new Crawler(this);
        }
    }

}
