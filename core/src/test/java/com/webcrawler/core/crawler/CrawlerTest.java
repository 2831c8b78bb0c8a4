package com.webcrawler.core.crawler;

import com.webcrawler.core.api.IPageParser;
import com.webcrawler.core.cache.InMemoryPageCache;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.FollowBehavior;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Crawler: 워커 풀/프론티어/유휴 종료")
@Timeout(value = 20, unit = TimeUnit.SECONDS)
class CrawlerTest {

    private static final String ROOT = "https://example.com";

    private static CrawlConfig cfg() {
        return CrawlConfig.defaults()
                .setMaxUrls(1000)
                .setWorkers(4)
                .setIdleCheckInterval(Duration.ofMillis(20));
    }

    @Test
    @DisplayName("seed → /a,/b ; /a → /b,/c ; /b → /a → 4페이지 각 1회")
    void crawlsReachableGraph_onceEach() {
        FakeSite site = new FakeSite()
                .page(ROOT, "/a", "/b")
                .page(ROOT + "/a", "/b", "c")
                .page(ROOT + "/b", "/a", "#top")
                .page(ROOT + "/c");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of("http://example.com/"), cb);

        assertThat(cb.urls()).containsExactlyInAnyOrder(ROOT, ROOT + "/a", ROOT + "/b", ROOT + "/c");
        assertThat(crawler.getStats().getProcessed()).isEqualTo(4);
        assertThat(crawler.getStats().getSucceeded()).isEqualTo(4);
        assertThat(crawler.getStats().getFailed()).isZero();
        assertThat(crawler.getState()).isEqualTo(CrawlState.IDLE);
    }

    @Test
    @DisplayName("완전 그래프 60페이지 × 워커 8 → URL마다 fetch/콜백 정확히 1회")
    void denseGraph_fetchesEachUrlExactlyOnce() {
        int n = 60;
        String[] all = new String[n];
        for (int i = 0; i < n; i++) all[i] = "/p" + i;
        FakeSite site = new FakeSite().page(ROOT, all);
        for (int i = 0; i < n; i++) site.page(ROOT + "/p" + i, all);
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg().setWorkers(8)).fetcher(site).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(site.callCounts()).hasSize(n + 1);
        assertThat(site.callCounts().values()).allMatch(c -> c == 1);
        assertThat(cb.countsByUrl().values()).allMatch(c -> c == 1);
        assertThat(crawler.getStats().getProcessed()).isEqualTo(n + 1);
        assertThat(crawler.getStats().snapshot().maxObservedConcurrency).isLessThanOrEqualTo(8);
        assertThat(site.maxConcurrentFetches()).isLessThanOrEqualTo(8);
    }

    @Test
    @DisplayName("maxUrls=5, 워커 1 → 정확히 5페이지 후 종료")
    void processedCap_singleWorkerIsExact() {
        FakeSite site = chain(50);
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg().setWorkers(1).setMaxUrls(5)).fetcher(site).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(crawler.getStats().getProcessed()).isEqualTo(5);
        assertThat(cb.outcomes).hasSize(5);
    }

    @Test
    @DisplayName("maxUrls는 소프트 캡: 워커 N이면 최대 max + N - 1")
    void processedCap_isSoftWithManyWorkers() {
        int n = 40;
        String[] all = new String[n];
        for (int i = 0; i < n; i++) all[i] = "/p" + i;
        FakeSite site = new FakeSite().page(ROOT, all).latency(5);
        for (int i = 0; i < n; i++) site.page(ROOT + "/p" + i);

        Crawler crawler = Crawler.builder(cfg().setWorkers(4).setMaxUrls(10)).fetcher(site).build();
        crawler.crawl(List.of(ROOT), new RecordingCallback());

        assertThat(crawler.getStats().getProcessed()).isBetween(10L, 13L);
    }

    @Test
    @DisplayName("캐시 히트 → fetcher 호출 없이 마크업 링크로 확장")
    void cacheHit_skipsFetcher_andFollowsMarkupLinks() throws Exception {
        InMemoryPageCache cache = new InMemoryPageCache();
        cache.set(ROOT, "<html><body><a href=\"/a\">A</a></body></html>".getBytes(StandardCharsets.UTF_8));
        FakeSite site = new FakeSite().page(ROOT + "/a");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).cache(cache).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(site.calls(ROOT)).isZero();
        assertThat(site.calls(ROOT + "/a")).isEqualTo(1);
        assertThat(cb.urls()).containsExactlyInAnyOrder(ROOT, ROOT + "/a");
        // fetch 결과는 캐시에 저장됨
        assertThat(cache.contains(ROOT + "/a")).isTrue();
    }

    @Test
    @DisplayName("/bad fetch 실패 → 콜백 에러 1건, 나머지는 계속, crawl은 정상 반환")
    void fetchFailure_isContainedToPage() {
        FakeSite site = new FakeSite()
                .page(ROOT, "/ok", "/bad")
                .page(ROOT + "/ok", "/deep")
                .page(ROOT + "/deep")
                .failing(ROOT + "/bad");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(cb.urls()).containsExactlyInAnyOrder(ROOT, ROOT + "/ok", ROOT + "/bad", ROOT + "/deep");
        assertThat(cb.of(ROOT + "/bad").error()).isNotNull();
        assertThat(cb.of(ROOT + "/ok").error()).isNull();
        assertThat(crawler.getStats().getFailed()).isEqualTo(1);
        assertThat(crawler.getStats().getSucceeded()).isEqualTo(3);
        assertThat(crawler.getStats().getProcessed()).isEqualTo(4);
    }

    @Test
    @DisplayName("파서 예외 → PageParseException을 콜백으로, 페이지는 succeeded")
    void parserFailure_reportedButPageSucceeds() {
        FakeSite site = new FakeSite().page(ROOT, "/a").page(ROOT + "/a");
        IPageParser exploding = resp -> {
            if (resp.getUrl().endsWith("/a")) throw new IllegalStateException("bad markup");
            return "ok:" + resp.getUrl();
        };
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).parser("example.com", exploding).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(cb.of(ROOT).parsed()).isEqualTo("ok:" + ROOT);
        assertThat(cb.of(ROOT + "/a").error()).isInstanceOf(PageParseException.class)
                .hasRootCauseMessage("bad markup");
        assertThat(crawler.getStats().getSucceeded()).isEqualTo(2);
        assertThat(crawler.getStats().getFailed()).isZero();
    }

    @Test
    @DisplayName("host 정확 일치 파서 > 규칙 > 기본 파서")
    void parserDispatch_exactThenRulesThenDefault() {
        FakeSite site = new FakeSite()
                .page(ROOT, "https://blog.example.com/", "https://other.org/")
                .page("https://blog.example.com")
                .page("https://other.org");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg().setFollowBehavior(FollowBehavior.ANY))
                .fetcher(site)
                .parser("example.com", r -> "exact")
                .parserRule(ParserRule.suffix(".example.com", r -> "suffix", 0))
                .defaultParser(r -> "default")
                .build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(cb.of(ROOT).parsed()).isEqualTo("exact");
        assertThat(cb.of("https://blog.example.com").parsed()).isEqualTo("suffix");
        assertThat(cb.of("https://other.org").parsed()).isEqualTo("default");
    }

    @Test
    @DisplayName("follow=NONE → 시드만 처리")
    void followNone_processesSeedsOnly() {
        FakeSite site = new FakeSite().page(ROOT, "/a").page("https://example.org", "/b");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg().setFollowBehavior(FollowBehavior.NONE)).fetcher(site).build();
        crawler.crawl(List.of(ROOT, "example.org"), cb);

        assertThat(cb.urls()).containsExactlyInAnyOrder(ROOT, "https://example.org");
    }

    @Test
    @DisplayName("follow=SAME_HOST → 서브도메인/외부 링크 제외")
    void followSameHost_skipsOtherHosts() {
        FakeSite site = new FakeSite()
                .page(ROOT, "/a", "https://sub.example.com/c", "https://other.com/b")
                .page(ROOT + "/a");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(cb.urls()).containsExactlyInAnyOrder(ROOT, ROOT + "/a");
        assertThat(site.calls("https://other.com/b")).isZero();
    }

    @Test
    @DisplayName("잘못된 시드는 건너뛰고, 전부 잘못되면 바로 반환")
    void invalidSeeds_areSkipped() {
        FakeSite site = new FakeSite().page(ROOT);
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of("ftp://example.com/file", "  ", ROOT), cb);
        assertThat(cb.urls()).containsExactly(ROOT);

        RecordingCallback none = new RecordingCallback();
        crawler.crawl(List.of("ftp://example.org/", ""), none);
        assertThat(none.outcomes).isEmpty();
        assertThat(crawler.getStats().getProcessed()).isZero();
    }

    @Test
    @DisplayName("중복 시드는 한 번만 입장")
    void duplicateSeeds_admittedOnce() {
        FakeSite site = new FakeSite().page(ROOT);
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of(ROOT, "http://example.com/", "example.com?x=1#f"), cb);

        assertThat(cb.urls()).containsExactly(ROOT);
    }

    @Test
    @DisplayName("콜백 RuntimeException은 해당 페이지에 격리")
    void callbackException_doesNotStopCrawl() {
        FakeSite site = new FakeSite().page(ROOT, "/a", "/b").page(ROOT + "/a").page(ROOT + "/b");
        AtomicInteger calls = new AtomicInteger();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of(ROOT), (req, parsed, err) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("callback broke");
        });

        assertThat(calls.get()).isEqualTo(3);
        assertThat(crawler.getStats().getSucceeded()).isEqualTo(3);
    }

    @Test
    @DisplayName("실행 중 두 번째 crawl → CrawlerAlreadyRunningException")
    void secondCrawlWhileRunning_isRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeSite site = new FakeSite().page(ROOT);
        Crawler crawler = Crawler.builder(cfg()).fetcher(req -> {
            entered.countDown();
            release.await(10, TimeUnit.SECONDS);
            return site.fetch(req);
        }).build();

        AtomicReference<Throwable> firstError = new AtomicReference<>();
        Thread first = new Thread(() -> {
            try {
                crawler.crawl(List.of(ROOT), new RecordingCallback());
            } catch (Throwable t) {
                firstError.set(t);
            }
        });
        first.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(crawler.isRunning()).isTrue();
        assertThatThrownBy(() -> crawler.crawl(List.of(ROOT), new RecordingCallback()))
                .isInstanceOf(CrawlerAlreadyRunningException.class);

        release.countDown();
        first.join(10_000);
        assertThat(firstError.get()).isNull();
        assertThat(crawler.getState()).isEqualTo(CrawlState.IDLE);
        assertThat(crawler.getStats().getProcessed()).isEqualTo(1);
    }

    @Test
    @DisplayName("시작 전 취소 → CancellationException, 상태는 IDLE로 복귀")
    void cancelledBeforeStart_throws() {
        FakeSite site = new FakeSite().page(ROOT);
        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();

        assertThatThrownBy(() -> crawler.crawl(List.of(ROOT), new RecordingCallback(), new AtomicBoolean(true)))
                .isInstanceOf(CancellationException.class);
        assertThat(crawler.getState()).isEqualTo(CrawlState.IDLE);
        assertThat(site.totalCalls()).isZero();

        // 다시 실행 가능
        crawler.crawl(List.of(ROOT), new RecordingCallback());
        assertThat(crawler.getStats().getProcessed()).isEqualTo(1);
    }

    @Test
    @DisplayName("실행 중 외부 취소 → 무한 체인이어도 정상 반환")
    void externalCancelMidRun_drainsAndReturns() {
        AtomicBoolean cancel = new AtomicBoolean(false);
        AtomicInteger fetched = new AtomicInteger();
        // /n → /n+1 무한 체인
        Crawler crawler = Crawler.builder(cfg().setWorkers(2)).fetcher(req -> {
            int n = fetched.incrementAndGet();
            if (n == 5) cancel.set(true);
            Thread.sleep(5);
            String next = "/n" + n;
            return com.webcrawler.core.model.FetchResponse.builder()
                    .url(req.getUrl()).html("<html/>")
                    .links(List.of(com.webcrawler.core.model.PageLink.of(next)))
                    .build();
        }).build();

        crawler.crawl(List.of(ROOT), new RecordingCallback(), cancel);

        assertThat(crawler.getState()).isEqualTo(CrawlState.IDLE);
        assertThat(crawler.getStats().getProcessed()).isLessThan(50);
    }

    @Test
    @DisplayName("요청 간 대기는 처리한 페이지마다 Sleeper로")
    void requestDelay_usesSleeperPerPage() {
        FakeSite site = new FakeSite().page(ROOT, "/a").page(ROOT + "/a");
        List<Duration> sleeps = new ArrayList<>();

        Crawler crawler = Crawler.builder(cfg().setWorkers(1).setRequestDelayMs(250))
                .fetcher(site)
                .sleeper(d -> { synchronized (sleeps) { sleeps.add(d); } })
                .build();
        crawler.crawl(List.of(ROOT), new RecordingCallback());

        synchronized (sleeps) {
            assertThat(sleeps).hasSize(2).allMatch(d -> d.toMillis() == 250);
        }
    }

    @Test
    @DisplayName("진행 보고 켜짐 → ProgressListener가 주기적으로 호출됨")
    void progressListener_isNotified() {
        FakeSite site = chain(10).latency(30);
        AtomicInteger reports = new AtomicInteger();

        Crawler crawler = Crawler.builder(cfg().setWorkers(1)
                        .setShowProgress(true)
                        .setProgressInterval(Duration.ofMillis(20)))
                .fetcher(site)
                .progressListener((s, queued, max) -> {
                    assertThat(max).isEqualTo(1000);
                    reports.incrementAndGet();
                })
                .build();
        crawler.crawl(List.of(ROOT), new RecordingCallback());

        assertThat(reports.get()).isPositive();
        assertThat(crawler.getStats().getProcessed()).isEqualTo(11);
    }

    @Test
    @DisplayName("큐 용량 1 → 넘치는 발견 링크는 버려지고 교착 없이 종료")
    void tinyQueue_dropsOverflowWithoutDeadlock() {
        FakeSite site = new FakeSite().page(ROOT, "/a", "/b", "/c", "/d")
                .page(ROOT + "/a").page(ROOT + "/b").page(ROOT + "/c").page(ROOT + "/d")
                .latency(10);
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg().setWorkers(1).setQueueSize(1)).fetcher(site).build();
        crawler.crawl(List.of(ROOT), cb);

        assertThat(cb.outcomes.size()).isBetween(2, 5);
        assertThat(cb.countsByUrl().values()).allMatch(c -> c == 1);
    }

    @Test
    @DisplayName("밑줄이 든 host도 fetch/콜백/링크 확장 대상")
    void underscoreHost_isCrawled() {
        String root = "https://my_site.example.com";
        FakeSite site = new FakeSite().page(root, "/a", "https://other.com/x").page(root + "/a");
        RecordingCallback cb = new RecordingCallback();

        Crawler crawler = Crawler.builder(cfg()).fetcher(site).build();
        crawler.crawl(List.of(root), cb);

        assertThat(cb.urls()).containsExactlyInAnyOrder(root, root + "/a");
        assertThat(cb.outcomes).allMatch(o -> o.error() == null);
        assertThat(site.calls(root)).isEqualTo(1);
        assertThat(crawler.getStats().getSucceeded()).isEqualTo(2);
    }

    /** ROOT → /1 → /2 → ... → /n */
    private static FakeSite chain(int n) {
        FakeSite site = new FakeSite().page(ROOT, "/1");
        for (int i = 1; i < n; i++) site.page(ROOT + "/" + i, "/" + (i + 1));
        site.page(ROOT + "/" + n);
        return site;
    }
}
