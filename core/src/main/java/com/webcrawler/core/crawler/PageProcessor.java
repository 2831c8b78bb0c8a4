package com.webcrawler.core.crawler;

import com.webcrawler.core.api.FetchException;
import com.webcrawler.core.api.IFetcher;
import com.webcrawler.core.api.IPageCache;
import com.webcrawler.core.api.IPageParser;
import com.webcrawler.core.api.PageCallback;
import com.webcrawler.core.model.CrawlStats;
import com.webcrawler.core.model.FetchRequest;
import com.webcrawler.core.model.FetchResponse;
import com.webcrawler.core.model.PageLink;
import com.webcrawler.core.util.StructuredLog;
import com.webcrawler.core.util.UrlNormalizer;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * URL 하나의 처리 파이프라인 (워커 한 개가 끝까지 수행):
 * processed++ → host 파싱 → 캐시 → fetch → 캐시 저장 → 파서 → 링크 추출 → 콜백 → 팔로우 필터 → 재입장 → succeeded++
 *
 * URL 단위 오류는 여기서 전부 격리된다(콜백 + 카운터로만 보고, 재시도 없음).
 */
final class PageProcessor {

    private static final StructuredLog SLOG = StructuredLog.get(PageProcessor.class);

    private final IFetcher fetcher;
    private final String fetcherName;
    private final IPageCache cache;          // null이면 캐시 미사용
    private final ParserRegistry parsers;
    private final LinkExtractor markupLinks; // 링크 없는 응답(캐시 히트 등)용, null 허용
    private final FollowPolicy followPolicy;
    private final Frontier frontier;
    private final CrawlStats stats;
    private final PageCallback callback;
    private final int maxUrls;

    PageProcessor(IFetcher fetcher, String fetcherName, IPageCache cache, ParserRegistry parsers,
                  LinkExtractor markupLinks, FollowPolicy followPolicy, Frontier frontier,
                  CrawlStats stats, PageCallback callback, int maxUrls) {
        this.fetcher = fetcher;
        this.fetcherName = fetcherName;
        this.cache = cache;
        this.parsers = parsers;
        this.markupLinks = markupLinks;
        this.followPolicy = followPolicy;
        this.frontier = frontier;
        this.stats = stats;
        this.callback = callback;
        this.maxUrls = maxUrls;
    }

    void process(String rawUrl) {
        stats.incrementProcessed();

        // 1) host 파싱: 실패 시 succeeded/failed 어느 쪽도 아님
        URI pageUri;
        try {
            pageUri = new URI(rawUrl);
        } catch (URISyntaxException e) {
            SLOG.warn("page-invalid-url", "url", rawUrl, "error", e.getMessage());
            return;
        }
        String host = UrlNormalizer.hostOf(pageUri);
        if (host == null) {
            SLOG.warn("page-invalid-url", "url", rawUrl, "error", "no host");
            return;
        }

        // 2) 캐시 우선 (키 = 원 URL 문자열)
        FetchResponse response = lookupCache(rawUrl);

        FetchRequest request = FetchRequest.builder()
                .url(rawUrl)
                .fetcher(fetcherName)
                .build();

        // 3) 캐시 미스 → fetch
        if (response == null) {
            try {
                response = fetcher.fetch(request);
                if (response == null) throw new FetchException(rawUrl, "fetcher returned no response");
            } catch (Exception e) {
                if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                SLOG.warn("fetch-failed", "url", rawUrl, "error", String.valueOf(e.getMessage()));
                deliver(request, null, e);
                stats.incrementFailed();
                return;
            }
            storeCache(rawUrl, response);
        }

        // 4) 파서 (실패해도 페이지는 성공)
        Object parsed = null;
        Throwable parseError = null;
        IPageParser parser = parsers.select(host);
        if (parser != null) {
            SLOG.debug("parse", "url", rawUrl, "domain", host);
            try {
                parsed = parser.parse(response);
            } catch (Exception e) {
                parseError = new PageParseException(rawUrl, e);
                SLOG.error("parse-failed", e, "url", rawUrl);
            }
        }

        // 5) 링크 추출 → 페이지 내 중복 제거 + 정렬
        List<String> discovered = extractUrls(linksOf(response, rawUrl), host);

        // 6) 콜백은 정확히 한 번
        deliver(request, parsed, parseError);

        // 7) 팔로우 필터 → 비블로킹 입장
        queueDiscovered(followPolicy.filter(pageUri, discovered));
        stats.incrementSucceeded();
    }

    private FetchResponse lookupCache(String rawUrl) {
        if (cache == null) return null;
        try {
            Optional<byte[]> hit = cache.get(rawUrl);
            if (hit.isPresent()) {
                SLOG.debug("cache-hit", "url", rawUrl);
                return FetchResponse.fromCache(rawUrl, new String(hit.get(), StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            SLOG.warn("cache-read-failed", "url", rawUrl, "error", e.getMessage());
        }
        return null;
    }

    private void storeCache(String rawUrl, FetchResponse response) {
        if (cache == null || response.getHtml().isEmpty()) return;
        try {
            cache.set(rawUrl, response.getHtml().getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            SLOG.warn("cache-write-failed", "url", rawUrl, "error", e.getMessage());
        }
    }

    private List<PageLink> linksOf(FetchResponse response, String rawUrl) {
        if (response.getLinks() != null) return response.getLinks();
        // 캐시 히트 응답은 마크업뿐 → 마크업에서 직접 추출
        if (markupLinks != null && !response.getHtml().isEmpty()) {
            try {
                return markupLinks.extract(response.getHtml(), rawUrl);
            } catch (RuntimeException e) {
                SLOG.warn("link-extract-failed", "url", rawUrl, "error", e.getMessage());
            }
        }
        return List.of();
    }

    static List<String> extractUrls(List<PageLink> links, String domain) {
        if (links == null || links.isEmpty()) return List.of();
        TreeSet<String> unique = new TreeSet<>();
        for (PageLink link : links) {
            if (link == null) continue;
            LinkResolver.resolve(domain, link.url()).ifPresent(unique::add);
        }
        return new ArrayList<>(unique);
    }

    private void queueDiscovered(List<String> urls) {
        int admitted = 0, dropped = 0;
        for (String url : urls) {
            if (stats.getProcessed() >= maxUrls) break;
            switch (frontier.tryAdmit(url)) {
                case ADMITTED -> admitted++;
                case DROPPED -> dropped++;
                case DUPLICATE -> { }
            }
        }
        if (dropped > 0) {
            SLOG.warn("queue-full-drop", "dropped", dropped, "admitted", admitted, "capacity", frontier.capacity());
        }
    }

    private void deliver(FetchRequest request, Object parsed, Throwable error) {
        try {
            callback.onPage(request, parsed, error);
        } catch (RuntimeException e) {
            SLOG.error("callback-failed", e, "url", request.getUrl());
        }
    }
}
