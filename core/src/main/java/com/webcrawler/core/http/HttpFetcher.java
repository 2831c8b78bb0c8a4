package com.webcrawler.core.http;

import com.webcrawler.core.api.FetchException;
import com.webcrawler.core.api.IFetcher;
import com.webcrawler.core.crawler.JsoupLinkExtractor;
import com.webcrawler.core.model.CrawlConfig;
import com.webcrawler.core.model.FetchRequest;
import com.webcrawler.core.model.FetchResponse;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 기본 HTTP 페처: GET → text/html 확인 → 본문 상한 읽기 → title/링크 추출.
 * 상태 코드는 실패로 보지 않는다(4xx/5xx 본문도 HTML이면 페이지로 취급).
 */
public class HttpFetcher implements IFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig.HttpCfg config;
    private final HttpSender sender;
    private final JsoupLinkExtractor links = new JsoupLinkExtractor();

    public HttpFetcher(CrawlConfig.HttpCfg config) {
        this.config = Objects.requireNonNull(config, "config");
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = req -> client.send(req, HttpResponse.BodyHandlers.ofInputStream());
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpFetcher(CrawlConfig.HttpCfg config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    @Override
    public FetchResponse fetch(FetchRequest request) throws FetchException, InterruptedException {
        final String url = request.getUrl();
        HttpRequest req = buildRequest(request);

        HttpResponse<InputStream> resp;
        try {
            resp = sender.send(req);
        } catch (IOException e) {
            throw new FetchException(url, "request failed: " + describe(e), e);
        }

        int status = resp.statusCode();
        String contentType = resp.headers().firstValue("Content-Type").orElse("");
        try (InputStream in = resp.body()) {
            if (!contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
                throw new FetchException(url, status, "unexpected content type: " + contentType, null);
            }
            byte[] body = readCapped(in, config.getMaxBodyBytes(), url, status);
            String html = new String(body, charsetOf(contentType));

            Document doc = Jsoup.parse(html, url);
            return FetchResponse.builder()
                    .url(url)
                    .statusCode(status)
                    .headers(flatten(resp.headers().map()))
                    .html(html)
                    .title(doc.title())
                    .links(links.extract(doc))
                    .build();
        } catch (IOException e) {
            if (e instanceof FetchException fe) throw fe;
            throw new FetchException(url, status, "read failed: " + describe(e), e);
        }
    }

    private HttpRequest buildRequest(FetchRequest request) throws FetchException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", config.getUserAgent());
        headers.putAll(config.getHeaders());
        headers.putAll(request.getHeaders()); // 요청 헤더가 기본값을 덮어씀

        Duration timeout = (request.getTimeout() != null) ? request.getTimeout() : config.getTimeout();
        try {
            HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(request.getUrl()))
                    .timeout(timeout)
                    .GET();
            headers.forEach((k, v) -> { if (k != null && v != null) b.header(k, v); });
            return b.build();
        } catch (IllegalArgumentException e) {
            // 잘못된 URI 또는 제한 헤더(Host 등)
            throw new FetchException(request.getUrl(), "invalid request: " + e.getMessage(), e);
        }
    }

    /** max+1 바이트까지만 읽고 넘으면 실패 */
    static byte[] readCapped(InputStream in, long max, String url, int status) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (total > max) {
                throw new FetchException(url, status, "body exceeds " + max + " bytes", null);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String name = p.substring(8).trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException ignore) {
                    return StandardCharsets.UTF_8; // 모르는 charset은 UTF-8로
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    /** HttpClient 연결 예외는 메시지가 비어 있는 경우가 많다 */
    private static String describe(IOException e) {
        return (e.getMessage() == null || e.getMessage().isBlank()) ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static Map<String, String> flatten(Map<String, List<String>> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (k != null && v != null && !v.isEmpty()) out.put(k, v.get(0));
        });
        return out;
    }
}
