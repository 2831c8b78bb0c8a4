package com.webcrawler.core.crawler;

import com.webcrawler.core.util.UrlNormalizer;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * 페이지에서 찾은 링크(상대/절대)를 정규화된 절대 URL로 변환.
 * 실패는 전부 Optional.empty()로 흡수한다(예외를 밖으로 내보내지 않음).
 */
public final class LinkResolver {
    private LinkResolver() {}

    /**
     * @param pageDomain 링크가 발견된 페이지의 host (예: "example.com")
     * @param rawLink    href 원문
     */
    public static Optional<String> resolve(String pageDomain, String rawLink) {
        if (rawLink == null) return Optional.empty();
        String value = rawLink.trim();
        int hash = value.indexOf('#');
        if (hash >= 0) value = value.substring(0, hash); // fragment 제거
        value = escapeIllegal(value);

        URI link;
        try {
            link = new URI(value);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }

        try {
            if (link.isAbsolute()) {
                // http/https만 허용: mailto:, javascript:, ftp: 등 제외
                String scheme = link.getScheme();
                if (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https")) {
                    return Optional.empty();
                }
                return Optional.of(UrlNormalizer.normalize(value));
            }

            if (pageDomain == null || pageDomain.isBlank()) return Optional.empty();
            String base = pageDomain;
            if (!base.startsWith("http://") && !base.startsWith("https://")) {
                base = "https://" + base;
            }
            // 빈 경로 base에 상대 경로를 붙이면 슬래시가 빠지므로 루트를 명시
            URI baseUri = new URI(base);
            if (baseUri.getRawPath() == null || baseUri.getRawPath().isEmpty()) {
                baseUri = new URI(base + "/");
            }
            URI resolved = baseUri.resolve(link);
            return Optional.of(UrlNormalizer.normalize(resolved.toString()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            // InvalidUrlException 포함
            return Optional.empty();
        }
    }

    private static final String ILLEGAL = " \"<>\\^`{|}";

    /** 마크업에 흔한 미인코딩 문자(공백, | 등)를 %XX로. 기존 %XX는 그대로 둔다. */
    static String escapeIllegal(String s) {
        StringBuilder sb = null;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (ILLEGAL.indexOf(c) >= 0) {
                if (sb == null) sb = new StringBuilder(s.length() + 8).append(s, 0, i);
                sb.append('%').append(String.format("%02X", (int) c));
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? s : sb.toString();
    }
}
