package com.webcrawler.core.util;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * 프론티어 입장 키를 만드는 URL 정규화.
 * 같은 입력은 실행 내내 항상 같은 문자열로 정규화되어야 한다(중복 제거의 전제).
 */
public final class UrlNormalizer {
    private UrlNormalizer() {}

    private static final String HTTPS = "https://";
    private static final String HTTP = "http://";

    /**
     * 정규화 규칙(순서 고정):
     * - 앞뒤 공백 제거, 빈 문자열은 거부
     * - "://"가 없으면 https:// 접두
     * - http:// → https:// 로 강제
     * - 그 외 스킴(ftp:// 등)은 거부
     * - query / fragment 제거
     * - 루트 경로 "/" 는 빈 경로로
     *
     * @throws InvalidUrlException 비었거나 스킴이 http/https가 아니거나 파싱 불가
     */
    public static String normalize(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            throw new InvalidUrlException("invalid empty url", raw);
        }
        int sep = value.indexOf("://");
        if (sep < 0) {
            value = HTTPS + value;
        } else {
            String scheme = value.substring(0, sep);
            if (scheme.equalsIgnoreCase("http")) {
                value = HTTPS + value.substring(HTTP.length());
            } else if (!scheme.equalsIgnoreCase("https")) {
                throw new InvalidUrlException("invalid url: " + value, raw);
            }
        }

        URI u;
        try {
            u = new URI(value);
        } catch (URISyntaxException e) {
            throw new InvalidUrlException("invalid url \"" + value + "\": " + e.getReason(), raw, e);
        }
        if (u.getRawAuthority() == null || u.getRawAuthority().isEmpty()) {
            throw new InvalidUrlException("invalid url (no host): " + value, raw);
        }

        String path = u.getRawPath() == null ? "" : u.getRawPath();
        if (path.equals("/")) path = "";

        // 원문 인코딩 유지: raw 조각을 그대로 이어 붙인다
        return "https://" + u.getRawAuthority() + path;
    }

    /** 정규화 실패 시 null (로그/건너뛰기 용도) */
    public static String normalizeOrNull(String raw) {
        try {
            return normalize(raw);
        } catch (InvalidUrlException e) {
            return null;
        }
    }

    /** 정규화된 URL의 host. 파싱 실패 시 null */
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            return hostOf(new URI(url));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * URI의 host. 밑줄 등이 들어간 host는 URI가 registry 기반 authority로 보고 getHost()가 null이므로
     * raw authority에서 userinfo와 port를 떼어 쓴다. host가 없으면 null.
     */
    public static String hostOf(URI u) {
        String authority = authorityHostPort(u);
        if (authority == null) return null;
        if (u.getHost() != null) return u.getHost();
        int colon = authority.lastIndexOf(':');
        if (colon >= 0 && !authority.endsWith("]")) authority = authority.substring(0, colon);
        return authority.isEmpty() ? null : authority;
    }

    /** host[:port] (userinfo 제외). port가 없으면 host만. */
    public static String hostPortOf(URI u) {
        String host = hostOf(u);
        if (host == null) return null;
        int port = u.getPort();
        if (port == -1 && u.getHost() == null) {
            String authority = authorityHostPort(u);
            int colon = authority.lastIndexOf(':');
            if (colon >= 0 && !authority.endsWith("]")) return host + authority.substring(colon);
            return host;
        }
        return port == -1 ? host : host + ":" + port;
    }

    private static String authorityHostPort(URI u) {
        if (u == null || u.getRawAuthority() == null) return null;
        String a = u.getRawAuthority();
        int at = a.lastIndexOf('@');
        return (at >= 0) ? a.substring(at + 1) : a;
    }
}
