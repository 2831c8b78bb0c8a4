package com.webcrawler.core.crawler;

import com.webcrawler.core.model.FollowBehavior;
import com.webcrawler.core.util.UrlNormalizer;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 발견 링크 → 큐 입장 후보 필터. host 비교만 하는 순수 함수. */
public final class FollowPolicy {

    private final FollowBehavior behavior;

    public FollowPolicy(FollowBehavior behavior) {
        this.behavior = Objects.requireNonNull(behavior, "behavior");
    }

    public FollowBehavior behavior() { return behavior; }

    /** 정규화된 링크 목록 중 따라갈 대상만 (입력 순서 유지) */
    public List<String> filter(URI page, List<String> links) {
        if (behavior == FollowBehavior.NONE || links == null || links.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(links.size());
        for (String raw : links) {
            String n = UrlNormalizer.normalizeOrNull(raw);
            if (n == null) continue;
            URI candidate;
            try {
                candidate = new URI(n);
            } catch (URISyntaxException e) {
                continue;
            }
            if (admit(page, candidate, behavior)) out.add(n);
        }
        return out;
    }

    public static boolean admit(URI page, URI candidate, FollowBehavior behavior) {
        return switch (behavior) {
            case NONE -> false;
            case ANY -> true;
            case SAME_HOST -> sameHost(page, candidate);
            case RELATED_SUBDOMAINS -> relatedHosts(page, candidate);
        };
    }

    /** host(+port) 바이트 비교 */
    static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = UrlNormalizer.hostPortOf(a);
        return ha != null && ha.equals(UrlNormalizer.hostPortOf(b));
    }

    /** 마지막 두 라벨 비교. 라벨이 2개 미만(localhost 등)이면 항상 false */
    static boolean relatedHosts(URI a, URI b) {
        if (a == null || b == null) return false;
        String base1 = baseDomain(UrlNormalizer.hostOf(a));
        String base2 = baseDomain(UrlNormalizer.hostOf(b));
        return base1 != null && base1.equals(base2);
    }

    private static String baseDomain(String host) {
        if (host == null) return null;
        String[] parts = host.split("\\.", -1);
        if (parts.length < 2) return null;
        return parts[parts.length - 2] + "." + parts[parts.length - 1];
    }
}
