package com.webcrawler.core.model;

import java.util.Locale;

/** 발견된 링크를 따라갈지 결정하는 정책. 크롤러 생성 시 한 번 정해진다. */
public enum FollowBehavior {
    /** 어떤 링크도 따라가지 않음 (시드만 처리) */
    NONE,
    /** 모든 링크 */
    ANY,
    /** host 문자열이 완전히 같을 때만 */
    SAME_HOST,
    /** host 마지막 두 라벨이 같을 때 (blog.example.com ~ shop.example.com) */
    RELATED_SUBDOMAINS;

    /**
     * CLI/YAML 표기 해석: "same-domain", "same_host", "related-subdomains" 등.
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static FollowBehavior parse(String value) {
        if (value == null) throw new IllegalArgumentException("follow behavior is null");
        String s = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (s) {
            case "none" -> NONE;
            case "any" -> ANY;
            case "same_host", "same_domain", "samehost", "samedomain" -> SAME_HOST;
            case "related_subdomains", "related", "relatedsubdomains" -> RELATED_SUBDOMAINS;
            default -> throw new IllegalArgumentException("Invalid follow mode: " + value);
        };
    }
}
