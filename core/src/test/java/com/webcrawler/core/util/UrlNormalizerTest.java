package com.webcrawler.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlNormalizerTest {

    @Test
    @DisplayName("스킴 없음 → https, http → https, 루트 / 제거")
    void coercesSchemeAndRoot() {
        assertThat(UrlNormalizer.normalize("example.com")).isEqualTo("https://example.com");
        assertThat(UrlNormalizer.normalize("http://example.com/")).isEqualTo("https://example.com");
        assertThat(UrlNormalizer.normalize("  https://example.com/a/b  ")).isEqualTo("https://example.com/a/b");
    }

    @Test
    void dropsQueryAndFragment() {
        assertThat(UrlNormalizer.normalize("https://example.com/p?x=1&y=2#frag")).isEqualTo("https://example.com/p");
        assertThat(UrlNormalizer.normalize("example.com/?q=1")).isEqualTo("https://example.com");
    }

    @Test
    void keepsPortAndTrailingSlashOnDeeperPaths() {
        assertThat(UrlNormalizer.normalize("http://localhost:8080/docs/")).isEqualTo("https://localhost:8080/docs/");
    }

    @Test
    void isDeterministic() {
        String raw = " HTTP://Example.com/x?y#z ";
        assertThat(UrlNormalizer.normalize(raw)).isEqualTo(UrlNormalizer.normalize(raw));
    }

    @Test
    @DisplayName("빈 입력 / http(s) 이외 스킴 → InvalidUrlException")
    void rejectsEmptyAndForeignSchemes() {
        assertThatThrownBy(() -> UrlNormalizer.normalize("   ")).isInstanceOf(InvalidUrlException.class);
        assertThatThrownBy(() -> UrlNormalizer.normalize(null)).isInstanceOf(InvalidUrlException.class);
        assertThatThrownBy(() -> UrlNormalizer.normalize("ftp://example.com/file"))
                .isInstanceOf(InvalidUrlException.class)
                .satisfies(e -> assertThat(((InvalidUrlException) e).getRawUrl()).isEqualTo("ftp://example.com/file"));
        assertThatThrownBy(() -> UrlNormalizer.normalize("https://exa mple.com")).isInstanceOf(InvalidUrlException.class);
    }

    @Test
    void normalizeOrNull_and_hostOf() {
        assertThat(UrlNormalizer.normalizeOrNull("ftp://x")).isNull();
        assertThat(UrlNormalizer.hostOf("https://blog.example.com/p")).isEqualTo("blog.example.com");
        assertThat(UrlNormalizer.hostOf((String) null)).isNull();
    }

    @Test
    @DisplayName("밑줄 host: raw authority에서 userinfo/port를 떼어 host 추출")
    void hostOf_registryAuthority() {
        assertThat(UrlNormalizer.normalize("my_site.example.com/p")).isEqualTo("https://my_site.example.com/p");
        URI u = URI.create("https://user@my_site.example.com:8443/p");
        assertThat(u.getHost()).isNull();
        assertThat(UrlNormalizer.hostOf(u)).isEqualTo("my_site.example.com");
        assertThat(UrlNormalizer.hostPortOf(u)).isEqualTo("my_site.example.com:8443");
        assertThat(UrlNormalizer.hostPortOf(URI.create("https://example.com:8080/"))).isEqualTo("example.com:8080");
        assertThat(UrlNormalizer.hostOf("https://my_site.example.com")).isEqualTo("my_site.example.com");
    }
}
