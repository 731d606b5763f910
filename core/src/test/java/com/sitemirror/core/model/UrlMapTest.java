package com.sitemirror.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlMapTest {

    @Test
    void lookup_normalizesInput() {
        UrlMap map = new UrlMap();
        assertThat(map.put("https://Example.com/about/", "pages/about.html")).isTrue();

        assertThat(map.get("https://example.com/about")).isEqualTo("pages/about.html");
        assertThat(map.get("https://example.com:443/about#team")).isEqualTo("pages/about.html");
        assertThat(map.get("https://example.com/contact")).isNull();
        assertThat(map.get("/about")).isNull();
    }

    @Test
    void appendOnly() {
        UrlMap map = new UrlMap();
        map.put("https://example.com/a", "pages/a.html");

        assertThat(map.put("https://example.com/a", "pages/a.html")).isFalse();
        assertThatThrownBy(() -> map.put("https://example.com/a", "pages/other.html"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(map.size()).isEqualTo(1);
    }

    @Test
    void twoUrls_mayShareOnePath() {
        UrlMap map = new UrlMap();
        map.put("https://example.com/old", "pages/new.html");
        map.put("https://example.com/new", "pages/new.html");

        assertThat(map.isLocalPath("pages/new.html")).isTrue();
        assertThat(map.isLocalPath("pages/old.html")).isFalse();
        assertThat(map.snapshot()).hasSize(2);
    }
}
