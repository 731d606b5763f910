package com.sitemirror.core.model;

import java.time.Instant;
import java.util.Objects;

/** 다운로드 전 후보 페이지. lastModified는 사이트맵 lastmod(없으면 null). */
public record PageRef(String url, Instant lastModified) {
    public PageRef {
        Objects.requireNonNull(url, "url");
    }

    public static PageRef of(String url) { return new PageRef(url, null); }
}
