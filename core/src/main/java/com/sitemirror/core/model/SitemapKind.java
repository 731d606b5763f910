package com.sitemirror.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** INDEX: 자식이 사이트맵 URL, URLSET: 자식이 페이지 URL */
public enum SitemapKind {
    INDEX,
    URLSET;

    @JsonValue
    public String wire() { return name().toLowerCase(Locale.ROOT); }
}
