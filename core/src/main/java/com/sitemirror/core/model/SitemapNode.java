package com.sitemirror.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 파싱된 사이트맵 문서 하나.
 * kind가 INDEX면 sitemaps, URLSET이면 pages가 채워진다(문서 순서 유지).
 */
public record SitemapNode(String url, SitemapKind kind, List<String> sitemaps, List<PageRef> pages) {
    public SitemapNode {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(kind, "kind");
        sitemaps = (sitemaps == null ? List.of() : List.copyOf(sitemaps));
        pages = (pages == null ? List.of() : List.copyOf(pages));
    }

    public static SitemapNode index(String url, List<String> children) {
        return new SitemapNode(url, SitemapKind.INDEX, children, List.of());
    }

    public static SitemapNode urlset(String url, List<PageRef> pages) {
        return new SitemapNode(url, SitemapKind.URLSET, List.of(), pages);
    }

    public int entryCount() {
        return kind == SitemapKind.INDEX ? sitemaps.size() : pages.size();
    }
}
