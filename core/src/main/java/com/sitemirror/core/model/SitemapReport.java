package com.sitemirror.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** sitemaps 모드 결과 (sitemap_report.json) */
@JsonPropertyOrder({"sitemapCount", "sitemaps", "urls"})
public record SitemapReport(int sitemapCount, List<Entry> sitemaps, List<String> urls) {

    public SitemapReport {
        sitemaps = (sitemaps == null ? List.of() : List.copyOf(sitemaps));
        urls = (urls == null ? List.of() : List.copyOf(urls));
    }

    @JsonPropertyOrder({"url", "kind", "entryCount"})
    public record Entry(String url, SitemapKind kind, int entryCount) {
        public static Entry of(SitemapNode node) {
            return new Entry(node.url(), node.kind(), node.entryCount());
        }
    }
}
