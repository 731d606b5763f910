package com.sitemirror.core.sitemap;

import com.sitemirror.core.model.PageRef;
import com.sitemirror.core.model.SitemapNode;

import java.util.List;

/**
 * 확장 결과.
 * @param pages    모든 urlset의 말단 PageRef (정규화 URL 기준 중복 제거, 첫 등장 순)
 * @param nodes    파싱에 성공한 사이트맵 문서 (fetch 순)
 * @param failures 소프트 실패 (url, reason)
 */
public record SitemapExpansion(List<PageRef> pages, List<SitemapNode> nodes, List<Failure> failures) {

    public SitemapExpansion {
        pages = List.copyOf(pages);
        nodes = List.copyOf(nodes);
        failures = List.copyOf(failures);
    }

    public static SitemapExpansion empty() {
        return new SitemapExpansion(List.of(), List.of(), List.of());
    }

    public record Failure(String url, String reason) {}
}
