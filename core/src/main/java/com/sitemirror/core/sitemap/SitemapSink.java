package com.sitemirror.core.sitemap;

import com.sitemirror.core.model.SitemapNode;

import java.io.IOException;

/** 파싱에 성공한 사이트맵 문서를 원본 바이트와 함께 받는 콜백 */
@FunctionalInterface
public interface SitemapSink {
    void accept(SitemapNode node, byte[] raw) throws IOException;

    SitemapSink NONE = (node, raw) -> {};
}
