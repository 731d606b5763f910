package com.sitemirror.core.sitemap;

import com.sitemirror.core.model.FetchResult;
import com.sitemirror.core.model.PageRef;
import com.sitemirror.core.model.SitemapKind;
import com.sitemirror.core.model.SitemapNode;
import com.sitemirror.core.support.RecordingSleeper;
import com.sitemirror.core.support.StubFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapExpanderTest {

    private static final String ROOT = "https://example.com";

    @Test
    @DisplayName("인덱스 → urlset 말단 URL 수집, 404 자식은 소프트 실패")
    void index_expandsToLeafPages_andSoftFailsMissingChild() {
        StubFetcher f = new StubFetcher()
                .xml(ROOT + "/sitemap_index.xml", SitemapXml.index(ROOT + "/posts.xml", ROOT + "/gone.xml"))
                .xml(ROOT + "/posts.xml", SitemapXml.urlset(ROOT + "/a", ROOT + "/b"));

        SitemapExpansion ex = new SitemapExpander(f)
                .expandDetailed(ROOT + "/sitemap_index.xml", new HashSet<>(), SitemapSink.NONE, () -> false);

        assertThat(ex.pages()).extracting(PageRef::url).containsExactlyInAnyOrder(ROOT + "/a", ROOT + "/b");
        assertThat(ex.nodes()).extracting(SitemapNode::kind).containsExactly(SitemapKind.INDEX, SitemapKind.URLSET);
        assertThat(ex.failures()).hasSize(1);
        assertThat(ex.failures().get(0).url()).isEqualTo(ROOT + "/gone.xml");
        assertThat(ex.failures().get(0).reason()).isEqualTo("HTTP 404");
    }

    @Test
    @DisplayName("순환 인덱스(A↔B)에서도 각 사이트맵은 한 번만 fetch")
    void cycle_eachSitemapFetchedOnce() {
        StubFetcher f = new StubFetcher()
                .xml(ROOT + "/a.xml", SitemapXml.index(ROOT + "/b.xml"))
                .xml(ROOT + "/b.xml", SitemapXml.index(ROOT + "/a.xml", ROOT + "/pages.xml"))
                .xml(ROOT + "/pages.xml", SitemapXml.urlset(ROOT + "/p1"));

        Set<PageRef> pages = new SitemapExpander(f).expand(ROOT + "/a.xml", new HashSet<>());

        assertThat(pages).extracting(PageRef::url).containsExactly(ROOT + "/p1");
        assertThat(f.callsTo(ROOT + "/a.xml")).isEqualTo(1);
        assertThat(f.callsTo(ROOT + "/b.xml")).isEqualTo(1);
        assertThat(f.callsTo(ROOT + "/pages.xml")).isEqualTo(1);
    }

    @Test
    void leafUrls_areNormalizedAndDeduplicated_acrossUrlsets() {
        StubFetcher f = new StubFetcher()
                .xml(ROOT + "/index.xml", SitemapXml.index(ROOT + "/one.xml", ROOT + "/two.xml"))
                .xml(ROOT + "/one.xml", SitemapXml.urlset(ROOT + "/shared/", ROOT + "/only-one"))
                .xml(ROOT + "/two.xml", SitemapXml.urlset("https://EXAMPLE.com/shared", ROOT + "/only-two"));

        Set<PageRef> pages = new SitemapExpander(f).expand(ROOT + "/index.xml", new HashSet<>());

        assertThat(pages).extracting(PageRef::url)
                .containsExactlyInAnyOrder(ROOT + "/shared", ROOT + "/only-one", ROOT + "/only-two");
    }

    @Test
    void lastmod_isCarriedWhenPresent() {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                  <url><loc>https://example.com/dated</loc><lastmod>2024-01-15</lastmod></url>
                  <url><loc>https://example.com/undated</loc></url>
                </urlset>
                """;
        StubFetcher f = new StubFetcher().xml(ROOT + "/sitemap.xml", xml);

        Map<String, PageRef> byUrl = new HashMap<>();
        for (PageRef p : new SitemapExpander(f).expand(ROOT + "/sitemap.xml", new HashSet<>())) byUrl.put(p.url(), p);

        assertThat(byUrl).hasSize(2);
        assertThat(byUrl.get(ROOT + "/dated").lastModified()).isNotNull();
        assertThat(byUrl.get(ROOT + "/undated").lastModified()).isNull();
    }

    @Test
    @DisplayName("공유 visited: 이미 펼친 사이트맵은 다시 fetch하지 않음")
    void sharedVisited_skipsAlreadyExpandedRoot() {
        StubFetcher f = new StubFetcher().xml(ROOT + "/sitemap.xml", SitemapXml.urlset(ROOT + "/x"));
        SitemapExpander expander = new SitemapExpander(f);
        Set<String> visited = new HashSet<>();

        assertThat(expander.expand(ROOT + "/sitemap.xml", visited)).hasSize(1);
        assertThat(expander.expand(ROOT + "/sitemap.xml/", visited)).isEmpty();
        assertThat(f.callsTo(ROOT + "/sitemap.xml")).isEqualTo(1);
    }

    @Test
    void transportError_isSoftFailure() {
        StubFetcher f = new StubFetcher()
                .result(ROOT + "/sitemap.xml", FetchResult.transportError(ROOT + "/sitemap.xml", "timeout after 30000ms"));

        SitemapExpansion ex = new SitemapExpander(f)
                .expandDetailed(ROOT + "/sitemap.xml", new HashSet<>(), SitemapSink.NONE, () -> false);

        assertThat(ex.pages()).isEmpty();
        assertThat(ex.failures()).extracting(SitemapExpansion.Failure::reason).containsExactly("timeout after 30000ms");
    }

    @Test
    @DisplayName("대기는 요청 사이에만, 사이트맵마다 원본 바이트를 sink로 전달")
    void delayBetweenRequests_andRawBytesToSink() {
        StubFetcher f = new StubFetcher()
                .xml(ROOT + "/index.xml", SitemapXml.index(ROOT + "/one.xml", ROOT + "/two.xml"))
                .xml(ROOT + "/one.xml", SitemapXml.urlset(ROOT + "/1"))
                .xml(ROOT + "/two.xml", SitemapXml.urlset(ROOT + "/2"));
        RecordingSleeper sleeper = new RecordingSleeper();
        List<String> sunk = new ArrayList<>();

        new SitemapExpander(f, sleeper, Duration.ofMillis(1000))
                .expandDetailed(ROOT + "/index.xml", new HashSet<>(), (node, raw) -> {
                    assertThat(raw).isNotEmpty();
                    sunk.add(node.url());
                }, () -> false);

        assertThat(sleeper.sleeps()).hasSize(2).containsOnly(Duration.ofMillis(1000));
        assertThat(sunk).hasSize(3).startsWith(ROOT + "/index.xml")
                .containsExactlyInAnyOrder(ROOT + "/index.xml", ROOT + "/one.xml", ROOT + "/two.xml");
    }

    @Test
    void cancellation_stopsBeforeNextFetch() {
        StubFetcher f = new StubFetcher()
                .xml(ROOT + "/index.xml", SitemapXml.index(ROOT + "/one.xml", ROOT + "/two.xml"))
                .xml(ROOT + "/one.xml", SitemapXml.urlset(ROOT + "/1"))
                .xml(ROOT + "/two.xml", SitemapXml.urlset(ROOT + "/2"));
        AtomicInteger checks = new AtomicInteger();

        SitemapExpansion ex = new SitemapExpander(f)
                .expandDetailed(ROOT + "/index.xml", new HashSet<>(), SitemapSink.NONE,
                        () -> checks.incrementAndGet() > 2);

        assertThat(f.calls()).hasSize(2).startsWith(ROOT + "/index.xml");
        assertThat(ex.pages()).hasSize(1);
    }
}
