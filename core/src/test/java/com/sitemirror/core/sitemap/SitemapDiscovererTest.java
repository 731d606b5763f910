package com.sitemirror.core.sitemap;

import com.sitemirror.core.model.FetchResult;
import com.sitemirror.core.support.StubFetcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SitemapDiscovererTest {

    private static final String ROOT = "https://example.com";

    @Test
    @DisplayName("robots.txt에 Sitemap이 있으면 관례 경로는 프로브하지 않음")
    void robots_winsAndSkipsProbing() {
        StubFetcher f = new StubFetcher()
                .respond(ROOT + "/robots.txt", 200, "text/plain",
                        "User-agent: *\nSitemap: https://example.com/wp-sitemap.xml\n");

        List<String> found = new SitemapDiscoverer(f).discover(ROOT + "/some/deep/page");

        assertThat(found).containsExactly(ROOT + "/wp-sitemap.xml");
        assertThat(f.calls()).containsExactly(ROOT + "/robots.txt");
    }

    @Test
    @DisplayName("robots 없음 → 관례 경로 중 XML 응답만 채택")
    void commonPaths_acceptOnlyXmlResponses() {
        StubFetcher f = new StubFetcher()
                .xml(ROOT + "/sitemap.xml", SitemapXml.urlset(ROOT + "/a"))
                .respond(ROOT + "/sitemap_index.xml", 200, "text/html", "<html><body>soft 404</body></html>")
                .respond(ROOT + "/sitemap1.xml", 200, "text/plain", "<?xml version=\"1.0\"?><urlset/>");

        List<String> found = new SitemapDiscoverer(f).discover(ROOT);

        assertThat(found).containsExactly(ROOT + "/sitemap.xml", ROOT + "/sitemap1.xml");
        assertThat(f.calls()).contains(ROOT + "/sitemap_1.xml");
    }

    @Test
    void homepageLinks_areUsedAsLastResort() {
        StubFetcher f = new StubFetcher()
                .html(ROOT, """
                        <html><head><link rel="sitemap" type="application/xml" href="/map.xml"></head>
                        <body><a href="/about">About</a><a href="/site-sitemap.xml">Sitemap</a>
                        <a href="mailto:sitemap@example.com">mail</a></body></html>
                        """);

        List<String> found = new SitemapDiscoverer(f).discover(ROOT);

        assertThat(found).containsExactly(ROOT + "/map.xml", ROOT + "/site-sitemap.xml");
    }

    @Test
    void htmlSitemapPage_xmlLinksOnly() {
        StubFetcher f = new StubFetcher()
                .html(ROOT, "<html><body><a href=\"/about\">About</a></body></html>")
                .html(ROOT + "/sitemap", """
                        <html><body>
                        <a href="/post-sitemap.xml">Posts</a>
                        <a href="/sitemap-overview">Overview</a>
                        <a href="/page-sitemap.xml#x">Pages</a>
                        </body></html>
                        """);

        List<String> found = new SitemapDiscoverer(f).discover(ROOT);

        assertThat(found).containsExactly(ROOT + "/post-sitemap.xml", ROOT + "/page-sitemap.xml");
    }

    @Test
    void nothingFound_returnsEmpty() {
        assertThat(new SitemapDiscoverer(new StubFetcher()).discover(ROOT)).isEmpty();
        assertThat(new SitemapDiscoverer(new StubFetcher()).discover("not a url")).isEmpty();
    }

    @Test
    void looksLikeXml_sniffsBodyWithBom() {
        byte[] body = "\uFEFF  <sitemapindex>".getBytes(StandardCharsets.UTF_8);
        assertThat(SitemapDiscoverer.looksLikeXml(FetchResult.ok(ROOT, ROOT, 200, "text/plain", body))).isTrue();
        assertThat(SitemapDiscoverer.looksLikeXml(FetchResult.ok(ROOT, ROOT, 200, null, "<html>".getBytes(StandardCharsets.UTF_8)))).isFalse();
        assertThat(SitemapDiscoverer.looksLikeXml(FetchResult.ok(ROOT, ROOT, 200, "text/xml; charset=utf-8", new byte[0]))).isTrue();
    }
}
