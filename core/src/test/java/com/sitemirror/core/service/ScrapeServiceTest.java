package com.sitemirror.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.Mode;
import com.sitemirror.core.model.Report;
import com.sitemirror.core.model.ScrapeOutcome;
import com.sitemirror.core.model.ScrapeSession;
import com.sitemirror.core.model.SessionState;
import com.sitemirror.core.model.SitemapReport;
import com.sitemirror.core.store.InMemoryPageStore;
import com.sitemirror.core.support.RecordingSleeper;
import com.sitemirror.core.support.StubFetcher;
import com.sitemirror.core.util.BufferedLogSink;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ScrapeServiceTest {

    static HttpServer server;
    static String base;

    @BeforeAll
    static void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ScrapeServiceTest::route);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterAll
    static void stop() {
        server.stop(0);
    }

    // robots → sitemap.xml(urlset: /, /about, /gone) / "/" ↔ "/about" / "/gone" 404
    private static void route(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        switch (path) {
            case "/robots.txt" -> respond(ex, 200, "text/plain", "User-agent: *\nSitemap: " + base + "/sitemap.xml\n");
            case "/sitemap.xml" -> respond(ex, 200, "application/xml", """
                    <?xml version="1.0" encoding="UTF-8"?>
                    <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                      <url><loc>%1$s/</loc></url>
                      <url><loc>%1$s/about</loc></url>
                      <url><loc>%1$s/gone</loc></url>
                    </urlset>
                    """.formatted(base));
            case "/" -> respond(ex, 200, "text/html; charset=UTF-8",
                    "<html><head><title>Home</title></head><body><a href=\"/about\">About</a></body></html>");
            case "/about" -> respond(ex, 200, "text/html; charset=UTF-8",
                    "<html><head><title>About</title></head><body><a href=\"/\">Home</a></body></html>");
            default -> respond(ex, 404, "text/plain", "not found");
        }
    }

    private static void respond(HttpExchange ex, int code, String ct, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", ct);
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }

    private static MirrorConfig config(Path out, Path maps) {
        return MirrorConfig.defaults()
                .setTarget(base)
                .setDelayMs(0)
                .setSitemapDelayMs(0)
                .setTimeoutMs(5_000)
                .setOutputDir(out)
                .setSitemapDir(maps);
    }

    @Test
    @DisplayName("E2E: robots → sitemap 3개(200/200/404) → 다운로드 2, 실패 1, 인덱스 2항목")
    void siteMode_endToEnd(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("offline_output");
        MirrorConfig cfg = config(out, dir.resolve("sitemap_output"));
        BufferedLogSink logs = new BufferedLogSink();
        ScrapeSession session = ScrapeSession.of(cfg, logs);

        ScrapeOutcome outcome = new ScrapeService(cfg).execute(session);

        Report r = outcome.report();
        assertThat(outcome.mode()).isEqualTo(Mode.SITE);
        assertThat(outcome.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(r.totalDownloaded()).isEqualTo(2);
        assertThat(r.totalFailed()).isEqualTo(1);
        assertThat(r.failedUrls()).singleElement()
                .satisfies(f -> assertThat(f.url()).isEqualTo(base + "/gone"));

        Document index = Jsoup.parse(out.resolve("index.html").toFile(), "UTF-8");
        assertThat(index.select(".page-item")).hasSize(2);
        assertThat(Files.exists(out.resolve("pages/index.html"))).isTrue();
        assertThat(Files.readString(out.resolve("pages/about.html"))).contains("href=\"pages/index.html\"");

        JsonNode json = new ObjectMapper().readTree(out.resolve("report.json").toFile());
        assertThat(json.get("totalDownloaded").asInt()).isEqualTo(2);
        assertThat(json.get("totalFailed").asInt()).isEqualTo(1);

        assertThat(logs.lines()).anyMatch(l -> l.contains("Downloaded: About"));
        assertThat(logs.lines()).anyMatch(l -> l.contains("Failed: " + base + "/gone - HTTP 404"));
    }

    @Test
    @DisplayName("SITEMAPS 모드: 원본 XML 저장 + sitemap_report.json")
    void sitemapsMode_endToEnd(@TempDir Path dir) throws IOException {
        Path maps = dir.resolve("sitemap_output");
        MirrorConfig cfg = config(dir.resolve("offline_output"), maps).setMode(Mode.SITEMAPS);

        ScrapeOutcome outcome = new ScrapeService(cfg).execute(ScrapeSession.of(cfg, null));

        SitemapReport r = outcome.sitemapReport();
        assertThat(outcome.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(r.sitemapCount()).isEqualTo(1);
        assertThat(r.urls()).containsExactlyInAnyOrder(base, base + "/about", base + "/gone");
        assertThat(Files.readString(maps.resolve("sitemaps/sitemap.xml"))).contains("<urlset");
        assertThat(Files.exists(maps.resolve("sitemap_report.json"))).isTrue();
        assertThat(Files.exists(dir.resolve("offline_output"))).isFalse();
    }

    @Test
    @DisplayName("사이트맵이 없으면 시드 URL에서 링크 추종")
    void noSitemaps_fallsBackToLinkFollowing() throws IOException {
        StubFetcher site = new StubFetcher()
                .html("https://example.com", "<html><title>Home</title><a href=\"/a\">a</a></html>")
                .html("https://example.com/a", "<html><title>A</title></html>");
        MirrorConfig cfg = MirrorConfig.defaults().setTarget("https://example.com").setDelayMs(0);
        InMemoryPageStore pages = new InMemoryPageStore();

        ScrapeOutcome outcome = new ScrapeService(cfg, site, pages, new InMemoryPageStore(), new RecordingSleeper())
                .execute(ScrapeSession.of(cfg, null));

        assertThat(outcome.report().totalDownloaded()).isEqualTo(2);
        assertThat(site.calls()).contains("https://example.com/robots.txt", "https://example.com/sitemap.xml");
        assertThat(pages.keys()).contains("index.html", "report.json", "pages/index.html", "pages/a.html");
    }

    @Test
    @DisplayName("사이트맵 페이지 중 다른 도메인 URL은 큐에 넣지 않음")
    void sitemapPages_fromOtherDomains_areIgnored() throws IOException {
        StubFetcher site = new StubFetcher()
                .respond("https://example.com/robots.txt", 200, "text/plain", "Sitemap: https://example.com/s.xml")
                .xml("https://example.com/s.xml", """
                        <?xml version="1.0" encoding="UTF-8"?>
                        <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                          <url><loc>https://example.com/in</loc></url>
                          <url><loc>https://cdn.other.org/out</loc></url>
                        </urlset>
                        """)
                .html("https://example.com/in", "<html><title>In</title></html>");
        MirrorConfig cfg = MirrorConfig.defaults().setTarget("https://example.com").setDelayMs(0).setSitemapDelayMs(0);

        ScrapeOutcome outcome = new ScrapeService(cfg, site, new InMemoryPageStore(), new InMemoryPageStore(),
                new RecordingSleeper()).execute(ScrapeSession.of(cfg, null));

        assertThat(outcome.report().pages()).extracting(p -> p.url()).containsExactly("https://example.com/in");
        assertThat(site.calls()).noneMatch(u -> u.contains("other.org"));
    }

    @Test
    @DisplayName("진행 리스너가 예외를 던져도 발견/크롤/내보내기는 끝까지 진행")
    void failingProgressListener_doesNotStopScrape() throws IOException {
        StubFetcher site = new StubFetcher()
                .respond("https://example.com/robots.txt", 200, "text/plain", "Sitemap: https://example.com/s.xml")
                .xml("https://example.com/s.xml", """
                        <?xml version="1.0" encoding="UTF-8"?>
                        <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
                          <url><loc>https://example.com/in</loc></url>
                        </urlset>
                        """)
                .html("https://example.com/in", "<html><title>In</title></html>");
        MirrorConfig cfg = MirrorConfig.defaults().setTarget("https://example.com").setDelayMs(0).setSitemapDelayMs(0);
        InMemoryPageStore pages = new InMemoryPageStore();
        ScrapeSession session = ScrapeSession.of(cfg, null);

        ScrapeOutcome outcome = new ScrapeService(cfg, site, pages, new InMemoryPageStore(), new RecordingSleeper())
                .withProgress((p, phase, done, total) -> { throw new IllegalStateException("listener down: " + phase); })
                .execute(session);

        assertThat(session.state()).isEqualTo(SessionState.COMPLETED);
        assertThat(outcome.report().totalDownloaded()).isEqualTo(1);
        assertThat(pages.keys()).contains("index.html", "report.json", "pages/in.html");
    }
}
