package com.sitemirror.core.service;

import com.sitemirror.core.api.Fetcher;
import com.sitemirror.core.api.PageStore;
import com.sitemirror.core.crawler.Crawler;
import com.sitemirror.core.crawler.LocalPathAllocator;
import com.sitemirror.core.http.HttpFetcher;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.PageRecord;
import com.sitemirror.core.model.PageRef;
import com.sitemirror.core.model.Report;
import com.sitemirror.core.model.ScrapeOutcome;
import com.sitemirror.core.model.ScrapeSession;
import com.sitemirror.core.model.SessionState;
import com.sitemirror.core.model.SitemapNode;
import com.sitemirror.core.model.SitemapReport;
import com.sitemirror.core.service.export.ExportCoordinator;
import com.sitemirror.core.service.export.SitemapReportExporter;
import com.sitemirror.core.sitemap.SitemapDiscoverer;
import com.sitemirror.core.sitemap.SitemapExpander;
import com.sitemirror.core.sitemap.SitemapExpansion;
import com.sitemirror.core.sitemap.SitemapSink;
import com.sitemirror.core.store.FileSystemPageStore;
import com.sitemirror.core.util.DefaultSleeper;
import com.sitemirror.core.util.LogSink;
import com.sitemirror.core.util.ProgressListener;
import com.sitemirror.core.util.Sleeper;
import com.sitemirror.core.util.StructuredLog;
import com.sitemirror.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 스크레이프 오케스트레이터:
 *  - SITE    : discover → expand(공유 visited) → 같은 도메인 페이지로 큐 시드 → Crawler → index.html/report.json
 *  - SITEMAPS: discover → expand(원본 XML 저장) → sitemap_report.json
 *  - 기본 생성자는 HttpFetcher + 파일 저장소, DI 생성자는 테스트/임베딩용
 */
public final class ScrapeService {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeService.class);

    private final MirrorConfig config;
    private final Fetcher fetcher;
    private final PageStore pageStore;
    private final PageStore sitemapStore;
    private final Sleeper sleeper;
    private final SitemapDiscoverer discoverer;
    private final SitemapExpander expander;
    private final ExportCoordinator exports = new ExportCoordinator();
    private ProgressListener progress = ProgressListener.NONE;

    /** 기본 구현 */
    public ScrapeService(MirrorConfig config) {
        this(config,
                new HttpFetcher(config),
                new FileSystemPageStore(config.getOutputDir()),
                new FileSystemPageStore(config.getSitemapDir()),
                new DefaultSleeper());
    }

    /** DI/테스트용 */
    public ScrapeService(MirrorConfig config, Fetcher fetcher, PageStore pageStore,
                         PageStore sitemapStore, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.pageStore = Objects.requireNonNull(pageStore, "pageStore");
        this.sitemapStore = Objects.requireNonNull(sitemapStore, "sitemapStore");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.discoverer = new SitemapDiscoverer(fetcher);
        this.expander = new SitemapExpander(fetcher, sleeper, config.getSitemapDelay());
    }

    public ScrapeService withProgress(ProgressListener listener) {
        this.progress = ProgressListener.guarded(listener);
        return this;
    }

    public MirrorConfig getConfig() { return config; }

    /* =========================
       실행 API
       ========================= */

    /** 설정 모드에 따라 실행. 예상 밖 오류는 세션을 FAILED로 만들고 그대로 던진다. */
    public ScrapeOutcome execute(ScrapeSession session) throws IOException {
        Objects.requireNonNull(session, "session");
        try {
            return switch (config.getMode()) {
                case SITE -> {
                    Report r = run(session);
                    yield ScrapeOutcome.site(session.state(), r);
                }
                case SITEMAPS -> {
                    SitemapReport r = runSitemaps(session);
                    yield ScrapeOutcome.sitemaps(session.state(), r);
                }
            };
        } catch (IOException | RuntimeException e) {
            session.fail();
            LOG.error("Scrape failed: seed={}", session.getSeedUrl(), e);
            slog(session).error("scrape-failed", e, "seed", session.getSeedUrl());
            session.log().log("Error: " + e.getMessage());
            throw e;
        }
    }

    /** SITE 모드: 페이지 미러링 */
    public Report run(ScrapeSession session) throws IOException {
        begin(session);
        final LogSink log = session.log();
        LOG.info("Scrape start: seed={}, maxPages={}, useSitemaps={}, followLinks={}",
                session.getSeedUrl(), session.getMaxPages(), config.isUseSitemaps(), config.isFollowLinks());
        slog(session).info("scrape-start",
                "seed", session.getSeedUrl(),
                "mode", "SITE",
                "maxPages", session.getMaxPages());

        // ---- 0) 사이트맵으로 큐 시드 ----
        List<String> seeds = config.isUseSitemaps() ? collectSitemapPages(session) : List.of();
        if (seeds.isEmpty()) {
            log.log("No sitemap pages found, following links from " + session.getSeedUrl());
            session.enqueue(session.getSeedUrl());
        } else {
            log.log("Found " + seeds.size() + " page URL(s) in sitemaps");
            for (String s : seeds) session.enqueue(s);
        }

        // ---- 1) 크롤 + 링크 재작성 ----
        Report report = new Crawler(config, fetcher, pageStore, sleeper)
                .withProgress(progress)
                .run(session);

        // ---- 2) 산출물 ----
        progress.onProgress(1.0, "export", report.totalDownloaded(), report.pages().size());
        exports.exportSite(report, session.getSeedUrl(), pageStore);
        log.log("Index and report written");

        LOG.info("Scrape done. state={}, discovered={}, downloaded={}, failed={}",
                session.state(), report.totalDiscovered(), report.totalDownloaded(), report.totalFailed());
        slog(session).info("scrape-done",
                "state", session.state().name(),
                "discovered", report.totalDiscovered(),
                "downloaded", report.totalDownloaded(),
                "failed", report.totalFailed());
        return report;
    }

    /** SITEMAPS 모드: 사이트맵 XML만 원본 그대로 수집 */
    public SitemapReport runSitemaps(ScrapeSession session) throws IOException {
        begin(session);
        final LogSink log = session.log();
        slog(session).info("scrape-start", "seed", session.getSeedUrl(), "mode", "SITEMAPS");

        progress.onProgress(0.0, "discover", 0, -1);
        List<String> candidates = discoverer.discover(session.getSeedUrl());
        if (candidates.isEmpty()) log.log("No sitemaps found for " + session.getSeedUrl());

        LocalPathAllocator names = LocalPathAllocator.forSitemaps();
        SitemapSink sink = (node, raw) -> {
            String key = names.allocate(node.url());
            sitemapStore.put(key, raw);
            session.addRecord(PageRecord.success(node.url(), key, node.kind().wire()));
            log.log("Saved sitemap: " + node.url() + " (" + node.kind().wire() + ", " + node.entryCount() + " entries)");
        };

        List<SitemapNode> nodes = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String c : candidates) {
            if (session.isCancelled()) break;
            SitemapExpansion ex = expander.expandDetailed(c, visited, sink, session::isCancelled);
            nodes.addAll(ex.nodes());
            for (SitemapExpansion.Failure f : ex.failures()) {
                session.addRecord(PageRecord.failed(f.url(), f.reason()));
                log.log("Sitemap skipped: " + f.url() + " - " + f.reason());
            }
        }

        session.transition(session.isCancelled() ? SessionState.CANCELLED : SessionState.COMPLETED);

        SitemapReport report = SitemapReportExporter.toReport(nodes);
        progress.onProgress(1.0, "export", nodes.size(), nodes.size());
        exports.exportSitemaps(report, sitemapStore);
        log.log("Sitemap report written: " + report.sitemapCount() + " sitemap(s), "
                + report.urls().size() + " URL(s)");

        slog(session).info("scrape-done",
                "state", session.state().name(),
                "sitemaps", report.sitemapCount(),
                "urls", report.urls().size());
        return report;
    }

    /* =========================
       내부 헬퍼
       ========================= */

    private static StructuredLog slog(ScrapeSession session) {
        return SLOG.with("session", session.getId());
    }

    private static void begin(ScrapeSession session) {
        if (session.state() == SessionState.PENDING) session.transition(SessionState.RUNNING);
    }

    /** 모든 후보 사이트맵을 하나의 visited로 펼쳐서 같은 도메인 페이지 URL만 모은다 */
    private List<String> collectSitemapPages(ScrapeSession session) {
        final LogSink log = session.log();
        progress.onProgress(0.0, "discover", 0, -1);

        List<String> candidates = discoverer.discover(session.getSeedUrl());
        log.log("Found " + candidates.size() + " sitemap candidate(s)");

        Set<String> visited = new HashSet<>();
        Set<String> pages = new LinkedHashSet<>();
        int done = 0;
        for (String c : candidates) {
            if (session.isCancelled()) break;
            SitemapExpansion ex = expander.expandDetailed(c, visited, SitemapSink.NONE, session::isCancelled);
            for (PageRef p : ex.pages()) {
                if (UrlUtils.sameDomain(session.getSeedUrl(), p.url())) pages.add(p.url());
            }
            for (SitemapExpansion.Failure f : ex.failures()) {
                log.log("Sitemap skipped: " + f.url() + " - " + f.reason());
            }
            done++;
            progress.onProgress((double) done / candidates.size(), "discover", done, candidates.size());
        }
        return new ArrayList<>(pages);
    }
}
