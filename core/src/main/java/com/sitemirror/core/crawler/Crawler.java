package com.sitemirror.core.crawler;

import com.sitemirror.core.api.Fetcher;
import com.sitemirror.core.api.PageStore;
import com.sitemirror.core.model.FetchResult;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.PageRecord;
import com.sitemirror.core.model.Report;
import com.sitemirror.core.model.ScrapeSession;
import com.sitemirror.core.model.SessionState;
import com.sitemirror.core.service.export.ReportWriter;
import com.sitemirror.core.util.DefaultSleeper;
import com.sitemirror.core.util.LogSink;
import com.sitemirror.core.util.ProgressListener;
import com.sitemirror.core.util.Sleeper;
import com.sitemirror.core.util.StructuredLog;
import com.sitemirror.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 순차 BFS 크롤러.
 * - 큐가 비거나, 취소되거나, 레코드 수가 maxPages에 닿으면 종료 (상한은 dequeue 전에 확인)
 * - 요청 사이에만 politeness delay (마지막 요청 뒤에는 없음)
 * - fetch 실패/비 2xx는 failed 레코드로 남기고 계속
 * - 루프 종료 후 최종 UrlMap으로 성공 페이지 전체의 링크를 재작성
 */
public class Crawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final Fetcher fetcher;
    private final PageStore store;
    private final Sleeper sleeper;
    private final Duration delay;
    private final boolean followLinks;
    private final LinkRewriter rewriter;
    private final LocalPathAllocator paths = LocalPathAllocator.forPages();
    private ProgressListener progress = ProgressListener.NONE;

    public Crawler(MirrorConfig config, Fetcher fetcher, PageStore store) {
        this(config, fetcher, store, new DefaultSleeper());
    }

    public Crawler(MirrorConfig config, Fetcher fetcher, PageStore store, Sleeper sleeper) {
        Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.store = Objects.requireNonNull(store, "store");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.delay = (config.getDelay() == null ? Duration.ZERO : config.getDelay());
        this.followLinks = config.isFollowLinks();
        this.rewriter = new LinkRewriter();
    }

    public Crawler withProgress(ProgressListener listener) {
        this.progress = ProgressListener.guarded(listener);
        return this;
    }

    /** 세션 큐를 소진할 때까지 크롤하고 Report를 돌려준다. 큐가 비어 있으면 시드 URL로 시작. */
    public Report run(ScrapeSession session) {
        Objects.requireNonNull(session, "session");
        if (session.state() == SessionState.PENDING) session.transition(SessionState.RUNNING);
        if (!session.hasQueued() && session.visitedCount() == 0) session.enqueue(session.getSeedUrl());

        final LogSink log = session.log();
        final String host = UrlUtils.hostOf(session.getSeedUrl());
        final Map<String, PageMeta> meta = new HashMap<>();

        LOG.info("Crawl start: seed={}, maxPages={}, queued={}",
                session.getSeedUrl(), session.getMaxPages(), session.queuedCount());
        SLOG.info("crawl-start",
                "seed", session.getSeedUrl(),
                "maxPages", session.getMaxPages(),
                "queued", session.queuedCount());
        log.log("Crawling " + session.queuedCount() + " queued URL(s) from " + session.getSeedUrl());

        boolean requested = false;
        while (session.hasQueued()) {
            if (session.isCancelled()) break;
            if (session.capReached()) break;

            String url = session.poll();
            if (!session.markVisited(url)) continue;

            // 직전 요청이 있을 때만 대기 → 마지막 요청 뒤에는 대기 없음
            if (requested && !delay.isZero()) {
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    session.cancel();
                    break;
                }
                if (session.isCancelled()) break;
            }

            FetchResult r = fetcher.fetch(url);
            requested = true;
            PageRecord rec = handle(session, url, r, host, meta);
            session.addRecord(rec);

            if (rec.isSuccess()) {
                log.log("Downloaded: " + rec.title() + " (" + url + ")");
            } else {
                log.log("Failed: " + url + " - " + rec.error());
            }
            reportProgress(session);
        }

        session.transition(finalState(session));
        LOG.info("Crawl loop done: state={}, downloaded={}, failed={}",
                session.state(), session.downloadedCount(), session.failedCount());

        rewriteAll(session, meta, host);

        Report report = ReportWriter.write(session);
        SLOG.info("crawl-done",
                "state", session.state().name(),
                "discovered", report.totalDiscovered(),
                "downloaded", report.totalDownloaded(),
                "failed", report.totalFailed());
        log.log("Crawl finished (" + session.state().name().toLowerCase(Locale.ROOT) + "): "
                + report.totalDownloaded() + " downloaded, " + report.totalFailed() + " failed");
        return report;
    }

    // ---------- 단일 페이지 처리 ----------

    private PageRecord handle(ScrapeSession session, String url, FetchResult r, String host, Map<String, PageMeta> meta) {
        if (!r.isSuccess()) {
            SLOG.warn("page-failed", "url", url, "status", r.status(), "reason", r.failureReason());
            return PageRecord.failed(url, r.failureReason());
        }
        if (!PageExtractor.isHtml(r.contentType())) {
            String reason = "parse: unsupported content type " + r.contentType();
            SLOG.warn("page-failed", "url", url, "status", r.status(), "reason", reason);
            return PageRecord.failed(url, reason);
        }

        PageExtractor.ParsedPage page;
        try {
            page = PageExtractor.parse(r.body(), r.contentType(), r.finalUrl());
        } catch (IOException | RuntimeException e) {
            SLOG.warn("page-failed", "url", url, "reason", "parse");
            return PageRecord.failed(url, "parse: " + e.getMessage());
        }

        String title = PageExtractor.title(page.doc(), url);

        if (followLinks) {
            for (String link : PageExtractor.sameDomainLinks(page.doc(), host)) {
                if (!session.hasRoomToEnqueue()) break;
                session.enqueue(link);
            }
        }

        String localPath = paths.allocate(url);
        try {
            store.put(localPath, r.body());
        } catch (IOException e) {
            LOG.warn("Storage failed for {}: {}", url, e.toString());
            SLOG.error("page-storage-failed", e, "url", url, "path", localPath);
            return PageRecord.failed(url, "storage: " + e.getMessage());
        }

        session.urlMap().put(url, localPath);
        // 리다이렉트 최종 URL도 같은 파일로 매핑 (같은 도메인일 때만, 중복 fetch 방지)
        String finalUrl = UrlUtils.normalize(r.finalUrl());
        if (finalUrl != null && !finalUrl.equals(url) && host.equals(UrlUtils.hostOf(finalUrl))
                && session.markVisited(finalUrl)) {
            session.urlMap().put(finalUrl, localPath);
        }
        meta.put(url, new PageMeta(localPath, page.charset(), r.finalUrl()));

        LOG.debug("Fetched {} -> {} ({} bytes)", url, localPath, r.body().length);
        SLOG.info("page-fetched", "url", url, "path", localPath, "bytes", r.body().length);
        return PageRecord.success(url, localPath, title);
    }

    // ---------- 재작성 패스 ----------

    private void rewriteAll(ScrapeSession session, Map<String, PageMeta> meta, String host) {
        int total = meta.size();
        int done = 0;
        progress.onProgress(0.0, "rewrite", 0, total);
        for (PageRecord rec : session.pageRecords()) {
            if (!rec.isSuccess()) continue;
            PageMeta m = meta.get(rec.url());
            if (m == null) continue;
            try {
                String html = new String(store.get(m.localPath()), m.charset());
                String out = rewriter.rewrite(html, session.urlMap(), m.baseUrl(), host);
                store.put(m.localPath(), out.getBytes(StandardCharsets.UTF_8));
            } catch (IOException | RuntimeException e) {
                // 원본 HTML은 이미 저장돼 있으므로 레코드는 success 유지
                LOG.warn("Link rewrite failed for {}: {}", rec.url(), e.toString());
                SLOG.error("rewrite-failed", e, "url", rec.url());
            }
            done++;
            progress.onProgress(total == 0 ? 1.0 : (double) done / total, "rewrite", done, total);
        }
    }

    // ---------- helpers ----------

    private static SessionState finalState(ScrapeSession s) {
        if (s.isCancelled()) return SessionState.CANCELLED;
        if (s.capReached() && s.hasQueued()) return SessionState.CAPPED;
        return SessionState.COMPLETED;
    }

    private void reportProgress(ScrapeSession s) {
        int done = s.pageRecords().size();
        long total = (s.getMaxPages() != null)
                ? s.getMaxPages()
                : (long) done + s.queuedCount();
        double p = (total <= 0 ? 1.0 : Math.min(1.0, (double) done / total));
        progress.onProgress(p, "crawl", done, total);
    }

    private record PageMeta(String localPath, Charset charset, String baseUrl) {}
}
