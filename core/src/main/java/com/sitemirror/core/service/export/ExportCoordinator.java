package com.sitemirror.core.service.export;

import com.sitemirror.core.api.PageStore;
import com.sitemirror.core.model.Report;
import com.sitemirror.core.model.SitemapReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * 산출물 기록 순서 고정: index.html → report.json.
 * 어느 하나라도 실패하면 예외를 그대로 올린다 (세션은 FAILED 처리).
 */
public final class ExportCoordinator {

    private static final Logger LOG = Logger.getLogger(ExportCoordinator.class.getName());

    public static final String INDEX_FILE = "index.html";

    private final JsonReportExporter json = new JsonReportExporter();
    private final SitemapReportExporter sitemapJson = new SitemapReportExporter();

    /** @return 기록한 키 목록 */
    public List<String> exportSite(Report report, String siteLabel, PageStore store) throws IOException {
        Objects.requireNonNull(report, "report");
        Objects.requireNonNull(store, "store");

        String html = IndexBuilder.build(report.pages(), report.totalFailed(), siteLabel);
        store.put(INDEX_FILE, html.getBytes(StandardCharsets.UTF_8));
        String reportKey = json.export(report, store);

        LOG.info(() -> "[Export] index.html + report.json written (pages=" + report.totalDownloaded()
                + ", failed=" + report.totalFailed() + ")");
        return List.of(INDEX_FILE, reportKey);
    }

    public String exportSitemaps(SitemapReport report, PageStore store) throws IOException {
        Objects.requireNonNull(report, "report");
        String key = sitemapJson.export(report, store);
        LOG.info(() -> "[Export] sitemap_report.json written (sitemaps=" + report.sitemapCount()
                + ", urls=" + report.urls().size() + ")");
        return key;
    }
}
