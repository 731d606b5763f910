package com.sitemirror.core.service.export;

import com.sitemirror.core.api.PageStore;
import com.sitemirror.core.model.PageRef;
import com.sitemirror.core.model.SitemapNode;
import com.sitemirror.core.model.SitemapReport;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** sitemaps 모드 결과 sitemap_report.json */
public class SitemapReportExporter {

    public static final String FILE_NAME = "sitemap_report.json";

    /** 노드 목록에서 보고서 구성 (urls는 모든 urlset 항목, 첫 등장 순 중복 제거) */
    public static SitemapReport toReport(List<SitemapNode> nodes) {
        List<SitemapReport.Entry> entries = new ArrayList<>();
        Set<String> urls = new LinkedHashSet<>();
        for (SitemapNode n : nodes) {
            entries.add(SitemapReport.Entry.of(n));
            for (PageRef p : n.pages()) urls.add(p.url());
        }
        return new SitemapReport(entries.size(), entries, new ArrayList<>(urls));
    }

    public byte[] toJson(SitemapReport report) throws IOException {
        Objects.requireNonNull(report, "report");
        return JsonReportExporter.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(report);
    }

    public String export(SitemapReport report, PageStore store) throws IOException {
        store.put(FILE_NAME, toJson(report));
        return FILE_NAME;
    }
}
