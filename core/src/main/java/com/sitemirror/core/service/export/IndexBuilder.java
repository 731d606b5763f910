package com.sitemirror.core.service.export;

import com.sitemirror.core.model.PageRecord;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 오프라인 미러의 진입 페이지(index.html).
 * 성공 레코드만 나열하며 정렬은 제목(대소문자 무시) → URL 순.
 */
public final class IndexBuilder {

    static final Comparator<PageRecord> ORDER = Comparator
            .comparing((PageRecord r) -> safe(r.title()).toLowerCase(Locale.ROOT))
            .thenComparing(PageRecord::url);

    private static final DateTimeFormatter GENERATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private IndexBuilder() {}

    public static String build(List<PageRecord> records) {
        int failed = 0;
        for (PageRecord r : records) if (!r.isSuccess()) failed++;
        return build(records, failed, null);
    }

    /**
     * @param failedCount 실패 페이지 수(요약 표시용)
     * @param siteLabel   헤더에 표시할 사이트 이름(null이면 생략)
     */
    public static String build(List<PageRecord> records, int failedCount, String siteLabel) {
        List<PageRecord> ok = new ArrayList<>();
        for (PageRecord r : records) if (r.isSuccess()) ok.add(r);
        ok.sort(ORDER);

        StringBuilder sb = new StringBuilder(4096 + ok.size() * 256);
        sb.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n")
          .append("<meta charset=\"UTF-8\">\n")
          .append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
          .append("<title>Offline Website Index")
          .append(siteLabel == null ? "" : " - " + esc(siteLabel))
          .append("</title>\n")
          .append(IndexTemplates.css())
          .append("</head>\n<body>\n<div class=\"container\">\n");

        // Header
        sb.append("<header><h1>Offline Website Index</h1>");
        if (siteLabel != null) sb.append("<p>").append(esc(siteLabel)).append("</p>");
        sb.append("</header>\n");

        // Stats
        sb.append("<div class=\"stats\">");
        stat(sb, ok.size(), "Pages Downloaded");
        stat(sb, failedCount, "Failed");
        stat(sb, ok.size() + failedCount, "Total Processed");
        sb.append("</div>\n");

        // Search
        sb.append("<div class=\"search-box\">")
          .append("<input type=\"text\" id=\"search-input\" placeholder=\"Search pages...\" autocomplete=\"off\">")
          .append("</div>\n");

        // List
        sb.append("<div class=\"pages\" id=\"pages-list\">\n");
        for (PageRecord r : ok) {
            sb.append("<div class=\"page-item\" data-title=\"").append(esc(safe(r.title()).toLowerCase(Locale.ROOT)))
              .append("\" data-url=\"").append(esc(r.url().toLowerCase(Locale.ROOT))).append("\">")
              .append("<a href=\"").append(esc(r.localPath())).append("\">").append(esc(safe(r.title()))).append("</a>")
              .append("<div class=\"page-url\">").append(esc(r.url())).append("</div>")
              .append("</div>\n");
        }
        sb.append("<div class=\"no-results\" id=\"no-results\">No pages found</div>\n");
        sb.append("</div>\n");

        sb.append("<footer>Generated on ").append(esc(GENERATED.format(ZonedDateTime.now()))).append("</footer>\n");
        sb.append("</div>\n")
          .append(IndexTemplates.script())
          .append("</body>\n</html>\n");
        return sb.toString();
    }

    // ---------- helpers ----------

    private static void stat(StringBuilder sb, int n, String label) {
        sb.append("<div class=\"stat\"><div class=\"stat-number\">").append(n)
          .append("</div><div class=\"stat-label\">").append(esc(label)).append("</div></div>");
    }

    private static String safe(String s) { return s == null ? "" : s; }

    static String esc(String s) {
        if (s == null) return "";
        return s.replace("&","&amp;").replace("<","&lt;").replace(">","&gt;")
                .replace("\"","&quot;").replace("'","&#39;");
    }
}
