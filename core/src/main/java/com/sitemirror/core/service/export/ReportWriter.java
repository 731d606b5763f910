package com.sitemirror.core.service.export;

import com.sitemirror.core.model.PageRecord;
import com.sitemirror.core.model.Report;
import com.sitemirror.core.model.ScrapeSession;

import java.util.ArrayList;
import java.util.List;

/** ScrapeSession → Report 순수 투영 (재계산 없이 status별 분할만) */
public final class ReportWriter {

    private ReportWriter() {}

    public static Report write(ScrapeSession session) {
        List<PageRecord> records = session.pageRecords();
        List<Report.FailedUrl> failed = new ArrayList<>();
        int ok = 0;
        for (PageRecord r : records) {
            if (r.isSuccess()) ok++;
            else failed.add(new Report.FailedUrl(r.url(), r.error()));
        }
        return new Report(session.discoveredCount(), ok, failed.size(), records, failed);
    }
}
