package com.sitemirror.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * 세션 종료 시점의 읽기 전용 스냅샷 (report.json).
 * pages에는 성공/실패 모든 레코드가, failedUrls에는 실패분의 url/error가 들어간다.
 */
@JsonPropertyOrder({"totalDiscovered", "totalDownloaded", "totalFailed", "pages", "failedUrls"})
public record Report(int totalDiscovered,
                     int totalDownloaded,
                     int totalFailed,
                     List<PageRecord> pages,
                     List<FailedUrl> failedUrls) {

    public Report {
        pages = (pages == null ? List.of() : List.copyOf(pages));
        failedUrls = (failedUrls == null ? List.of() : List.copyOf(failedUrls));
    }

    @JsonPropertyOrder({"url", "error"})
    public record FailedUrl(String url, String error) {}
}
