package com.sitemirror.core.model;

/**
 * 세션 실행 결과. SITE 모드는 report, SITEMAPS 모드는 sitemapReport가 채워진다.
 */
public record ScrapeOutcome(Mode mode, SessionState state, Report report, SitemapReport sitemapReport) {

    public static ScrapeOutcome site(SessionState state, Report report) {
        return new ScrapeOutcome(Mode.SITE, state, report, null);
    }

    public static ScrapeOutcome sitemaps(SessionState state, SitemapReport report) {
        return new ScrapeOutcome(Mode.SITEMAPS, state, null, report);
    }
}
