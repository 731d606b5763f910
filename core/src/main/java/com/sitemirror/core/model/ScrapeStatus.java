package com.sitemirror.core.model;

/** 컨트롤 서피스용 상태 스냅샷 */
public record ScrapeStatus(boolean running, int pagesDownloaded, int pagesFailed) {
    public static final ScrapeStatus IDLE = new ScrapeStatus(false, 0, 0);
}
