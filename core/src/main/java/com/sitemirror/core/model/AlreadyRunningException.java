package com.sitemirror.core.model;

/** 활성 세션이 있는 동안 start 요청이 들어온 경우. 기존 세션은 영향 없음. */
public class AlreadyRunningException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final String activeSessionId;

    public AlreadyRunningException(String activeSessionId) {
        super("Scraper is already running (session " + activeSessionId + ")");
        this.activeSessionId = activeSessionId;
    }

    public String getActiveSessionId() { return activeSessionId; }
}
