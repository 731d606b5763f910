package com.sitemirror.core.model;

/** 실행 모드: 페이지 미러링 또는 사이트맵 XML 수집 */
public enum Mode {
    SITE,
    SITEMAPS
}
