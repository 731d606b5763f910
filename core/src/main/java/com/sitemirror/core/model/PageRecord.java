package com.sitemirror.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * 한 번의 fetch 시도 결과. 생성 후 불변.
 * - success: localPath/title 필수
 * - failed : error 필수(비어 있지 않음)
 */
@JsonPropertyOrder({"url", "localPath", "title", "status"})
public record PageRecord(String url, String localPath, String title, PageStatus status,
                         @JsonIgnore String error) {

    public PageRecord {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(status, "status");
        if (status == PageStatus.SUCCESS && (localPath == null || localPath.isBlank()))
            throw new IllegalArgumentException("success record needs localPath: " + url);
        if (status == PageStatus.FAILED && (error == null || error.isBlank()))
            throw new IllegalArgumentException("failed record needs error: " + url);
    }

    public static PageRecord success(String url, String localPath, String title) {
        return new PageRecord(url, localPath, title, PageStatus.SUCCESS, null);
    }

    public static PageRecord failed(String url, String error) {
        return new PageRecord(url, null, null, PageStatus.FAILED, error);
    }

    @JsonIgnore
    public boolean isSuccess() { return status == PageStatus.SUCCESS; }
}
