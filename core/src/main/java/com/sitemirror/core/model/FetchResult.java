package com.sitemirror.core.model;

import java.nio.charset.StandardCharsets;

/**
 * 단일 GET 결과.
 * status -1 = 전송 오류(타임아웃/연결 거부/DNS), 이때 error에 사유가 담긴다.
 */
public record FetchResult(String url, String finalUrl, int status, String contentType, byte[] body, String error) {

    public FetchResult {
        body = (body == null ? new byte[0] : body);
        finalUrl = (finalUrl == null ? url : finalUrl);
    }

    public static FetchResult ok(String url, String finalUrl, int status, String contentType, byte[] body) {
        return new FetchResult(url, finalUrl, status, contentType, body, null);
    }

    public static FetchResult transportError(String url, String error) {
        return new FetchResult(url, url, -1, null, new byte[0], error);
    }

    public boolean isSuccess() { return status >= 200 && status < 300; }

    public boolean isTransportError() { return status < 0; }

    /** 실패 사유 문자열: 전송 오류면 원문, 그 외는 "HTTP <code>" */
    public String failureReason() {
        if (isTransportError()) return (error == null || error.isBlank()) ? "transport error" : error;
        return "HTTP " + status;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
