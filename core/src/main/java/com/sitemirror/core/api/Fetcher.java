package com.sitemirror.core.api;

import com.sitemirror.core.model.FetchResult;

import java.net.URI;

/**
 * 단일 HTTP GET(타임아웃 포함). 재시도 없음.
 * 구현체는 예외를 던지지 않고 전송 오류를 status -1 결과로 돌려준다.
 */
@FunctionalInterface
public interface Fetcher {
    FetchResult fetch(URI url);

    default FetchResult fetch(String url) {
        try {
            return fetch(URI.create(url));
        } catch (IllegalArgumentException e) {
            return FetchResult.transportError(url, "invalid URL: " + e.getMessage());
        }
    }
}
