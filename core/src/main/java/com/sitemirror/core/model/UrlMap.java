package com.sitemirror.core.model;

import com.sitemirror.core.util.UrlUtils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 정규화된 절대 URL → 로컬 상대 경로(pages/&lt;slug&gt;.html).
 * 세션 동안 append-only, 읽기는 다른 스레드에서도 안전.
 */
public final class UrlMap {

    private final Map<String, String> byUrl = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Set<String> localPaths = ConcurrentHashMap.newKeySet();

    /**
     * @return 새로 추가되면 true, 같은 URL이 같은 경로로 이미 있으면 false
     * @throws IllegalStateException 같은 URL을 다른 경로로 덮어쓰려는 경우
     */
    public boolean put(String url, String localPath) {
        String key = UrlUtils.normalize(url);
        if (key == null) throw new IllegalArgumentException("not an absolute URL: " + url);
        synchronized (byUrl) {
            String prev = byUrl.get(key);
            if (prev != null) {
                if (prev.equals(localPath)) return false;
                throw new IllegalStateException("UrlMap is append-only: " + key + " -> " + prev);
            }
            byUrl.put(key, localPath);
        }
        localPaths.add(localPath);
        return true;
    }

    /** 입력 URL을 정규화해서 조회 (없으면 null) */
    public String get(String url) {
        String key = UrlUtils.normalize(url);
        return key == null ? null : byUrl.get(key);
    }

    public boolean contains(String url) { return get(url) != null; }

    /** 이미 로컬 경로로 바뀐 href인지 (재작성 멱등성 판정용) */
    public boolean isLocalPath(String href) {
        return href != null && localPaths.contains(href);
    }

    public int size() { return byUrl.size(); }

    public Map<String, String> snapshot() {
        synchronized (byUrl) {
            return Map.copyOf(byUrl);
        }
    }
}
