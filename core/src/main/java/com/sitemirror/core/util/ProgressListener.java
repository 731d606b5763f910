package com.sitemirror.core.util;

import org.slf4j.LoggerFactory;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "discover" | "crawl" | "rewrite" | "export"
     * @param done     처리 수(모르면 -1)
     * @param total    전체 수(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};

    /**
     * 리스너 예외가 크롤/내보내기를 멈추지 않도록 감싼다. 예외는 WARN으로 남기고 진행.
     * null이면 NONE.
     */
    static ProgressListener guarded(ProgressListener listener) {
        if (listener == null || listener == NONE) return NONE;
        return (p, phase, d, t) -> {
            try {
                listener.onProgress(p, phase, d, t);
            } catch (RuntimeException e) {
                LoggerFactory.getLogger(ProgressListener.class)
                        .warn("Progress listener failed in phase {}: {}", phase, e.toString());
            }
        };
    }
}
