package com.sitemirror.core.service;

import com.sitemirror.core.model.ScrapeOutcome;
import com.sitemirror.core.model.ScrapeSession;
import com.sitemirror.core.model.ScrapeStatus;
import com.sitemirror.core.util.BufferedLogSink;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** start()가 돌려주는 세션 핸들. 컨트롤 서피스는 이 핸들만 들고 있으면 된다. */
public final class SessionHandle {

    private final ScrapeSession session;
    private final BufferedLogSink logs;
    private final CompletableFuture<ScrapeOutcome> future;

    SessionHandle(ScrapeSession session, BufferedLogSink logs, CompletableFuture<ScrapeOutcome> future) {
        this.session = session;
        this.logs = logs;
        this.future = future;
    }

    public String id() { return session.getId(); }

    public ScrapeSession session() { return session; }

    public BufferedLogSink logs() { return logs; }

    public boolean isDone() { return future.isDone(); }

    /** 취소 요청만 하고 바로 반환 (진행 중인 fetch는 끝까지 간다) */
    public void stop() { session.cancel(); }

    public ScrapeStatus status() {
        return new ScrapeStatus(!future.isDone(), session.downloadedCount(), session.failedCount());
    }

    /** 세션 종료까지 대기. 실패했으면 ExecutionException(cause = 원래 예외). */
    public ScrapeOutcome await() throws InterruptedException, ExecutionException {
        return future.get();
    }

    public ScrapeOutcome await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
