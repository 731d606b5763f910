package com.sitemirror.core.service;

import com.sitemirror.core.model.AlreadyRunningException;
import com.sitemirror.core.model.MirrorConfig;
import com.sitemirror.core.model.ScrapeOutcome;
import com.sitemirror.core.model.ScrapeSession;
import com.sitemirror.core.model.ScrapeStatus;
import com.sitemirror.core.util.BufferedLogSink;
import com.sitemirror.core.util.LogSink;
import com.sitemirror.core.util.NamedThreadFactory;
import com.sitemirror.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 컨트롤 서피스(웹/CLI)가 호출하는 start/stop/status 인터페이스.
 * - 활성 세션은 최대 1개, 실행 중 start는 AlreadyRunningException (대기열에 넣지 않음)
 * - 세션은 전용 워커 스레드에서 돌고 start는 즉시 반환
 */
public final class ScrapeController implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScrapeController.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScrapeController.class);

    private final MirrorConfig baseConfig;
    private final Function<MirrorConfig, ScrapeService> serviceFactory;
    private final LogSink forward;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(new NamedThreadFactory("mirror-worker"));

    private SessionHandle active;          // guarded by this
    private volatile SessionHandle last;

    public ScrapeController(MirrorConfig baseConfig) {
        this(baseConfig, ScrapeService::new, LogSink.NONE);
    }

    /**
     * @param serviceFactory 세션별 설정으로 ScrapeService 생성 (테스트에서 가짜 Fetcher 주입)
     * @param forward        로그 라인을 버퍼와 함께 흘려보낼 대상
     */
    public ScrapeController(MirrorConfig baseConfig, Function<MirrorConfig, ScrapeService> serviceFactory, LogSink forward) {
        this.baseConfig = Objects.requireNonNull(baseConfig, "baseConfig").copy();
        this.serviceFactory = Objects.requireNonNull(serviceFactory, "serviceFactory");
        this.forward = (forward != null ? forward : LogSink.NONE);
    }

    /**
     * @param maxPages null이면 무제한
     * @throws com.sitemirror.core.model.ConfigurationException 잘못된 URL/상한
     * @throws AlreadyRunningException 활성 세션이 있을 때
     */
    public SessionHandle start(String seedUrl, Integer maxPages) {
        MirrorConfig cfg = baseConfig.copy().setTarget(seedUrl).setMaxPages(maxPages);
        cfg.validate();

        synchronized (this) {
            if (active != null && !active.isDone()) {
                SLOG.warn("start-rejected", "active", active.id());
                throw new AlreadyRunningException(active.id());
            }
            BufferedLogSink logs = new BufferedLogSink(forward);
            ScrapeSession session = ScrapeSession.of(cfg, logs);
            ScrapeService service = serviceFactory.apply(cfg);
            CompletableFuture<ScrapeOutcome> future = new CompletableFuture<>();
            SessionHandle handle = new SessionHandle(session, logs, future);

            active = handle;
            last = handle;
            worker.execute(() -> runSession(handle, service, future));

            LOG.info("Session {} started: seed={}, maxPages={}, mode={}",
                    handle.id(), session.getSeedUrl(), maxPages, cfg.getMode());
            SLOG.info("session-start", "id", handle.id(), "seed", session.getSeedUrl(), "mode", cfg.getMode().name());
            return handle;
        }
    }

    /** 취소 요청 후 즉시 반환 */
    public void stop(SessionHandle handle) {
        if (handle == null) return;
        handle.stop();
        LOG.info("Stop requested for session {}", handle.id());
        SLOG.info("session-stop", "id", handle.id());
    }

    /** 활성 세션 취소. 활성 세션이 없으면 false. */
    public synchronized boolean stop() {
        if (active == null || active.isDone()) return false;
        stop(active);
        return true;
    }

    public ScrapeStatus status() {
        SessionHandle h = last;
        return h == null ? ScrapeStatus.IDLE : h.status();
    }

    public synchronized boolean isRunning() {
        return active != null && !active.isDone();
    }

    /** 현재(또는 마지막) 세션의 로그 라인 */
    public List<String> logs(int since) {
        SessionHandle h = last;
        return h == null ? List.of() : h.logs().linesSince(since);
    }

    public SessionHandle lastSession() { return last; }

    @Override
    public void close() {
        stop();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(30, TimeUnit.SECONDS)) worker.shutdownNow();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }

    // ---------- worker ----------

    private void runSession(SessionHandle handle, ScrapeService service, CompletableFuture<ScrapeOutcome> future) {
        try {
            ScrapeOutcome outcome = service.execute(handle.session());
            LOG.info("Session {} finished: {}", handle.id(), outcome.state());
            future.complete(outcome);
        } catch (Throwable t) {
            LOG.warn("Session {} failed: {}", handle.id(), t.toString());
            future.completeExceptionally(t);
        } finally {
            synchronized (this) {
                if (active == handle) active = null;
            }
        }
    }
}
