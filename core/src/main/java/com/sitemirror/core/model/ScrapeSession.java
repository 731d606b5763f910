package com.sitemirror.core.model;

import com.sitemirror.core.util.LogSink;
import com.sitemirror.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 한 번의 스크레이프 실행 상태.
 * - visited/queue/discovered는 크롤 워커 스레드 전용
 * - cancelled, pageRecords, state, logSink는 상태 조회 스레드에서 읽어도 안전
 */
public final class ScrapeSession {

    private final String id = UUID.randomUUID().toString();
    private final String seedUrl;
    private final Integer maxPages;
    private final LogSink log;

    private final Set<String> visited = new LinkedHashSet<>();
    private final Deque<String> queue = new ArrayDeque<>();
    private final Set<String> discovered = new LinkedHashSet<>();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<PageRecord> pageRecords = new CopyOnWriteArrayList<>();
    private final UrlMap urlMap = new UrlMap();
    private volatile SessionState state = SessionState.PENDING;

    public ScrapeSession(String seedUrl, Integer maxPages, LogSink log) {
        String n = UrlUtils.normalize(seedUrl);
        if (n == null) throw new ConfigurationException("Invalid URL: " + seedUrl);
        if (maxPages != null && maxPages < 0) throw new ConfigurationException("maxPages must be >= 0");
        this.seedUrl = n;
        this.maxPages = maxPages;
        this.log = (log != null ? log : LogSink.NONE);
    }

    public static ScrapeSession of(MirrorConfig cfg, LogSink log) {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        return new ScrapeSession(cfg.getTarget(), cfg.getMaxPages(), log);
    }

    // ---------- queue / visited ----------

    /** 처음 발견된 URL만 큐에 넣는다. @return 큐에 들어갔으면 true */
    public boolean enqueue(String url) {
        String n = UrlUtils.normalize(url);
        if (n == null || !discovered.add(n)) return false;
        queue.addLast(n);
        return true;
    }

    public String poll() { return queue.pollFirst(); }

    public boolean hasQueued() { return !queue.isEmpty(); }

    public int queuedCount() { return queue.size(); }

    /** @return 처음 방문이면 true */
    public boolean markVisited(String url) {
        String n = UrlUtils.normalize(url);
        if (n == null) return false;
        discovered.add(n);
        return visited.add(n);
    }

    public int visitedCount() { return visited.size(); }

    public int discoveredCount() { return discovered.size(); }

    // ---------- cap / cancel ----------

    public boolean capReached() {
        return maxPages != null && pageRecords.size() >= maxPages;
    }

    /** 상한 안에서 큐에 더 넣을 여유가 있는지 (visited + queued < cap) */
    public boolean hasRoomToEnqueue() {
        return maxPages == null || visited.size() + queue.size() < maxPages;
    }

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() { return cancelled.get(); }

    // ---------- records ----------

    public void addRecord(PageRecord r) { pageRecords.add(Objects.requireNonNull(r, "record")); }

    public List<PageRecord> pageRecords() { return List.copyOf(pageRecords); }

    public int downloadedCount() {
        int n = 0;
        for (PageRecord r : pageRecords) if (r.isSuccess()) n++;
        return n;
    }

    public int failedCount() {
        int n = 0;
        for (PageRecord r : pageRecords) if (!r.isSuccess()) n++;
        return n;
    }

    // ---------- state ----------

    public synchronized void transition(SessionState next) {
        Objects.requireNonNull(next, "next");
        if (state.isTerminal()) {
            throw new IllegalStateException("session already finished: " + state + " -> " + next);
        }
        if (next == SessionState.PENDING || (state == SessionState.PENDING && next != SessionState.RUNNING
                && next != SessionState.FAILED)) {
            throw new IllegalStateException("illegal transition: " + state + " -> " + next);
        }
        state = next;
    }

    /** 이미 종료 상태면 무시하고 FAILED로 전환 */
    public synchronized void fail() {
        state = SessionState.FAILED;
    }

    public ScrapeStatus status() {
        boolean running = !state.isTerminal();
        return new ScrapeStatus(running, downloadedCount(), failedCount());
    }

    // ---------- getters ----------
    public String getId() { return id; }
    public String getSeedUrl() { return seedUrl; }
    public Integer getMaxPages() { return maxPages; }
    public UrlMap urlMap() { return urlMap; }
    public SessionState state() { return state; }
    public LogSink log() { return log; }
}
