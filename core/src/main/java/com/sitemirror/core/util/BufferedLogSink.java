package com.sitemirror.core.util;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * append-only 로그 버퍼.
 * 크롤 스레드가 쓰고, 상태 조회 스레드가 인덱스 기준으로 이어 읽는다.
 */
public final class BufferedLogSink implements LogSink {

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final List<String> lines = new CopyOnWriteArrayList<>();
    private final LogSink forward;

    public BufferedLogSink() {
        this(NONE);
    }

    /** @param forward 버퍼링과 동시에 전달할 대상(예: 콘솔 출력) */
    public BufferedLogSink(LogSink forward) {
        this.forward = (forward != null ? forward : NONE);
    }

    @Override
    public void log(String line) {
        String stamped = "[" + TS.format(LocalTime.now()) + "] " + (line == null ? "" : line);
        lines.add(stamped);
        forward.log(stamped);
    }

    /**
     * from 번째 줄부터의 스냅샷 (from이 범위를 벗어나면 빈 리스트).
     * 쓰기와 동시에 호출돼도 배열 하나를 먼저 떠서 자르므로 예외가 나지 않는다.
     */
    public List<String> linesSince(int from) {
        Object[] snap = lines.toArray();
        if (from < 0) from = 0;
        if (from >= snap.length) return List.of();
        List<String> out = new ArrayList<>(snap.length - from);
        for (int i = from; i < snap.length; i++) out.add((String) snap[i]);
        return Collections.unmodifiableList(out);
    }

    public List<String> lines() { return List.copyOf(lines); }

    public int size() { return lines.size(); }
}
