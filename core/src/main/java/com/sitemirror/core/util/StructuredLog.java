package com.sitemirror.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 한 줄 JSON 이벤트 로거 (JUL 위에 얹음).
 * 크롤 이벤트(crawl-start, page-fetched, page-failed, sitemap-parsed ...)를
 * {"ts","lvl","comp","thread","event", ...kv} 형태로 남긴다.
 * with()로 세션 id 같은 고정 필드를 묶은 파생 로거를 만들 수 있다.
 */
public final class StructuredLog {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Logger jul;
    private final String comp;
    private final Map<String, Object> bound;

    private StructuredLog(Logger jul, String comp, Map<String, Object> bound) {
        this.jul = jul;
        this.comp = comp;
        this.bound = bound;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), Map.of());
    }

    /** 모든 이벤트에 key=value를 덧붙이는 파생 로거 */
    public StructuredLog with(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(bound);
        next.put(key, value);
        return new StructuredLog(jul, comp, next);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line);
        else jul.log(lvl, line, t);
    }

    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = JSON.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        bound.forEach((k, v) -> put(n, k, v));

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        return n.toString();
    }

    // 숫자/불리언은 그대로, 나머지는 문자열
    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
