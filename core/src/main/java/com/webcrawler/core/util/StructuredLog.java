package com.webcrawler.core.util;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트를 JSON 한 줄로 JUL에 남긴다.
 * 필드 순서: ts, lvl, comp, thread, event, 호출자 key/value, (예외 시) error, message.
 * 사용: SLOG.info("crawl-done", "processed", 10, "failed", 1)
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> owner) {
        this.jul = Logger.getLogger(owner.getName());
        this.comp = owner.getSimpleName();
    }

    public static StructuredLog get(Class<?> owner) {
        return new StructuredLog(owner);
    }

    public void debug(String event, Object... kvs) { emit(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { emit(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { emit(Level.WARNING, event, null, kvs); }
    public void warn(String event, Throwable t, Object... kvs) { emit(Level.WARNING, event, t, kvs); }
    public void error(String event, Throwable t, Object... kvs) { emit(Level.SEVERE, event, t, kvs); }

    private void emit(Level lvl, String event, Throwable t, Object[] kvs) {
        if (!jul.isLoggable(lvl)) return;
        jul.log(lvl, toJson(lvl, comp, event, t, kvs), t);
    }

    static String toJson(Level lvl, String comp, String event, Throwable t, Object... kvs) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ts", Instant.now().toString());
        fields.put("lvl", lvl.getName());
        fields.put("comp", comp);
        fields.put("thread", Thread.currentThread().getName());
        fields.put("event", event);
        int n = (kvs == null) ? 0 : kvs.length;
        for (int i = 0; i + 1 < n; i += 2) {
            fields.put(String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (n % 2 == 1) fields.put("_kv_mismatch", true); // 짝 없는 키
        if (t != null) {
            fields.put("error", t.getClass().getSimpleName());
            fields.put("message", t.getMessage());
        }

        StringJoiner json = new StringJoiner(",", "{", "}");
        fields.forEach((k, v) -> json.add(quote(k) + ":" + value(v)));
        return json.toString();
    }

    private static String value(Object v) {
        if (v == null) return "null";
        if (v instanceof Number || v instanceof Boolean) return v.toString();
        return quote(String.valueOf(v));
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }
}
