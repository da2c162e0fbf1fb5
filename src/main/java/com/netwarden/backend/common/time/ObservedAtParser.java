package com.netwarden.backend.common.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.Function;

/**
 * 上游事件時間 best-effort 解析，順序：
 * ISO instant > ISO offset date-time > ISO local date-time（視為 UTC）> epoch 秒 / 毫秒
 * 解析不了回 null（呼叫端當作沒帶）。
 */
public final class ObservedAtParser {

    /** 大於這個值就當成 epoch millis（約 2286 年的秒數） */
    private static final long EPOCH_MILLIS_THRESHOLD = 10_000_000_000L;

    private ObservedAtParser() {}

    public static Instant parse(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        if (s.isEmpty()) return null;

        if (s.matches("-?\\d{1,19}")) {
            return fromEpoch(s);
        }

        // 有些來源用空白分隔日期與時間
        String iso = (s.length() > 10 && s.charAt(10) == ' ') ? s.substring(0, 10) + 'T' + s.substring(11) : s;

        for (Function<String, Instant> f : ISO_PARSERS) {
            Instant t = tryParse(f, iso);
            if (t != null) return t;
        }
        return null;
    }

    private static final List<Function<String, Instant>> ISO_PARSERS = List.of(
            Instant::parse,
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC)
    );

    private static Instant tryParse(Function<String, Instant> f, String v) {
        try {
            return f.apply(v);
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static Instant fromEpoch(String digits) {
        try {
            long v = Long.parseLong(digits);
            if (v < 0) return null;
            return (v >= EPOCH_MILLIS_THRESHOLD) ? Instant.ofEpochMilli(v) : Instant.ofEpochSecond(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
