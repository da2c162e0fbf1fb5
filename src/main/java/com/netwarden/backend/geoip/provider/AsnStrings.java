package com.netwarden.backend.geoip.provider;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** "AS12389 Rostelecom" → 12389 */
public final class AsnStrings {

    private static final Pattern AS_TOKEN = Pattern.compile("(?i)\\bAS(\\d{1,10})\\b");

    private AsnStrings() {}

    public static Long parseAsn(String raw) {
        if (raw == null || raw.isBlank()) return null;
        Matcher m = AS_TOKEN.matcher(raw);
        if (!m.find()) return null;
        try {
            long v = Long.parseLong(m.group(1));
            return v > 0 ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** "AS12389 Rostelecom" → "Rostelecom"；沒有 AS 前綴就原樣回 */
    public static String stripAsnPrefix(String raw) {
        if (raw == null) return null;
        String t = AS_TOKEN.matcher(raw).replaceFirst("").trim();
        return t.isEmpty() ? null : t;
    }
}
