package com.netwarden.backend.report.model;

public enum TrendDirection {
    UP, DOWN, STABLE;

    /** ±5% 以內算持平；沒有前期資料（null）也算持平 */
    public static TrendDirection of(Double trendPercent) {
        if (trendPercent == null) return STABLE;
        if (trendPercent > 5.0) return UP;
        if (trendPercent < -5.0) return DOWN;
        return STABLE;
    }
}
