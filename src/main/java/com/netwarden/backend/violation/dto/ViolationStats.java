package com.netwarden.backend.violation.dto;

/**
 * 期間統計。critical ≥ 80、warning [50, 80)、monitor [30, 50)。
 */
public record ViolationStats(
        long total,
        long critical,
        long warning,
        long monitor,
        long uniqueUsers,
        double avgScore,
        double maxScore
) {
    public static ViolationStats empty() {
        return new ViolationStats(0, 0, 0, 0, 0, 0.0, 0.0);
    }
}
