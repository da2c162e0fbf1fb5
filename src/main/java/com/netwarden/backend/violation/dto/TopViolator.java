package com.netwarden.backend.violation.dto;

import java.time.Instant;
import java.util.List;

public record TopViolator(
        String userUuid,
        String username,
        String email,
        Long telegramId,
        long violationsCount,
        double maxScore,
        double avgScore,
        Instant lastViolationAt,
        List<String> actions
) {
    /** 報表顯示用：username > email > uuid 前 8 碼 */
    public String displayName() {
        if (username != null && !username.isBlank()) return username;
        if (email != null && !email.isBlank()) return email;
        if (userUuid == null) return "?";
        return userUuid.length() <= 8 ? userUuid : userUuid.substring(0, 8);
    }
}
