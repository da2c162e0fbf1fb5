package com.netwarden.backend.report.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

@ConfigurationProperties(prefix = "app.reports")
public class ReportProperties {

    /** 總開關 */
    private boolean enabled = true;

    private Cadence daily = new Cadence(true, "09:00");
    private Weekly weekly = new Weekly();
    private Monthly monthly = new Monthly();

    /** 只統計 score >= minScore（0..100） */
    private double minScore = 30.0;

    /** 報表 top violators 筆數（1..50） */
    private int topViolatorsCount = 10;

    /** 期間內 0 筆時還要不要發 */
    private boolean sendEmpty = false;

    /** Telegram forum topic（message_thread_id）；null = 一般訊息 */
    private Long topicId;

    /** 觸發時間用的時區；報表期間本身固定 UTC */
    private ZoneId zone = ZoneOffset.UTC;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Cadence getDaily() { return daily; }
    public void setDaily(Cadence daily) { this.daily = daily; }

    public Weekly getWeekly() { return weekly; }
    public void setWeekly(Weekly weekly) { this.weekly = weekly; }

    public Monthly getMonthly() { return monthly; }
    public void setMonthly(Monthly monthly) { this.monthly = monthly; }

    public double getMinScore() { return Math.max(0.0, Math.min(100.0, minScore)); }
    public void setMinScore(double minScore) { this.minScore = minScore; }

    public int getTopViolatorsCount() { return Math.max(1, Math.min(50, topViolatorsCount)); }
    public void setTopViolatorsCount(int topViolatorsCount) { this.topViolatorsCount = topViolatorsCount; }

    public boolean isSendEmpty() { return sendEmpty; }
    public void setSendEmpty(boolean sendEmpty) { this.sendEmpty = sendEmpty; }

    public Long getTopicId() { return topicId; }
    public void setTopicId(Long topicId) { this.topicId = topicId; }

    public ZoneId getZone() { return zone; }
    public void setZone(ZoneId zone) { this.zone = zone; }

    public static class Cadence {
        private boolean enabled;

        /** HH:mm */
        private String time;

        public Cadence() {
            this(true, "10:00");
        }

        public Cadence(boolean enabled, String time) {
            this.enabled = enabled;
            this.time = time;
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getTime() { return time; }
        public void setTime(String time) { this.time = time; }

        /** 只比到分鐘；格式錯誤直接丟 IllegalArgumentException */
        public LocalTime triggerTime() {
            try {
                return LocalTime.parse(time == null ? "" : time.trim()).withSecond(0).withNano(0);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid report time (expected HH:mm): " + time, e);
            }
        }
    }

    public static class Weekly extends Cadence {
        private DayOfWeek day = DayOfWeek.MONDAY;

        public DayOfWeek getDay() { return day; }
        public void setDay(DayOfWeek day) { this.day = day; }
    }

    public static class Monthly extends Cadence {
        /** 1..28；避免短月份跳過 */
        private int day = 1;

        public int getDay() { return Math.max(1, Math.min(28, day)); }
        public void setDay(int day) { this.day = day; }
    }
}
