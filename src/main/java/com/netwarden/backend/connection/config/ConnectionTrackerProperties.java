package com.netwarden.backend.connection.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.connections")
public class ConnectionTrackerProperties {

    /** 換 IP 後，舊 IP 的 open 連線要超過多久才自動關（預設 2 分鐘） */
    private Duration graceWindow = Duration.ofMinutes(2);

    /** 「活躍」連線的最大年齡（預設 5 分鐘） */
    private Duration activeMaxAge = Duration.ofMinutes(5);

    /** 活躍連線查詢上限 */
    private int activeLimit = 100;

    /** unique IP 視窗（預設 60 分鐘） */
    private Duration uniqueIpWindow = Duration.ofMinutes(60);

    private int historyDays = 7;

    private int historyLimit = 1000;

    public Duration getGraceWindow() { return graceWindow; }
    public void setGraceWindow(Duration graceWindow) { this.graceWindow = graceWindow; }

    public Duration getActiveMaxAge() { return activeMaxAge; }
    public void setActiveMaxAge(Duration activeMaxAge) { this.activeMaxAge = activeMaxAge; }

    public int getActiveLimit() { return activeLimit; }
    public void setActiveLimit(int activeLimit) { this.activeLimit = activeLimit; }

    public Duration getUniqueIpWindow() { return uniqueIpWindow; }
    public void setUniqueIpWindow(Duration uniqueIpWindow) { this.uniqueIpWindow = uniqueIpWindow; }

    public int getHistoryDays() { return historyDays; }
    public void setHistoryDays(int historyDays) { this.historyDays = historyDays; }

    public int getHistoryLimit() { return historyLimit; }
    public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
}
