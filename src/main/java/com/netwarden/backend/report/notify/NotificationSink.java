package com.netwarden.backend.report.notify;

/**
 * 報表送出的出口。
 */
public interface NotificationSink {

    String sinkCode();

    /**
     * 是否真的送到營運人員手上。
     * false（例如只寫 log）時報表不會被標記 sent。
     */
    boolean delivers();

    /**
     * @param html      Telegram HTML（b / i）
     * @param topicHint forum topic id；null = 不指定
     * @return 對方確認收下才回 true
     * @throws NotificationDispatchException 傳輸 / 對方拒收
     */
    boolean dispatch(String html, Long topicHint);
}
