package com.netwarden.backend.report.notify;

import lombok.extern.slf4j.Slf4j;

/** Telegram 沒開時的替身：只寫 log，沒有真的送達任何人 */
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public String sinkCode() { return "LOG"; }

    @Override
    public boolean delivers() { return false; }

    @Override
    public boolean dispatch(String html, Long topicHint) {
        log.info("report written to log sink (not delivered). topic={} chars={}\n{}",
                topicHint, html == null ? 0 : html.length(), html);
        return true;
    }
}
