package com.netwarden.backend.report.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class NotificationConfig {

    /**
     * ✅ 只有 telegram enabled=false 才用 log sink，避免 NotificationSink 兩個 Bean 注入衝突
     */
    @Bean
    @ConditionalOnProperty(prefix = "app.notifications.telegram", name = "enabled", havingValue = "false", matchIfMissing = true)
    public NotificationSink loggingNotificationSink() {
        return new LoggingNotificationSink();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.notifications.telegram", name = "enabled", havingValue = "true")
    public NotificationSink telegramNotificationSink(
            @Qualifier("telegramRestClient") RestClient telegramRestClient,
            TelegramProperties props,
            ObjectMapper om
    ) {
        // ✅ Fail-fast：啟動就抓到設定缺失
        if (props.getBotToken() == null || props.getBotToken().isBlank()) {
            throw new IllegalStateException("TELEGRAM_BOT_TOKEN_MISSING");
        }
        if (props.getChatId() == null || props.getChatId().isBlank()) {
            throw new IllegalStateException("TELEGRAM_CHAT_ID_MISSING");
        }
        return new TelegramNotificationSink(telegramRestClient, props, om);
    }
}
