package com.netwarden.backend.report.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bot API sendMessage（parse_mode = HTML）。
 * 非 2xx / ok=false / 連線錯誤 → NotificationDispatchException。
 */
@Slf4j
public class TelegramNotificationSink implements NotificationSink {

    /** Telegram 單則訊息上限 */
    static final int MAX_MESSAGE_CHARS = 4096;
    private static final int PREVIEW_LEN = 200;

    private final RestClient http;
    private final TelegramProperties props;
    private final ObjectMapper om;

    public TelegramNotificationSink(RestClient http, TelegramProperties props, ObjectMapper om) {
        this.http = http;
        this.props = props;
        this.om = om;
    }

    @Override
    public String sinkCode() { return "TELEGRAM"; }

    @Override
    public boolean delivers() { return true; }

    @Override
    public boolean dispatch(String html, Long topicHint) {
        if (html == null || html.isBlank()) throw new IllegalArgumentException("EMPTY_MESSAGE");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", props.getChatId());
        body.put("text", truncate(html));
        body.put("parse_mode", "HTML");
        body.put("disable_web_page_preview", true);
        if (topicHint != null) body.put("message_thread_id", topicHint);

        String raw;
        try {
            raw = http.post()
                    .uri("/bot{token}/sendMessage", props.getBotToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        String preview = preview(new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                        log.warn("telegram sendMessage rejected. status={} body={}", status, preview);
                        throw new NotificationDispatchException("TELEGRAM_HTTP_" + status, status);
                    })
                    .body(String.class);
        } catch (RestClientException e) {
            throw new NotificationDispatchException("TELEGRAM_TRANSPORT_ERROR", null, e);
        }

        JsonNode root;
        try {
            root = (raw == null || raw.isBlank()) ? null : om.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new NotificationDispatchException("TELEGRAM_BAD_RESPONSE", 200, e);
        }
        if (root == null || !root.path("ok").asBoolean(false)) {
            log.warn("telegram sendMessage not ok. body={}", preview(raw));
            throw new NotificationDispatchException("TELEGRAM_NOT_OK", 200);
        }

        log.info("telegram report sent. chat={} topic={} messageId={}",
                props.getChatId(), topicHint, root.path("result").path("message_id").asLong(0));
        return true;
    }

    /**
     * 超過上限時退回最後一個完整行；沒有換行才退到 tag / entity 之前，
     * 也不切開 surrogate pair，否則 Telegram 會回 400 can't parse entities。
     */
    static String truncate(String html) {
        if (html.length() <= MAX_MESSAGE_CHARS) return html;

        String head = html.substring(0, MAX_MESSAGE_CHARS);
        int nl = head.lastIndexOf('\n');
        if (nl > 0) return head.substring(0, nl);

        int cut = MAX_MESSAGE_CHARS;
        int lt = head.lastIndexOf('<');
        if (lt > head.lastIndexOf('>')) cut = lt;
        int amp = head.lastIndexOf('&', cut - 1);
        if (amp >= 0) {
            int semi = head.indexOf(';', amp);
            if (semi < 0 || semi >= cut) cut = amp;
        }
        if (cut > 0 && Character.isHighSurrogate(head.charAt(cut - 1))) cut--;
        return head.substring(0, cut);
    }

    private static String preview(String s) {
        if (s == null) return "";
        String one = s.replaceAll("[\\r\\n]+", " ");
        return one.length() <= PREVIEW_LEN ? one : one.substring(0, PREVIEW_LEN) + "...";
    }
}
