package com.netwarden.backend.connection.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * 上游送進來的連線事件。observedAt 允許 ISO-8601 / epoch 秒 / epoch 毫秒，解析不了就當沒帶。
 */
public record ConnectionEvent(
        @NotBlank @Size(max = 64) String subscriberId,
        @NotBlank @Size(max = 45) String ip,
        @Size(max = 64) String relayId,
        Map<String, Object> deviceInfo,
        String observedAt
) {}
