package com.netwarden.backend.connection.dto;

import com.netwarden.backend.connection.entity.UserConnectionEntity;

import java.time.Instant;
import java.util.Map;

public record ConnectionView(
        Long id,
        String userUuid,
        String ipAddress,
        String nodeUuid,
        Instant connectedAt,
        Instant disconnectedAt,
        Map<String, Object> deviceInfo
) {
    public static ConnectionView from(UserConnectionEntity e) {
        return new ConnectionView(
                e.getId(),
                e.getUserUuid(),
                e.getIpAddress(),
                e.getNodeUuid(),
                e.getConnectedAt(),
                e.getDisconnectedAt(),
                e.getDeviceInfo()
        );
    }
}
