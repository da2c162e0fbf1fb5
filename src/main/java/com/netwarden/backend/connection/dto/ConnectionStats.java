package com.netwarden.backend.connection.dto;

public record ConnectionStats(
        String userUuid,
        int activeConnections,
        long simultaneousConnections,
        long uniqueIpsInWindow,
        long uniqueIps24h
) {}
