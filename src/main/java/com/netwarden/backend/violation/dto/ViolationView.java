package com.netwarden.backend.violation.dto;

import com.netwarden.backend.violation.entity.ViolationEntity;

import java.time.Instant;
import java.util.List;

public record ViolationView(
        Long id,
        String userUuid,
        String username,
        String email,
        Long telegramId,
        double score,
        String recommendedAction,
        Double confidence,
        double temporalScore,
        double geoScore,
        double asnScore,
        double profileScore,
        double deviceScore,
        List<String> ipAddresses,
        List<String> countries,
        List<String> cities,
        List<String> asnTypes,
        List<String> osList,
        List<String> clientList,
        List<String> reasons,
        int simultaneousConnections,
        int uniqueIpsCount,
        Integer deviceLimit,
        boolean impossibleTravel,
        boolean mobile,
        boolean datacenter,
        boolean vpn,
        Instant detectedAt,
        Instant notifiedAt,
        String actionTaken,
        Long actionTakenBy,
        Instant actionTakenAt
) {
    public static ViolationView from(ViolationEntity e) {
        return new ViolationView(
                e.getId(),
                e.getUserUuid(),
                e.getUsername(),
                e.getEmail(),
                e.getTelegramId(),
                e.getScore(),
                e.getRecommendedAction(),
                e.getConfidence(),
                e.getTemporalScore(),
                e.getGeoScore(),
                e.getAsnScore(),
                e.getProfileScore(),
                e.getDeviceScore(),
                nz(e.getIpAddresses()),
                nz(e.getCountries()),
                nz(e.getCities()),
                nz(e.getAsnTypes()),
                nz(e.getOsList()),
                nz(e.getClientList()),
                nz(e.getReasons()),
                e.getSimultaneousConnections(),
                e.getUniqueIpsCount(),
                e.getDeviceLimit(),
                e.isImpossibleTravel(),
                e.isMobile(),
                e.isDatacenter(),
                e.isVpn(),
                e.getDetectedAt(),
                e.getNotifiedAt(),
                e.getActionTaken(),
                e.getActionTakenBy(),
                e.getActionTakenAt()
        );
    }

    private static List<String> nz(List<String> v) {
        return v == null ? List.of() : v;
    }
}
