package com.netwarden.backend.violation.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * 外部 scorer 算完分數後送進來的一筆違規。
 */
@Builder
public record SaveViolationCommand(
        @NotBlank @Size(max = 64) String userUuid,
        @Size(max = 255) String username,
        @Size(max = 255) String email,
        Long telegramId,

        @DecimalMin("0.0") @DecimalMax("100.0") double score,
        @NotBlank @Size(max = 32) String recommendedAction,
        @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,

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

        @PositiveOrZero int simultaneousConnections,
        @PositiveOrZero int uniqueIpsCount,
        Integer deviceLimit,

        boolean impossibleTravel,
        boolean mobile,
        boolean datacenter,
        boolean vpn,

        Map<String, Object> rawBreakdown
) {}
