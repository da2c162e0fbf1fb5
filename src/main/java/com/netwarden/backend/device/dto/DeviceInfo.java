package com.netwarden.backend.device.dto;

import com.netwarden.backend.device.entity.HwidDeviceEntity;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * 上游回報的一台裝置；createdAt / updatedAt 沒給就用同步當下時間。
 */
public record DeviceInfo(
        @NotBlank @Size(max = 255) String hwid,
        @Size(max = 50) String platform,
        @Size(max = 100) String osVersion,
        @Size(max = 255) String deviceModel,
        @Size(max = 50) String appVersion,
        String userAgent,
        Instant createdAt,
        Instant updatedAt
) {
    public static DeviceInfo from(HwidDeviceEntity e) {
        return new DeviceInfo(
                e.getHwid(),
                e.getPlatform(),
                e.getOsVersion(),
                e.getDeviceModel(),
                e.getAppVersion(),
                e.getUserAgent(),
                e.getCreatedAt(),
                e.getUpdatedAt()
        );
    }
}
