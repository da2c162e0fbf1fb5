package com.netwarden.backend.device.controller;

import com.netwarden.backend.device.dto.DeviceInfo;
import com.netwarden.backend.device.service.DeviceRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/devices")
public class DeviceController {

    private final DeviceRegistryService devices;

    public record DeviceList(String userUuid, long count, List<DeviceInfo> devices) {}

    public record SyncResponse(int synced) {}

    public record DeleteResponse(int deleted) {}

    @GetMapping("/{userUuid}")
    public DeviceList list(@PathVariable String userUuid) {
        List<DeviceInfo> list = devices.getUserDevices(userUuid);
        return new DeviceList(userUuid, list.size(), list);
    }

    @GetMapping("/{userUuid}/count")
    public long count(@PathVariable String userUuid) {
        return devices.getUserDevicesCount(userUuid);
    }

    /** 整批覆蓋：body 沒有的 hwid 會被刪掉 */
    @PutMapping("/{userUuid}")
    public SyncResponse sync(@PathVariable String userUuid, @RequestBody List<@Valid DeviceInfo> body) {
        return new SyncResponse(devices.syncUserDevices(userUuid, body));
    }

    @DeleteMapping("/{userUuid}")
    public DeleteResponse deleteAll(@PathVariable String userUuid) {
        return new DeleteResponse(devices.deleteAllUserDevices(userUuid));
    }
}
