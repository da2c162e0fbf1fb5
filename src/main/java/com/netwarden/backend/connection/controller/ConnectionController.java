package com.netwarden.backend.connection.controller;

import com.netwarden.backend.connection.dto.BatchResult;
import com.netwarden.backend.connection.dto.ConnectionEvent;
import com.netwarden.backend.connection.dto.ConnectionStats;
import com.netwarden.backend.connection.dto.ConnectionView;
import com.netwarden.backend.connection.service.ConnectionTrackerService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/connections")
public class ConnectionController {

    private final ConnectionTrackerService tracker;

    public record RecordResponse(Long connectionId) {}

    @PostMapping
    public ResponseEntity<RecordResponse> record(@Valid @RequestBody ConnectionEvent event) {
        return tracker.recordEvent(event)
                .map(id -> ResponseEntity.status(HttpStatus.CREATED).body(new RecordResponse(id)))
                // 寫不進去：回 503 讓上游之後重送
                .orElseGet(() -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new RecordResponse(null)));
    }

    @PostMapping("/batch")
    public BatchResult recordBatch(@RequestBody @NotNull @Size(max = 5000) List<ConnectionEvent> events) {
        return tracker.recordBatch(events);
    }

    @PostMapping("/{connectionId}/close")
    public ResponseEntity<Void> close(@PathVariable Long connectionId) {
        return tracker.closeConnection(connectionId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/{userUuid}/active")
    public List<ConnectionView> active(
            @PathVariable String userUuid,
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit,
            @RequestParam(defaultValue = "5") @Min(1) @Max(1440) int maxAgeMinutes
    ) {
        return tracker.getActiveConnections(userUuid, limit, Duration.ofMinutes(maxAgeMinutes));
    }

    @GetMapping("/{userUuid}/history")
    public List<ConnectionView> history(
            @PathVariable String userUuid,
            @RequestParam(defaultValue = "7") @Min(1) @Max(90) int days,
            @RequestParam(defaultValue = "1000") @Min(1) @Max(5000) int limit
    ) {
        return tracker.getConnectionHistory(userUuid, days, limit);
    }

    @GetMapping("/{userUuid}/stats")
    public ConnectionStats stats(
            @PathVariable String userUuid,
            @RequestParam(defaultValue = "60") @Min(1) @Max(1440) int windowMinutes
    ) {
        return new ConnectionStats(
                userUuid,
                tracker.getActiveConnections(userUuid).size(),
                tracker.getSimultaneousConnections(userUuid),
                tracker.getUniqueIpsInWindow(userUuid, Duration.ofMinutes(windowMinutes)),
                tracker.getUniqueIpsCount(userUuid, 24)
        );
    }
}
