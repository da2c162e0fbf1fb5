package com.netwarden.backend.common.status;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter
@Setter
@Entity
@Table(name = "sync_metadata")
public class SyncMetadataEntity {

    public enum SyncStatus { SUCCESS, FAILED, SKIPPED }

    @Id
    @Column(name = "sync_key", length = 64, nullable = false)
    private String syncKey;

    @Column(name = "last_sync_at", nullable = false)
    private Instant lastSyncAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_status", length = 16, nullable = false)
    private SyncStatus syncStatus;

    @Column(name = "records_synced", nullable = false)
    private int recordsSynced;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;
}
