package com.netwarden.backend.common.status;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncMetadataRepository extends JpaRepository<SyncMetadataEntity, String> {
}
