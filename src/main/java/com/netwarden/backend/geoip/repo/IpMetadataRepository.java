package com.netwarden.backend.geoip.repo;

import com.netwarden.backend.geoip.entity.IpMetadataEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IpMetadataRepository extends JpaRepository<IpMetadataEntity, String> {
}
