package com.netwarden.backend.geoip.repo;

import com.netwarden.backend.geoip.entity.AsnRegistryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AsnRegistryRepository extends JpaRepository<AsnRegistryEntity, Long> {

    Optional<AsnRegistryEntity> findByAsnAndActiveTrue(Long asn);

    List<AsnRegistryEntity> findByProviderTypeAndActiveTrueOrderByAsnAsc(String providerType);

    @Query("""
            select a from AsnRegistryEntity a
             where a.active = true
               and (lower(a.orgName) like lower(concat('%', :q, '%'))
                    or lower(a.orgNameEn) like lower(concat('%', :q, '%')))
             order by a.asn asc
            """)
    List<AsnRegistryEntity> searchByOrgName(@Param("q") String q, Pageable page);
}
