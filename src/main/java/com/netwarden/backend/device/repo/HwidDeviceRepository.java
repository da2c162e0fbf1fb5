package com.netwarden.backend.device.repo;

import com.netwarden.backend.device.entity.HwidDeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

public interface HwidDeviceRepository extends JpaRepository<HwidDeviceEntity, Long> {

    List<HwidDeviceEntity> findByUserUuidOrderByCreatedAtDescIdDesc(String userUuid);

    List<HwidDeviceEntity> findByUserUuid(String userUuid);

    long countByUserUuid(String userUuid);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from HwidDeviceEntity d where d.userUuid = :userUuid and d.hwid in :hwids")
    int deleteByUserUuidAndHwidIn(@Param("userUuid") String userUuid, @Param("hwids") Collection<String> hwids);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from HwidDeviceEntity d where d.userUuid = :userUuid")
    int deleteAllByUser(@Param("userUuid") String userUuid);
}
