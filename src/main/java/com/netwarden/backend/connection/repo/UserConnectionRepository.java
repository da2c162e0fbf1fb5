package com.netwarden.backend.connection.repo;

import com.netwarden.backend.connection.entity.UserConnectionEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface UserConnectionRepository extends JpaRepository<UserConnectionEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select c from UserConnectionEntity c
             where c.userUuid = :userUuid
               and c.ipAddress = :ipAddress
               and c.disconnectedAt is null
             order by c.connectedAt desc
            """)
    List<UserConnectionEntity> findOpenForUpdate(@Param("userUuid") String userUuid,
                                                 @Param("ipAddress") String ipAddress,
                                                 Pageable page);

    /**
     * 關掉同一個 user「其他 IP」且已經超過 grace window 的 open 連線。
     * cutoff 之後才連上的視為真的同時在線，保留。
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserConnectionEntity c
               set c.disconnectedAt = :now
             where c.userUuid = :userUuid
               and c.ipAddress <> :ipAddress
               and c.disconnectedAt is null
               and c.connectedAt < :cutoff
            """)
    int closeStaleOtherIps(@Param("userUuid") String userUuid,
                           @Param("ipAddress") String ipAddress,
                           @Param("cutoff") Instant cutoff,
                           @Param("now") Instant now);

    @Query("""
            select c from UserConnectionEntity c
             where c.userUuid = :userUuid
               and c.disconnectedAt is null
               and c.connectedAt > :since
             order by c.connectedAt desc
            """)
    List<UserConnectionEntity> findActive(@Param("userUuid") String userUuid,
                                          @Param("since") Instant since,
                                          Pageable page);

    @Query("""
            select count(distinct c.ipAddress) from UserConnectionEntity c
             where c.userUuid = :userUuid
               and c.connectedAt > :since
            """)
    long countDistinctIpsSince(@Param("userUuid") String userUuid, @Param("since") Instant since);

    long countByUserUuidAndDisconnectedAtIsNull(String userUuid);

    List<UserConnectionEntity> findByUserUuidAndConnectedAtAfterOrderByConnectedAtDesc(
            String userUuid, Instant since, Pageable page);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserConnectionEntity c
               set c.disconnectedAt = :now
             where c.id = :id
               and c.disconnectedAt is null
            """)
    int closeById(@Param("id") Long id, @Param("now") Instant now);
}
