package com.netwarden.backend.connection.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * 連線帳本一列：同一個 (user_uuid, ip_address) 最多只有一列 disconnected_at = null。
 */
@Getter
@Setter
@Entity
@Table(
        name = "user_connections",
        indexes = {
                @Index(name = "idx_uc_user_ip_open", columnList = "user_uuid,ip_address,disconnected_at"),
                @Index(name = "idx_uc_user_connected", columnList = "user_uuid,connected_at")
        }
)
public class UserConnectionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_uuid", length = 64, nullable = false)
    private String userUuid;

    @Column(name = "ip_address", length = 45, nullable = false)
    private String ipAddress;

    @Column(name = "node_uuid", length = 64)
    private String nodeUuid;

    @Column(name = "connected_at", nullable = false)
    private Instant connectedAt;

    @Column(name = "disconnected_at")
    private Instant disconnectedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "device_info")
    private Map<String, Object> deviceInfo;

    public boolean isOpen() {
        return disconnectedAt == null;
    }
}
