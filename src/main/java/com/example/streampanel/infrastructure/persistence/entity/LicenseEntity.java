package com.example.streampanel.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LicenseEntity {

    private Long id;

    private String licenseKey;

    private String customerName;

    private String planType;

    private String status;

    private Integer maxConnections;

    private Integer currentConnections;

    private LocalDateTime expiresAt;

    private LocalDateTime lastUsed;

    private LocalDateTime createdAt;
}
