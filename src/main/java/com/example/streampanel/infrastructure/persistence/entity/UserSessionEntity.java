package com.example.streampanel.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class UserSessionEntity {

    private Long id;

    private Long userId;

    private String sessionToken;

    private String ipAddress;

    private String userAgent;

    private LocalDateTime createdAt;

    private LocalDateTime expiresAt;
}
