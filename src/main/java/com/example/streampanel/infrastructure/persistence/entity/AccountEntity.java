package com.example.streampanel.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class AccountEntity {
    private Long id;
    private String username;
    private String email;
    private String passwordHash;
    private String role;
    private String status;
    private Integer maxConnections;
    private LocalDateTime expiresAt;
    private LocalDateTime lastLogin;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
