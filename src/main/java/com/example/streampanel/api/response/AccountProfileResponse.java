package com.example.streampanel.api.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountProfileResponse {

    private Long id;
    private String username;
    private String email;
    private String role;
    private String status;
    private Integer maxConnections;
    private LocalDateTime expiresAt;
    private LocalDateTime lastLogin;
}
