package com.example.streampanel.api.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthTokenResponse {

    private String token;
    private String tokenType;
    private Long expiresInSeconds;
    private Instant expiresAt;
    private AccountProfileResponse account;
}
