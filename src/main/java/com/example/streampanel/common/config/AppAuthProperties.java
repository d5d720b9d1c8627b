package com.example.streampanel.common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.auth")
public class AppAuthProperties {

    /**
     * JWT issuer claim.
     */
    private String issuer = "stream-panel";

    /**
     * JWT audience claim.
     */
    private String audience = "stream-panel-clients";

    /**
     * HMAC secret used for JWT signature. HS256 needs at least 32 bytes.
     */
    private String jwtSecret = "changeit-stream-panel-jwt-secret-0123456789";

    /**
     * Absolute lifetime of a bearer token and of the session recorded with it.
     */
    private long tokenTtlSeconds = 604800;

    /**
     * Cookie consulted when no Authorization header is present.
     */
    private String tokenCookieName = "token";

    /**
     * Query parameter consulted when neither header nor cookie carry a token.
     */
    private String tokenQueryParam = "token";

    private String sessionSweepCron = "0 15 * * * ?";
}
