package com.example.streampanel.application.service;

import com.example.streampanel.common.config.AppAuthProperties;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.domain.AccountRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Issues and verifies the signed bearer tokens handed out at login.
 * <p>
 * Verification only proves the token was minted here and has not expired. Whether the
 * session behind it is still live, and whether the account may still log in, is decided
 * by {@link AuthTokenService}.
 */
@Service
public class AccessTokenService {

    private static final String CLAIM_USERNAME = "username";
    private static final String CLAIM_ROLE = "role";

    private final AppAuthProperties properties;
    private final Clock clock;
    private final Key signingKey;
    private final JwtParser parser;

    public AccessTokenService(AppAuthProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.signingKey = Keys.hmacShaKeyFor(properties.getJwtSecret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .requireIssuer(properties.getIssuer())
                .requireAudience(properties.getAudience())
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    public TokenIssue issue(Long accountId, String username, AccountRole role) {
        if (accountId == null) {
            throw new IllegalArgumentException("accountId is required");
        }
        Instant issuedAt = Instant.ofEpochSecond(clock.instant().getEpochSecond());
        Instant expiresAt = issuedAt.plusSeconds(Math.max(1L, properties.getTokenTtlSeconds()));
        String token = Jwts.builder()
                .setSubject(String.valueOf(accountId))
                .claim(CLAIM_USERNAME, username)
                .claim(CLAIM_ROLE, role.name())
                .setIssuer(properties.getIssuer())
                .setAudience(properties.getAudience())
                .setIssuedAt(Date.from(issuedAt))
                .setExpiration(Date.from(expiresAt))
                .setId(UUID.randomUUID().toString().replace("-", ""))
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
        return new TokenIssue(token, expiresAt);
    }

    public VerifiedToken verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new BusinessException(ErrorCode.AUTH_MISSING_TOKEN, "Access denied. No token provided.", "Please log in");
        }
        Claims claims;
        try {
            claims = parser.parseClaimsJws(token.trim()).getBody();
        } catch (ExpiredJwtException e) {
            throw new BusinessException(ErrorCode.AUTH_TOKEN_EXPIRED, "Token has expired", "Please log in again");
        } catch (JwtException | IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.AUTH_TOKEN_INVALID, "Invalid token", "Please log in again");
        }

        Long accountId = parseAccountId(claims.getSubject());
        String username = claims.get(CLAIM_USERNAME, String.class);
        String role = claims.get(CLAIM_ROLE, String.class);
        if (accountId == null || !StringUtils.hasText(role) || claims.getExpiration() == null) {
            throw new BusinessException(ErrorCode.AUTH_TOKEN_INVALID, "Invalid token", "Please log in again");
        }
        return new VerifiedToken(accountId, username, AccountRole.fromStorage(role),
                claims.getExpiration().toInstant());
    }

    private Long parseAccountId(String subject) {
        if (!StringUtils.hasText(subject)) {
            return null;
        }
        try {
            return Long.valueOf(subject.trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    public static final class TokenIssue {

        private final String token;
        private final Instant expiresAt;

        TokenIssue(String token, Instant expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }

        public String getToken() {
            return token;
        }

        public Instant getExpiresAt() {
            return expiresAt;
        }
    }

    public static final class VerifiedToken {

        private final Long accountId;
        private final String username;
        private final AccountRole role;
        private final Instant expiresAt;

        public VerifiedToken(Long accountId, String username, AccountRole role, Instant expiresAt) {
            this.accountId = accountId;
            this.username = username;
            this.role = role;
            this.expiresAt = expiresAt;
        }

        public Long getAccountId() {
            return accountId;
        }

        public String getUsername() {
            return username;
        }

        public AccountRole getRole() {
            return role;
        }

        public Instant getExpiresAt() {
            return expiresAt;
        }
    }
}
