package com.example.streampanel.application.service;

import com.example.streampanel.common.config.AppAuthProperties;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.domain.AccountRole;
import com.example.streampanel.support.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccessTokenServiceTest {

    private MutableClock clock;
    private AppAuthProperties properties;
    private AccessTokenService accessTokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        properties = new AppAuthProperties();
        properties.setJwtSecret("stream-panel-unit-test-jwt-secret-0123456789");
        accessTokenService = new AccessTokenService(properties, clock);
    }

    @Test
    void shouldIssueAndVerifyToken() {
        AccessTokenService.TokenIssue issue = accessTokenService.issue(7L, "alice", AccountRole.RESELLER);

        AccessTokenService.VerifiedToken verified = accessTokenService.verify(issue.getToken());

        Assertions.assertEquals(7L, verified.getAccountId().longValue());
        Assertions.assertEquals("alice", verified.getUsername());
        Assertions.assertEquals(AccountRole.RESELLER, verified.getRole());
        Assertions.assertEquals(Instant.parse("2026-01-08T00:00:00Z"), issue.getExpiresAt());
        Assertions.assertEquals(issue.getExpiresAt(), verified.getExpiresAt());
    }

    @Test
    void shouldStillAcceptTokenJustBeforeSevenDays() {
        AccessTokenService.TokenIssue issue = accessTokenService.issue(7L, "alice", AccountRole.USER);
        clock.plusSeconds(604799);

        Assertions.assertEquals(7L, accessTokenService.verify(issue.getToken()).getAccountId().longValue());
    }

    @Test
    void shouldRejectTokenPresentedAfterSevenDays() {
        AccessTokenService.TokenIssue issue = accessTokenService.issue(7L, "alice", AccountRole.USER);
        clock.plusSeconds(604801);

        BusinessException exception = Assertions.assertThrows(
                BusinessException.class,
                () -> accessTokenService.verify(issue.getToken())
        );

        Assertions.assertEquals("AUTH_TOKEN_EXPIRED", exception.getCode());
    }

    @Test
    void shouldRejectTamperedToken() {
        String token = accessTokenService.issue(7L, "alice", AccountRole.USER).getToken();
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        BusinessException exception = Assertions.assertThrows(
                BusinessException.class,
                () -> accessTokenService.verify(tampered)
        );

        Assertions.assertEquals("AUTH_TOKEN_INVALID", exception.getCode());
    }

    @Test
    void shouldRejectTokenSignedWithAnotherSecret() {
        AppAuthProperties other = new AppAuthProperties();
        other.setJwtSecret("another-stream-panel-secret-abcdefghijklmnop");
        String foreign = new AccessTokenService(other, clock).issue(7L, "alice", AccountRole.USER).getToken();

        BusinessException exception = Assertions.assertThrows(
                BusinessException.class,
                () -> accessTokenService.verify(foreign)
        );

        Assertions.assertEquals("AUTH_TOKEN_INVALID", exception.getCode());
    }

    @Test
    void shouldRejectTokenForAnotherAudience() {
        AppAuthProperties other = new AppAuthProperties();
        other.setJwtSecret(properties.getJwtSecret());
        other.setAudience("someone-else");
        String foreign = new AccessTokenService(other, clock).issue(7L, "alice", AccountRole.USER).getToken();

        BusinessException exception = Assertions.assertThrows(
                BusinessException.class,
                () -> accessTokenService.verify(foreign)
        );

        Assertions.assertEquals("AUTH_TOKEN_INVALID", exception.getCode());
    }

    @Test
    void shouldRejectGarbageAndBlankTokens() {
        BusinessException garbage = Assertions.assertThrows(
                BusinessException.class,
                () -> accessTokenService.verify("not-a-jwt")
        );
        BusinessException blank = Assertions.assertThrows(
                BusinessException.class,
                () -> accessTokenService.verify("  ")
        );

        Assertions.assertEquals("AUTH_TOKEN_INVALID", garbage.getCode());
        Assertions.assertEquals("AUTH_MISSING_TOKEN", blank.getCode());
    }

    @Test
    void shouldIssueDistinctTokensWithinSameSecond() {
        String first = accessTokenService.issue(7L, "alice", AccountRole.USER).getToken();
        String second = accessTokenService.issue(7L, "alice", AccountRole.USER).getToken();

        Assertions.assertNotEquals(first, second);
    }
}
