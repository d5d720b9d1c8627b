package com.example.streampanel.application.service;

import com.example.streampanel.api.response.AccountProfileResponse;
import com.example.streampanel.api.response.AuthTokenResponse;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.common.security.AccountPrincipal;
import com.example.streampanel.domain.AccountRole;
import com.example.streampanel.domain.AccountStatus;
import com.example.streampanel.domain.model.ClientMeta;
import com.example.streampanel.infrastructure.persistence.entity.AccountEntity;
import com.example.streampanel.infrastructure.persistence.entity.UserSessionEntity;
import com.example.streampanel.infrastructure.persistence.mapper.AccountMapper;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class AuthTokenService {

    private static final Logger log = LoggerFactory.getLogger(AuthTokenService.class);

    private static final String TOKEN_RESPONSE_TYPE = "Bearer";

    private final AccountMapper accountMapper;
    private final AccessTokenService accessTokenService;
    private final SessionRegistry sessionRegistry;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final String unknownAccountHash;

    public AuthTokenService(AccountMapper accountMapper,
                            AccessTokenService accessTokenService,
                            SessionRegistry sessionRegistry,
                            PasswordEncoder passwordEncoder,
                            Clock clock) {
        this.accountMapper = accountMapper;
        this.accessTokenService = accessTokenService;
        this.sessionRegistry = sessionRegistry;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.unknownAccountHash = passwordEncoder.encode("unknown-account-placeholder");
    }

    public AuthTokenResponse login(String login, String password, ClientMeta origin) {
        AccountEntity account = StringUtils.hasText(login) ? accountMapper.selectByLogin(login.trim()) : null;
        if (account == null) {
            // keeps response time independent of whether the login exists
            passwordEncoder.matches(password == null ? "" : password, unknownAccountHash);
            throw invalidCredentials();
        }
        if (password == null || !passwordEncoder.matches(password, account.getPasswordHash())) {
            log.warn("LOGIN_FAILED accountId={} reason=BAD_SECRET", account.getId());
            throw invalidCredentials();
        }
        assertAccountUsable(account);

        AccountRole role = AccountRole.fromStorage(account.getRole());
        AccessTokenService.TokenIssue issue = accessTokenService.issue(account.getId(), account.getUsername(), role);
        sessionRegistry.create(account.getId(), issue.getToken(), issue.getExpiresAt(), origin);

        LocalDateTime now = LocalDateTime.now(clock);
        accountMapper.updateLastLogin(account.getId(), now);
        account.setLastLogin(now);

        log.info("LOGIN_SUCCESS accountId={} role={}", account.getId(), role);
        long expiresIn = Math.max(0L, issue.getExpiresAt().getEpochSecond() - clock.instant().getEpochSecond());
        return new AuthTokenResponse(issue.getToken(), TOKEN_RESPONSE_TYPE, expiresIn, issue.getExpiresAt(),
                toProfile(account));
    }

    /**
     * Destroys the session behind {@code token}. Unknown or already destroyed tokens are
     * accepted silently so the call does not reveal token validity.
     */
    public void logout(String token) {
        if (!StringUtils.hasText(token)) {
            return;
        }
        sessionRegistry.destroy(token.trim());
    }

    /**
     * Full request authentication: signature and expiry, then a live session row owned by
     * the same account, then the account's current status and expiry.
     */
    public AccountPrincipal authenticate(String token) {
        AccessTokenService.VerifiedToken verified = accessTokenService.verify(token);
        String normalized = token.trim();

        UserSessionEntity session = sessionRegistry.find(normalized);
        if (session == null || !verified.getAccountId().equals(session.getUserId())) {
            throw new BusinessException(ErrorCode.AUTH_SESSION_INVALID,
                    "Session expired. Please login again.", "Please log in again");
        }

        AccountEntity account = accountMapper.selectById(verified.getAccountId());
        if (account == null) {
            throw new BusinessException(ErrorCode.AUTH_SESSION_INVALID,
                    "Invalid token or user not found.", "Please log in again");
        }
        assertAccountUsable(account);
        return new AccountPrincipal(account.getId(), account.getUsername(),
                AccountRole.fromStorage(account.getRole()), normalized);
    }

    public AccountProfileResponse profile(Long accountId) {
        AccountEntity account = accountMapper.selectById(accountId);
        if (account == null) {
            throw new BusinessException(ErrorCode.AUTH_SESSION_INVALID, "User not found.", "Please log in again");
        }
        return toProfile(account);
    }

    public int revokeAllSessions(Long accountId) {
        return sessionRegistry.destroyAllForAccount(accountId);
    }

    private void assertAccountUsable(AccountEntity account) {
        AccountStatus status = AccountStatus.fromStorage(account.getStatus());
        if (status != AccountStatus.ACTIVE) {
            throw new BusinessException(ErrorCode.AUTH_ACCOUNT_SUSPENDED,
                    "Account is " + status.name().toLowerCase(Locale.ROOT) + ". Please contact administrator.",
                    "Contact your administrator");
        }
        if (account.getExpiresAt() != null && account.getExpiresAt().isBefore(LocalDateTime.now(clock))) {
            throw new BusinessException(ErrorCode.AUTH_ACCOUNT_EXPIRED,
                    "Account has expired. Please contact administrator.", "Renew your subscription");
        }
    }

    private BusinessException invalidCredentials() {
        return new BusinessException(ErrorCode.AUTH_INVALID_CREDENTIALS, "Invalid credentials.",
                "Check your username and password");
    }

    private AccountProfileResponse toProfile(AccountEntity account) {
        return new AccountProfileResponse(
                account.getId(),
                account.getUsername(),
                account.getEmail(),
                AccountRole.fromStorage(account.getRole()).name(),
                AccountStatus.fromStorage(account.getStatus()).name(),
                account.getMaxConnections(),
                account.getExpiresAt(),
                account.getLastLogin()
        );
    }
}
