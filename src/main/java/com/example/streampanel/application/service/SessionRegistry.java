package com.example.streampanel.application.service;

import com.example.streampanel.domain.model.ClientMeta;
import com.example.streampanel.infrastructure.persistence.entity.UserSessionEntity;
import com.example.streampanel.infrastructure.persistence.mapper.UserSessionMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Server-side table of live sessions keyed by token.
 * <p>
 * A token is only honoured while its row exists and has not expired, so deleting the row
 * revokes the token immediately even though its signature and embedded expiry are still
 * valid. Lookups never extend a session.
 */
@Service
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private static final int USER_AGENT_MAX_LENGTH = 512;

    private final UserSessionMapper userSessionMapper;
    private final Clock clock;

    public SessionRegistry(UserSessionMapper userSessionMapper, Clock clock) {
        this.userSessionMapper = userSessionMapper;
        this.clock = clock;
    }

    public UserSessionEntity create(Long accountId, String token, Instant expiresAt, ClientMeta origin) {
        UserSessionEntity entity = new UserSessionEntity();
        entity.setUserId(accountId);
        entity.setSessionToken(token);
        entity.setIpAddress(origin == null ? null : origin.getIpAddress());
        entity.setUserAgent(origin == null ? null : truncate(origin.getUserAgent(), USER_AGENT_MAX_LENGTH));
        entity.setCreatedAt(LocalDateTime.now(clock));
        entity.setExpiresAt(LocalDateTime.ofInstant(expiresAt, ZoneOffset.UTC));
        userSessionMapper.insert(entity);
        log.info("SESSION_CREATED accountId={} sessionId={} expiresAt={}", accountId, entity.getId(), expiresAt);
        return entity;
    }

    /**
     * @return the live session for {@code token}, or {@code null} when it was destroyed or
     * has expired
     */
    public UserSessionEntity find(String token) {
        if (!StringUtils.hasText(token)) {
            return null;
        }
        return userSessionMapper.selectLiveByToken(token, LocalDateTime.now(clock));
    }

    public void destroy(String token) {
        if (!StringUtils.hasText(token)) {
            return;
        }
        int removed = userSessionMapper.deleteByToken(token);
        log.info("SESSION_DESTROYED removed={}", removed);
    }

    public int destroyAllForAccount(Long accountId) {
        int removed = userSessionMapper.deleteByUserId(accountId);
        log.info("SESSION_REVOKE_ALL accountId={} removed={}", accountId, removed);
        return removed;
    }

    public int sweepExpired() {
        return userSessionMapper.deleteExpired(LocalDateTime.now(clock));
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
