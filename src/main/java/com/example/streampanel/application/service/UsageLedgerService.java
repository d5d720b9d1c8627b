package com.example.streampanel.application.service;

import com.example.streampanel.api.response.UsageStatsResponse;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.domain.StreamCloseReason;
import com.example.streampanel.infrastructure.persistence.entity.StreamLogEntity;
import com.example.streampanel.infrastructure.persistence.mapper.StreamLogMapper;
import com.example.streampanel.infrastructure.persistence.model.UsageStatsRow;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Durable record of every stream: one row per admitted stream, opened at admission and
 * closed exactly once.
 * <p>
 * A close that cannot be written is parked in memory with its original end time and
 * retried by {@link #retryPendingCloses()}; callers on the relay path never see the
 * failure.
 */
@Service
public class UsageLedgerService {

    private static final Logger log = LoggerFactory.getLogger(UsageLedgerService.class);

    private static final int USER_AGENT_MAX_LENGTH = 512;

    private final StreamLogMapper streamLogMapper;
    private final Clock clock;
    private final Map<Long, PendingClose> pendingCloses = new ConcurrentHashMap<>();

    public UsageLedgerService(StreamLogMapper streamLogMapper, Clock clock) {
        this.streamLogMapper = streamLogMapper;
        this.clock = clock;
    }

    /**
     * Writes the start row. Failure is fatal to the start: a stream is never admitted
     * without its ledger row.
     */
    public StreamLogEntity recordStart(Long accountId,
                                       Long channelId,
                                       String streamUrl,
                                       String ipAddress,
                                       String userAgent,
                                       String licenseKey) {
        StreamLogEntity entity = new StreamLogEntity();
        entity.setUserId(accountId);
        entity.setChannelId(channelId);
        entity.setStreamUrl(streamUrl);
        entity.setIpAddress(ipAddress);
        entity.setUserAgent(truncate(userAgent));
        entity.setLicenseKey(StringUtils.hasText(licenseKey) ? licenseKey.trim() : null);
        entity.setStartTime(LocalDateTime.now(clock));
        entity.setBytesTransferred(0L);
        try {
            streamLogMapper.insert(entity);
        } catch (DataAccessException e) {
            log.error("USAGE_LEDGER_START_FAILED accountId={} channelId={}", accountId, channelId, e);
            throw new BusinessException(ErrorCode.USAGE_LEDGER_UNAVAILABLE, "Usage ledger unavailable",
                    "Please try again later");
        }
        log.info("USAGE_LEDGER_START logId={} accountId={} channelId={}", entity.getId(), accountId, channelId);
        return entity;
    }

    public StreamLogEntity find(Long logId) {
        return logId == null ? null : streamLogMapper.selectById(logId);
    }

    /**
     * Marks the row as relaying. Returns false when it is closed or already claimed.
     */
    public boolean markRelaying(Long logId) {
        return streamLogMapper.markRelaying(logId, LocalDateTime.now(clock)) == 1;
    }

    /**
     * Closes the row if it is still open. The outcome tells the caller whether it won the
     * close; only the winner may release resources tied to the stream.
     */
    public CloseResult close(Long logId, StreamCloseReason reason, long bytesTransferred) {
        LocalDateTime endTime = LocalDateTime.now(clock);
        try {
            return closeAt(logId, endTime, reason, bytesTransferred);
        } catch (DataAccessException e) {
            log.error("USAGE_LEDGER_CLOSE_DEFERRED logId={} reason={} bytes={}", logId, reason, bytesTransferred, e);
            pendingCloses.put(logId, new PendingClose(endTime, reason, bytesTransferred));
            return CloseResult.deferred();
        }
    }

    /**
     * Retries parked closes. Returns the rows this call closed so the caller can release
     * what the original close would have released.
     */
    public List<StreamLogEntity> retryPendingCloses() {
        List<StreamLogEntity> closed = new ArrayList<>();
        for (Map.Entry<Long, PendingClose> entry : pendingCloses.entrySet()) {
            Long logId = entry.getKey();
            PendingClose pending = entry.getValue();
            try {
                CloseResult result = closeAt(logId, pending.endTime, pending.reason, pending.bytesTransferred);
                pendingCloses.remove(logId, pending);
                if (result.getOutcome() == CloseOutcome.CLOSED) {
                    closed.add(result.getRecord());
                }
                log.info("USAGE_LEDGER_CLOSE_RETRIED logId={} outcome={}", logId, result.getOutcome());
            } catch (DataAccessException e) {
                log.warn("USAGE_LEDGER_CLOSE_RETRY_FAILED logId={} message={}", logId, e.getMessage());
            }
        }
        return closed;
    }

    /**
     * Closes the row as {@link StreamCloseReason#UNCLAIMED} only if no relay has claimed it.
     */
    public CloseResult closeIfUnclaimed(Long logId) {
        StreamLogEntity row = streamLogMapper.selectById(logId);
        if (row == null) {
            return CloseResult.notFound();
        }
        if (row.getEndTime() != null) {
            return CloseResult.alreadyClosed(row);
        }
        if (row.getRelayStartedAt() != null) {
            return CloseResult.skipped(row);
        }
        LocalDateTime endTime = LocalDateTime.now(clock);
        long durationSec = Math.max(0L, Duration.between(row.getStartTime(), endTime).getSeconds());
        int updated = streamLogMapper.closeUnclaimed(logId, endTime, durationSec, StreamCloseReason.UNCLAIMED.name());
        if (updated != 1) {
            return CloseResult.skipped(row);
        }
        row.setEndTime(endTime);
        row.setDurationSec(durationSec);
        row.setBytesTransferred(0L);
        row.setCloseReason(StreamCloseReason.UNCLAIMED.name());
        log.info("USAGE_LEDGER_CLOSE logId={} reason={} durationSec={} bytes=0", logId,
                StreamCloseReason.UNCLAIMED, durationSec);
        return CloseResult.closed(row);
    }

    /**
     * Records that the relay for {@code logId} is still alive in this process.
     */
    public boolean heartbeat(Long logId, long bytesTransferred) {
        return streamLogMapper.touchRelay(logId, LocalDateTime.now(clock), Math.max(0L, bytesTransferred)) == 1;
    }

    public List<StreamLogEntity> findOrphaned(LocalDateTime staleBefore, int limit) {
        return streamLogMapper.selectOrphaned(staleBefore, limit);
    }

    /**
     * Closes a claimed row as {@link StreamCloseReason#ORPHANED} if its relay is still
     * stale. Duration runs to the last time the relay was seen.
     */
    public CloseResult closeIfOrphaned(Long logId, LocalDateTime staleBefore) {
        StreamLogEntity row = streamLogMapper.selectById(logId);
        if (row == null) {
            return CloseResult.notFound();
        }
        if (row.getEndTime() != null) {
            return CloseResult.alreadyClosed(row);
        }
        LocalDateTime lastSeen = row.getRelayHeartbeatAt() != null ? row.getRelayHeartbeatAt() : row.getRelayStartedAt();
        if (lastSeen == null) {
            return CloseResult.skipped(row);
        }
        long durationSec = Math.max(0L, Duration.between(row.getStartTime(), lastSeen).getSeconds());
        LocalDateTime endTime = LocalDateTime.now(clock);
        int updated = streamLogMapper.closeOrphaned(logId, endTime, durationSec, StreamCloseReason.ORPHANED.name(),
                staleBefore);
        if (updated != 1) {
            return CloseResult.skipped(row);
        }
        row.setEndTime(endTime);
        row.setDurationSec(durationSec);
        row.setCloseReason(StreamCloseReason.ORPHANED.name());
        log.info("USAGE_LEDGER_CLOSE logId={} reason={} durationSec={} bytes={}", logId,
                StreamCloseReason.ORPHANED, durationSec, row.getBytesTransferred());
        return CloseResult.closed(row);
    }

    public List<StreamLogEntity> history(Long accountId, int offset, int limit) {
        return streamLogMapper.selectHistoryByUser(accountId, limit, offset);
    }

    public long countHistory(Long accountId) {
        return streamLogMapper.countHistoryByUser(accountId);
    }

    public int pendingCloseCount() {
        return pendingCloses.size();
    }

    public List<StreamLogEntity> listActive(Long accountId) {
        return streamLogMapper.selectActiveByUser(accountId);
    }

    public List<StreamLogEntity> findUnclaimed(LocalDateTime issuedBefore, int limit) {
        return streamLogMapper.selectUnclaimed(issuedBefore, limit);
    }

    public UsageStatsResponse stats(Long accountId, String period) {
        String normalized = normalizePeriod(period);
        LocalDateTime since = LocalDateTime.now(clock).minus(periodLength(normalized));
        UsageStatsRow row = streamLogMapper.selectUsageStats(accountId, since);
        if (row == null) {
            return new UsageStatsResponse(normalized, 0L, 0L, 0.0, 0L, 0L);
        }
        return new UsageStatsResponse(normalized,
                nullToZero(row.getTotalStreams()),
                nullToZero(row.getTotalDurationSec()),
                row.getAvgDurationSec() == null ? 0.0 : row.getAvgDurationSec(),
                nullToZero(row.getUniqueChannels()),
                nullToZero(row.getTotalBytes()));
    }

    private CloseResult closeAt(Long logId, LocalDateTime endTime, StreamCloseReason reason, long bytesTransferred) {
        StreamLogEntity row = streamLogMapper.selectById(logId);
        if (row == null) {
            return CloseResult.notFound();
        }
        if (row.getEndTime() != null) {
            return CloseResult.alreadyClosed(row);
        }
        long durationSec = reason == StreamCloseReason.UPSTREAM_UNAVAILABLE
                ? 0L
                : Math.max(0L, Duration.between(row.getStartTime(), endTime).getSeconds());
        long bytes = Math.max(0L, bytesTransferred);
        int updated = streamLogMapper.close(logId, endTime, durationSec, bytes, reason.name());
        if (updated != 1) {
            return CloseResult.alreadyClosed(row);
        }
        row.setEndTime(endTime);
        row.setDurationSec(durationSec);
        row.setBytesTransferred(bytes);
        row.setCloseReason(reason.name());
        log.info("USAGE_LEDGER_CLOSE logId={} reason={} durationSec={} bytes={}", logId, reason, durationSec, bytes);
        return CloseResult.closed(row);
    }

    static String normalizePeriod(String period) {
        if (!StringUtils.hasText(period)) {
            return "7d";
        }
        String value = period.trim().toLowerCase(Locale.ROOT);
        if ("24h".equals(value) || "30d".equals(value)) {
            return value;
        }
        return "7d";
    }

    private Duration periodLength(String period) {
        if ("24h".equals(period)) {
            return Duration.ofHours(24);
        }
        if ("30d".equals(period)) {
            return Duration.ofDays(30);
        }
        return Duration.ofDays(7);
    }

    private long nullToZero(Long value) {
        return value == null ? 0L : value;
    }

    private String truncate(String value) {
        if (value == null || value.length() <= USER_AGENT_MAX_LENGTH) {
            return value;
        }
        return value.substring(0, USER_AGENT_MAX_LENGTH);
    }

    public enum CloseOutcome {
        CLOSED,
        ALREADY_CLOSED,
        NOT_FOUND,
        /** The row was claimed by a relay, so an unclaimed-only close left it alone. */
        SKIPPED,
        DEFERRED
    }

    public static final class CloseResult {

        private final CloseOutcome outcome;
        private final StreamLogEntity record;

        private CloseResult(CloseOutcome outcome, StreamLogEntity record) {
            this.outcome = outcome;
            this.record = record;
        }

        static CloseResult closed(StreamLogEntity record) {
            return new CloseResult(CloseOutcome.CLOSED, record);
        }

        static CloseResult alreadyClosed(StreamLogEntity record) {
            return new CloseResult(CloseOutcome.ALREADY_CLOSED, record);
        }

        static CloseResult notFound() {
            return new CloseResult(CloseOutcome.NOT_FOUND, null);
        }

        static CloseResult skipped(StreamLogEntity record) {
            return new CloseResult(CloseOutcome.SKIPPED, record);
        }

        static CloseResult deferred() {
            return new CloseResult(CloseOutcome.DEFERRED, null);
        }

        public CloseOutcome getOutcome() {
            return outcome;
        }

        public StreamLogEntity getRecord() {
            return record;
        }

        public boolean isWon() {
            return outcome == CloseOutcome.CLOSED;
        }
    }

    private static final class PendingClose {

        private final LocalDateTime endTime;
        private final StreamCloseReason reason;
        private final long bytesTransferred;

        private PendingClose(LocalDateTime endTime, StreamCloseReason reason, long bytesTransferred) {
            this.endTime = endTime;
            this.reason = reason;
            this.bytesTransferred = bytesTransferred;
        }
    }
}
