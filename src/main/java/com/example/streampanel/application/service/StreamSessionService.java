package com.example.streampanel.application.service;

import com.example.streampanel.api.response.PageResponse;
import com.example.streampanel.api.response.StreamSessionResponse;
import com.example.streampanel.api.response.StreamStartResponse;
import com.example.streampanel.api.response.UsageStatsResponse;
import com.example.streampanel.common.config.AppLicenseProperties;
import com.example.streampanel.common.config.AppStreamProperties;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.exception.ErrorCode;
import com.example.streampanel.common.logging.AccessLogFilter;
import com.example.streampanel.common.security.AccountPrincipal;
import com.example.streampanel.domain.StreamCloseReason;
import com.example.streampanel.domain.StreamState;
import com.example.streampanel.domain.model.AdmissionDecision;
import com.example.streampanel.domain.model.ClientMeta;
import com.example.streampanel.infrastructure.persistence.entity.ChannelEntity;
import com.example.streampanel.infrastructure.persistence.entity.StreamLogEntity;
import com.example.streampanel.infrastructure.persistence.mapper.ChannelMapper;
import com.example.streampanel.infrastructure.upstream.UpstreamMediaClient;
import com.example.streampanel.infrastructure.upstream.UpstreamResponse;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Drives a stream through admission, relay and close.
 * <p>
 * Every way a stream can end (upstream end, upstream failure, client abort, stop, force
 * stop, unclaimed expiry) goes through {@link #closeSession}. The ledger close is
 * conditional, so exactly one caller wins and only that caller gives back the license
 * slot.
 */
@Service
public class StreamSessionService {

    private static final Logger log = LoggerFactory.getLogger(StreamSessionService.class);

    private static final int REAPER_BATCH_SIZE = 100;
    private static final int MAX_HISTORY_PAGE_SIZE = 100;

    private final ChannelMapper channelMapper;
    private final QuotaGuard quotaGuard;
    private final LicenseQuotaService licenseQuotaService;
    private final UsageLedgerService usageLedgerService;
    private final UpstreamMediaClient upstreamMediaClient;
    private final AppStreamProperties streamProperties;
    private final AppLicenseProperties licenseProperties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<Long, ActiveRelay> activeRelays = new ConcurrentHashMap<>();

    public StreamSessionService(ChannelMapper channelMapper,
                                QuotaGuard quotaGuard,
                                LicenseQuotaService licenseQuotaService,
                                UsageLedgerService usageLedgerService,
                                UpstreamMediaClient upstreamMediaClient,
                                AppStreamProperties streamProperties,
                                AppLicenseProperties licenseProperties,
                                Clock clock,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.channelMapper = channelMapper;
        this.quotaGuard = quotaGuard;
        this.licenseQuotaService = licenseQuotaService;
        this.usageLedgerService = usageLedgerService;
        this.upstreamMediaClient = upstreamMediaClient;
        this.streamProperties = streamProperties;
        this.licenseProperties = licenseProperties;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public StreamStartResponse start(AccountPrincipal principal, Long channelId, ClientMeta origin, String licenseKey) {
        ChannelEntity channel = channelId == null ? null : channelMapper.selectActiveById(channelId);
        if (channel == null) {
            throw new BusinessException(ErrorCode.STREAM_CHANNEL_NOT_FOUND, "Channel not found or inactive",
                    "Pick another channel");
        }

        String key = StringUtils.hasText(licenseKey) ? licenseKey.trim() : null;
        if (key == null && licenseProperties.isRequiredForStreams()) {
            throw new BusinessException(ErrorCode.LICENSE_INVALID, "License key is required",
                    "Provide a license key");
        }
        if (key != null) {
            AdmissionDecision licenseDecision = licenseQuotaService.acquire(key);
            if (!licenseDecision.isAdmitted()) {
                throw licenseQuotaService.toException(licenseDecision);
            }
        }

        AtomicReference<StreamLogEntity> started = new AtomicReference<>();
        AdmissionDecision decision;
        try {
            decision = quotaGuard.admit(principal.getAccountId(), () -> started.set(
                    usageLedgerService.recordStart(principal.getAccountId(), channel.getId(), channel.getStreamUrl(),
                            origin == null ? null : origin.getIpAddress(),
                            origin == null ? null : origin.getUserAgent(),
                            key)));
        } catch (RuntimeException e) {
            releaseLicenseQuietly(key);
            throw e;
        }
        if (!decision.isAdmitted()) {
            releaseLicenseQuietly(key);
            throw new BusinessException(ErrorCode.QUOTA_EXCEEDED,
                    "Maximum concurrent connections reached (" + decision.getActiveCount() + "/"
                            + decision.getLimit() + ")",
                    "Stop another stream and try again");
        }

        StreamLogEntity row = started.get();
        log.info("STREAM_ADMITTED logId={} accountId={} channelId={} licensed={} traceId={}",
                row.getId(), principal.getAccountId(), channel.getId(), key != null, currentTraceId());
        return new StreamStartResponse(row.getId(), buildProxyUrl(channel.getId(), row.getId()), channel.getId(),
                channel.getName(), channel.getQuality(), streamProperties.getClaimTimeoutSeconds());
    }

    /**
     * Relays the upstream media for an admitted stream onto {@code response}. Blocks the
     * calling thread until the stream ends. Errors are thrown only while nothing has been
     * written to the client; after that the stream is closed and the method returns.
     */
    public void relay(AccountPrincipal principal,
                      Long channelId,
                      Long logId,
                      String rangeHeader,
                      String userAgent,
                      HttpServletResponse response) {
        StreamLogEntity row = requireOwnedSession(principal, logId);
        if (channelId != null && !channelId.equals(row.getChannelId())) {
            throw sessionNotFound();
        }
        assertClaimable(row);

        // Must be visible to stop() before the row is claimed.
        ActiveRelay relay = new ActiveRelay();
        if (activeRelays.putIfAbsent(logId, relay) != null) {
            throw alreadyRelaying();
        }
        boolean claimed = false;
        try {
            claimed = usageLedgerService.markRelaying(logId);
        } finally {
            if (!claimed) {
                activeRelays.remove(logId, relay);
            }
        }
        if (!claimed) {
            StreamLogEntity current = usageLedgerService.find(logId);
            if (current == null) {
                throw sessionNotFound();
            }
            assertClaimable(current);
            throw alreadyRelaying();
        }

        long startedAtNanos = System.nanoTime();
        String effectiveUserAgent = StringUtils.hasText(userAgent) ? userAgent : streamProperties.getDefaultUserAgent();
        log.info("STREAM_RELAY_START logId={} channelId={} range={} upstream={} traceId={}",
                logId, row.getChannelId(), StringUtils.hasText(rangeHeader) ? rangeHeader : "none",
                summarizeUrl(row.getStreamUrl()), currentTraceId());

        UpstreamResponse upstream = null;
        StreamCloseReason reason = StreamCloseReason.UPSTREAM_END;
        try {
            if (relay.isCancelled()) {
                log.info("STREAM_RELAY_CANCELLED_BEFORE_START logId={} traceId={}", logId, currentTraceId());
                return;
            }
            try {
                upstream = upstreamMediaClient.open(row.getStreamUrl(), rangeHeader, effectiveUserAgent);
            } catch (IOException e) {
                log.warn("STREAM_UPSTREAM_UNAVAILABLE logId={} message={} traceId={}",
                        logId, e.getMessage(), currentTraceId());
                reason = StreamCloseReason.UPSTREAM_UNAVAILABLE;
                throw upstreamUnavailable();
            }
            if (!relay.attach(upstream)) {
                log.info("STREAM_RELAY_CANCELLED_BEFORE_START logId={} traceId={}", logId, currentTraceId());
                return;
            }
            StreamLogEntity claimedRow = usageLedgerService.find(logId);
            if (claimedRow == null || claimedRow.getEndTime() != null) {
                log.info("STREAM_RELAY_CLOSED_ELSEWHERE logId={} traceId={}", logId, currentTraceId());
                relay.cancel();
                return;
            }
            int status = upstream.getStatus();
            if (status >= 400) {
                log.warn("STREAM_UPSTREAM_UNAVAILABLE logId={} status={} traceId={}", logId, status, currentTraceId());
                reason = StreamCloseReason.UPSTREAM_UNAVAILABLE;
                throw upstreamUnavailable();
            }

            response.setStatus(status);
            String contentType = upstream.getHeader("Content-Type");
            response.setContentType(StringUtils.hasText(contentType) ? contentType : "application/octet-stream");
            copyHeaderIfPresent(upstream, response, "Content-Length");
            copyHeaderIfPresent(upstream, response, "Content-Range");
            copyHeaderIfPresent(upstream, response, "Accept-Ranges");
            response.setHeader("Cache-Control", "no-store");

            reason = pump(logId, upstream, response, relay);
        } finally {
            activeRelays.remove(logId, relay);
            if (upstream != null) {
                upstream.close();
            }
            if (!relay.isCancelled()) {
                closeSession(logId, reason, relay.getBytes());
            }
            recordDuration("stream.relay.duration", System.nanoTime() - startedAtNanos);
        }
    }

    private StreamCloseReason pump(Long logId, UpstreamResponse upstream, HttpServletResponse response,
                                   ActiveRelay relay) {
        byte[] buffer = new byte[Math.max(1024, streamProperties.getRelayBufferBytes())];
        InputStream in;
        OutputStream out;
        try {
            in = upstream.getBody();
        } catch (IOException e) {
            log.warn("STREAM_UPSTREAM_INTERRUPTED logId={} bytes=0 message={} traceId={}",
                    logId, e.getMessage(), currentTraceId());
            return StreamCloseReason.UPSTREAM_INTERRUPTED;
        }
        try {
            out = response.getOutputStream();
        } catch (IOException e) {
            log.warn("STREAM_CLIENT_DISCONNECT logId={} bytes=0 traceId={}", logId, currentTraceId());
            return StreamCloseReason.CLIENT_DISCONNECT;
        }

        while (true) {
            int len;
            try {
                len = in.read(buffer);
            } catch (IOException e) {
                if (relay.isCancelled()) {
                    log.info("STREAM_RELAY_STOPPED logId={} bytes={} traceId={}",
                            logId, relay.getBytes(), currentTraceId());
                    return StreamCloseReason.STOPPED;
                }
                log.warn("STREAM_UPSTREAM_INTERRUPTED logId={} bytes={} message={} traceId={}",
                        logId, relay.getBytes(), e.getMessage(), currentTraceId());
                return StreamCloseReason.UPSTREAM_INTERRUPTED;
            }
            if (len == -1) {
                break;
            }
            try {
                out.write(buffer, 0, len);
            } catch (IOException e) {
                logClientGone(logId, relay, e);
                return StreamCloseReason.CLIENT_DISCONNECT;
            }
            relay.addBytes(len);
        }
        try {
            out.flush();
        } catch (IOException e) {
            logClientGone(logId, relay, e);
            return StreamCloseReason.CLIENT_DISCONNECT;
        }
        log.info("STREAM_RELAY_END logId={} bytes={} traceId={}", logId, relay.getBytes(), currentTraceId());
        return StreamCloseReason.UPSTREAM_END;
    }

    /**
     * Owner stop. Stopping a closed stream is a no-op success.
     */
    public StreamSessionResponse stop(AccountPrincipal principal, Long logId) {
        StreamLogEntity row = requireOwnedSession(principal, logId);
        if (row.getEndTime() != null) {
            return toResponse(row);
        }
        terminate(logId, StreamCloseReason.STOPPED);
        return toResponse(usageLedgerService.find(logId));
    }

    public StreamSessionResponse forceStop(Long logId) {
        StreamLogEntity row = usageLedgerService.find(logId);
        if (row == null) {
            throw sessionNotFound();
        }
        if (row.getEndTime() == null) {
            terminate(logId, StreamCloseReason.FORCE_STOPPED);
            log.info("STREAM_FORCE_STOPPED logId={} accountId={} traceId={}", logId, row.getUserId(), currentTraceId());
        }
        return toResponse(usageLedgerService.find(logId));
    }

    public List<StreamSessionResponse> listActive(Long accountId) {
        List<StreamSessionResponse> result = new ArrayList<>();
        for (StreamLogEntity row : usageLedgerService.listActive(accountId)) {
            result.add(toResponse(row));
        }
        return result;
    }

    public UsageStatsResponse stats(Long accountId, String period) {
        return usageLedgerService.stats(accountId, period);
    }

    /**
     * Closes admitted streams whose play handle was never claimed within the claim
     * window.
     *
     * @return number of streams closed
     */
    public int reapUnclaimed() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusSeconds(streamProperties.getClaimTimeoutSeconds());
        int closed = 0;
        for (StreamLogEntity row : usageLedgerService.findUnclaimed(cutoff, REAPER_BATCH_SIZE)) {
            UsageLedgerService.CloseResult result = usageLedgerService.closeIfUnclaimed(row.getId());
            if (result.isWon()) {
                onClosed(result.getRecord(), StreamCloseReason.UNCLAIMED);
                closed++;
            }
        }
        return closed;
    }

    /**
     * Refreshes the liveness mark of every relay running in this process.
     *
     * @return number of rows refreshed
     */
    public int heartbeatActiveRelays() {
        int touched = 0;
        for (Map.Entry<Long, ActiveRelay> entry : activeRelays.entrySet()) {
            try {
                if (usageLedgerService.heartbeat(entry.getKey(), entry.getValue().getBytes())) {
                    touched++;
                }
            } catch (DataAccessException e) {
                log.warn("STREAM_HEARTBEAT_FAILED logId={} message={}", entry.getKey(), e.getMessage());
            }
        }
        return touched;
    }

    /**
     * Closes claimed streams whose relay stopped reporting, typically after the instance
     * relaying them crashed or restarted. Relays owned by this process are left alone.
     *
     * @return number of streams closed
     */
    public int reapOrphaned() {
        LocalDateTime staleBefore = LocalDateTime.now(clock).minusSeconds(streamProperties.getRelayStaleSeconds());
        int closed = 0;
        for (StreamLogEntity row : usageLedgerService.findOrphaned(staleBefore, REAPER_BATCH_SIZE)) {
            if (activeRelays.containsKey(row.getId())) {
                continue;
            }
            UsageLedgerService.CloseResult result = usageLedgerService.closeIfOrphaned(row.getId(), staleBefore);
            if (result.isWon()) {
                log.warn("STREAM_ORPHAN_CLOSED logId={} accountId={} lastSeen={}", row.getId(), row.getUserId(),
                        row.getRelayHeartbeatAt() != null ? row.getRelayHeartbeatAt() : row.getRelayStartedAt());
                onClosed(result.getRecord(), StreamCloseReason.ORPHANED);
                closed++;
            }
        }
        return closed;
    }

    /**
     * Closed streams of one account, newest first.
     */
    public PageResponse<StreamSessionResponse> history(Long accountId, int pageNo, int pageSize) {
        int safePageNo = Math.max(1, pageNo);
        int safePageSize = Math.max(1, Math.min(MAX_HISTORY_PAGE_SIZE, pageSize));
        long total = usageLedgerService.countHistory(accountId);
        List<StreamSessionResponse> records = new ArrayList<>();
        if (total > 0) {
            for (StreamLogEntity row : usageLedgerService.history(accountId, (safePageNo - 1) * safePageSize,
                    safePageSize)) {
                records.add(toResponse(row));
            }
        }
        int pages = (int) ((total + safePageSize - 1) / safePageSize);
        return new PageResponse<>(records, total, safePageNo, safePageSize, pages);
    }

    /**
     * Replays ledger closes that failed earlier and releases their license slots.
     *
     * @return number of streams closed by the retry
     */
    public int retryPendingCloses() {
        List<StreamLogEntity> closed = usageLedgerService.retryPendingCloses();
        for (StreamLogEntity row : closed) {
            onClosed(row, StreamCloseReason.valueOf(row.getCloseReason()));
        }
        return closed.size();
    }

    /**
     * Single close path. Returns true for the caller that actually closed the stream.
     */
    boolean closeSession(Long logId, StreamCloseReason reason, long bytesTransferred) {
        UsageLedgerService.CloseResult result = usageLedgerService.close(logId, reason, bytesTransferred);
        if (!result.isWon()) {
            log.debug("STREAM_CLOSE_NOOP logId={} reason={} outcome={}", logId, reason, result.getOutcome());
            return false;
        }
        onClosed(result.getRecord(), reason);
        return true;
    }

    int activeRelayCount() {
        return activeRelays.size();
    }

    private void terminate(Long logId, StreamCloseReason reason) {
        ActiveRelay relay = activeRelays.get(logId);
        long bytes = 0L;
        if (relay != null) {
            relay.cancel();
            bytes = relay.getBytes();
        }
        closeSession(logId, reason, bytes);
    }

    private void onClosed(StreamLogEntity row, StreamCloseReason reason) {
        if (StringUtils.hasText(row.getLicenseKey())) {
            releaseLicenseQuietly(row.getLicenseKey());
        }
        recordCounter("stream.close", "reason", reason.name());
        log.info("STREAM_CLOSED logId={} accountId={} reason={} durationSec={} bytes={} traceId={}",
                row.getId(), row.getUserId(), reason, row.getDurationSec(), row.getBytesTransferred(),
                currentTraceId());
    }

    private void releaseLicenseQuietly(String licenseKey) {
        if (licenseKey == null) {
            return;
        }
        try {
            licenseQuotaService.release(licenseKey);
        } catch (RuntimeException e) {
            log.error("LICENSE_RELEASE_FAILED traceId={}", currentTraceId(), e);
        }
    }

    private StreamLogEntity requireOwnedSession(AccountPrincipal principal, Long logId) {
        StreamLogEntity row = usageLedgerService.find(logId);
        if (row == null || !principal.getAccountId().equals(row.getUserId())) {
            throw sessionNotFound();
        }
        return row;
    }

    private void assertClaimable(StreamLogEntity row) {
        if (row.getEndTime() != null) {
            throw new BusinessException(ErrorCode.STREAM_SESSION_CLOSED, "Stream session already closed",
                    "Request a new play handle");
        }
        if (row.getRelayStartedAt() != null) {
            throw alreadyRelaying();
        }
    }

    private StreamSessionResponse toResponse(StreamLogEntity row) {
        StreamState state;
        if (row.getEndTime() != null) {
            state = StreamState.CLOSED;
        } else if (row.getRelayStartedAt() != null) {
            state = StreamState.RELAYING;
        } else {
            state = StreamState.ADMITTED;
        }
        return new StreamSessionResponse(row.getId(), row.getChannelId(), state.name(), row.getStartTime(),
                row.getRelayStartedAt(), row.getEndTime(), row.getDurationSec(), row.getBytesTransferred(),
                row.getCloseReason());
    }

    private String buildProxyUrl(Long channelId, Long logId) {
        String prefix = streamProperties.getProxyPathPrefix();
        if (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix + "/" + channelId + "/proxy?log_id=" + logId;
    }

    private void copyHeaderIfPresent(UpstreamResponse source, HttpServletResponse target, String headerName) {
        String value = source.getHeader(headerName);
        if (value != null) {
            target.setHeader(headerName, value);
        }
    }

    private void logClientGone(Long logId, ActiveRelay relay, IOException e) {
        if (isClientAbort(e)) {
            log.info("STREAM_CLIENT_DISCONNECT logId={} bytes={} traceId={}", logId, relay.getBytes(), currentTraceId());
        } else {
            log.warn("STREAM_CLIENT_WRITE_FAILED logId={} bytes={} message={} traceId={}",
                    logId, relay.getBytes(), e.getMessage(), currentTraceId());
        }
    }

    private boolean isClientAbort(Throwable throwable) {
        String[] signals = {"clientabortexception", "broken pipe", "connection reset by peer", "stream is closed"};
        Throwable current = throwable;
        while (current != null) {
            String className = current.getClass().getName().toLowerCase(Locale.ROOT);
            String message = current.getMessage() == null ? "" : current.getMessage().toLowerCase(Locale.ROOT);
            for (String signal : signals) {
                if (className.contains(signal) || message.contains(signal)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private BusinessException sessionNotFound() {
        return new BusinessException(ErrorCode.STREAM_SESSION_NOT_FOUND, "Stream session not found",
                "Request a new play handle");
    }

    private BusinessException alreadyRelaying() {
        return new BusinessException(ErrorCode.STREAM_ALREADY_RELAYING, "Stream session is already being relayed",
                "Request a new play handle");
    }

    private BusinessException upstreamUnavailable() {
        return new BusinessException(ErrorCode.UPSTREAM_UNAVAILABLE, "Stream source unavailable",
                "Try again later or pick another channel");
    }

    private String summarizeUrl(String url) {
        if (!StringUtils.hasText(url)) {
            return "empty";
        }
        try {
            URI uri = new URI(url.trim());
            String host = StringUtils.hasText(uri.getHost()) ? uri.getHost() : "unknown";
            return "host=" + host + ",pathHash=" + Integer.toHexString(String.valueOf(uri.getPath()).hashCode());
        } catch (Exception ignored) {
            return "hash=" + Integer.toHexString(url.hashCode());
        }
    }

    private String currentTraceId() {
        String traceId = MDC.get(AccessLogFilter.MDC_REQUEST_ID);
        return StringUtils.hasText(traceId) ? traceId : "unknown";
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Stream metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Stream metric timer failed, name={}", name, ex);
        }
    }

    /**
     * In-process handle on a running relay so a stop from another thread can abort the
     * upstream read.
     */
    private static final class ActiveRelay {

        private final AtomicLong bytes = new AtomicLong();
        private volatile boolean cancelled;
        private UpstreamResponse upstream;

        synchronized boolean attach(UpstreamResponse response) {
            if (cancelled) {
                return false;
            }
            this.upstream = response;
            return true;
        }

        void cancel() {
            UpstreamResponse current;
            synchronized (this) {
                cancelled = true;
                current = upstream;
            }
            if (current != null) {
                current.abort();
            }
        }

        boolean isCancelled() {
            return cancelled;
        }

        void addBytes(long count) {
            bytes.addAndGet(count);
        }

        long getBytes() {
            return bytes.get();
        }
    }
}
