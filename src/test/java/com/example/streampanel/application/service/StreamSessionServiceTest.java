package com.example.streampanel.application.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.streampanel.api.response.PageResponse;
import com.example.streampanel.api.response.StreamSessionResponse;
import com.example.streampanel.api.response.StreamStartResponse;
import com.example.streampanel.common.config.AppLicenseProperties;
import com.example.streampanel.common.config.AppStreamProperties;
import com.example.streampanel.common.exception.BusinessException;
import com.example.streampanel.common.security.AccountPrincipal;
import com.example.streampanel.domain.AccountRole;
import com.example.streampanel.domain.model.ClientMeta;
import com.example.streampanel.infrastructure.persistence.entity.AccountEntity;
import com.example.streampanel.infrastructure.persistence.entity.ChannelEntity;
import com.example.streampanel.infrastructure.persistence.entity.LicenseEntity;
import com.example.streampanel.infrastructure.persistence.entity.StreamLogEntity;
import com.example.streampanel.infrastructure.persistence.mapper.AccountMapper;
import com.example.streampanel.infrastructure.persistence.mapper.ChannelMapper;
import com.example.streampanel.support.FakeUpstreamMediaClient;
import com.example.streampanel.support.InMemoryLicenseMapper;
import com.example.streampanel.support.InMemoryStreamLogMapper;
import com.example.streampanel.support.MeterProviders;
import com.example.streampanel.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.servlet.ServletOutputStream;
import javax.servlet.WriteListener;
import javax.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.transaction.support.TransactionOperations;

class StreamSessionServiceTest {

    private static final ClientMeta ORIGIN = new ClientMeta("10.0.0.8", "VLC/3.0");
    private static final AccountPrincipal ALICE = new AccountPrincipal(1L, "alice", AccountRole.USER, "token-a");
    private static final AccountPrincipal BOB = new AccountPrincipal(2L, "bob", AccountRole.USER, "token-b");

    private MutableClock clock;
    private AccountEntity aliceAccount;
    private AccountMapper accountMapper;
    private ChannelMapper channelMapper;
    private InMemoryStreamLogMapper streamLogMapper;
    private InMemoryLicenseMapper licenseMapper;
    private FakeUpstreamMediaClient upstream;
    private AppLicenseProperties licenseProperties;
    private SimpleMeterRegistry meterRegistry;
    private StreamSessionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

        aliceAccount = account(1L, 1);
        accountMapper = mock(AccountMapper.class);
        when(accountMapper.selectByIdForUpdate(1L)).thenReturn(aliceAccount);
        when(accountMapper.selectByIdForUpdate(2L)).thenReturn(account(2L, 1));

        ChannelEntity channel = new ChannelEntity();
        channel.setId(10L);
        channel.setName("News HD");
        channel.setStreamUrl("http://origin.example/live/news.ts");
        channel.setQuality("HD");
        channel.setStatus("active");
        channelMapper = mock(ChannelMapper.class);
        when(channelMapper.selectActiveById(10L)).thenReturn(channel);

        streamLogMapper = new InMemoryStreamLogMapper();
        licenseMapper = new InMemoryLicenseMapper();
        LicenseEntity license = new LicenseEntity();
        license.setLicenseKey("KEY-TWO");
        license.setStatus("active");
        license.setMaxConnections(2);
        license.setCurrentConnections(0);
        licenseMapper.put(license);

        upstream = new FakeUpstreamMediaClient();
        licenseProperties = new AppLicenseProperties();
        meterRegistry = new SimpleMeterRegistry();

        service = buildService(streamLogMapper);
    }

    @Test
    void singleSlotAccountShouldAdmitAgainOnlyAfterStop() {
        StreamStartResponse first = service.start(ALICE, 10L, ORIGIN, null);
        assertEquals("/api/v1/streams/10/proxy?log_id=" + first.getLogId(), first.getProxyUrl());
        assertEquals("News HD", first.getChannelName());

        BusinessException rejected = assertThrows(BusinessException.class,
                () -> service.start(ALICE, 10L, ORIGIN, null));
        assertEquals("QUOTA_EXCEEDED", rejected.getCode());
        assertEquals(429, rejected.getHttpStatus());

        service.stop(ALICE, first.getLogId());

        assertNotNull(service.start(ALICE, 10L, ORIGIN, null).getLogId());
    }

    @Test
    void quotaShouldBeIndependentPerAccount() {
        service.start(ALICE, 10L, ORIGIN, null);

        assertNotNull(service.start(BOB, 10L, ORIGIN, null).getLogId());
    }

    @Test
    void unknownChannelShouldBeRejectedBeforeAdmission() {
        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.start(ALICE, 99L, ORIGIN, null));

        assertEquals("STREAM_CHANNEL_NOT_FOUND", exception.getCode());
        assertEquals(0L, streamLogMapper.countActiveByUser(1L));
    }

    @Test
    void relayShouldCopyBodyAndHeadersThenCloseAtEnd() throws Exception {
        byte[] media = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);
        upstream.serve(media, "video/mp2t");
        upstream.setHeader("Accept-Ranges", "bytes");
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, null);
        MockHttpServletResponse response = new MockHttpServletResponse();

        service.relay(ALICE, 10L, start.getLogId(), "bytes=0-", null, response);

        assertEquals(200, response.getStatus());
        assertEquals("video/mp2t", response.getContentType());
        assertEquals("16", response.getHeader("Content-Length"));
        assertEquals("bytes", response.getHeader("Accept-Ranges"));
        assertArrayEquals(media, response.getContentAsByteArray());
        assertEquals("bytes=0-", upstream.getLastRange());
        assertEquals("Stream-Panel/1.0", upstream.getLastUserAgent());

        StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
        assertEquals("UPSTREAM_END", row.getCloseReason());
        assertEquals(16L, row.getBytesTransferred().longValue());
        assertTrue(row.getDurationSec() >= 0);
        assertEquals(0L, streamLogMapper.countActiveByUser(1L));
        assertEquals(1.0D, meterRegistry.find("stream.close").tag("reason", "UPSTREAM_END").counter().count());
    }

    @Test
    void partialContentStatusAndRangeHeadersShouldBeForwarded() {
        upstream.serve(new byte[] {1, 2, 3}, "video/mp4");
        upstream.setHeader("Content-Range", "bytes 100-102/5000");
        upstream.respondWithStatus(206);
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, null);
        MockHttpServletResponse response = new MockHttpServletResponse();

        service.relay(ALICE, 10L, start.getLogId(), "bytes=100-102", "Kodi/20", response);

        assertEquals(206, response.getStatus());
        assertEquals("bytes 100-102/5000", response.getHeader("Content-Range"));
        assertEquals("Kodi/20", upstream.getLastUserAgent());
    }

    @Test
    void unreachableUpstreamShouldCloseSessionAndFreeSlot() {
        upstream.failToConnect();
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        clock.plusSeconds(5);

        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.relay(ALICE, 10L, start.getLogId(), null, null, new MockHttpServletResponse()));

        assertEquals("UPSTREAM_UNAVAILABLE", exception.getCode());
        assertEquals(502, exception.getHttpStatus());
        StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
        assertEquals("UPSTREAM_UNAVAILABLE", row.getCloseReason());
        assertEquals(0L, row.getDurationSec().longValue());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        assertNotNull(service.start(ALICE, 10L, ORIGIN, null).getLogId());
    }

    @Test
    void upstreamErrorStatusShouldBeTreatedAsUnavailable() {
        upstream.respondWithStatus(404);
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, null);

        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.relay(ALICE, 10L, start.getLogId(), null, null, new MockHttpServletResponse()));

        assertEquals("UPSTREAM_UNAVAILABLE", exception.getCode());
        assertEquals(0L, streamLogMapper.countActiveByUser(1L));
    }

    @Test
    void clientDisconnectShouldCloseSessionWithinTheRelayCall() throws Exception {
        upstream.serve(new byte[200_000], "video/mp2t");
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        HttpServletResponse response = mock(HttpServletResponse.class);
        when(response.getOutputStream()).thenReturn(new BrokenPipeOutputStream());

        service.relay(ALICE, 10L, start.getLogId(), null, null, response);

        StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
        assertEquals("CLIENT_DISCONNECT", row.getCloseReason());
        assertNotNull(row.getEndTime());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        assertEquals(0, service.activeRelayCount());
        assertNotNull(service.start(ALICE, 10L, ORIGIN, null).getLogId());
    }

    @Test
    void stopShouldBeIdempotentAndReleaseLicenseOnce() {
        aliceAccount.setMaxConnections(2);
        StreamStartResponse first = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        assertEquals(2, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        clock.plusSeconds(42);

        StreamSessionResponse stopped = service.stop(ALICE, first.getLogId());
        StreamSessionResponse again = service.stop(ALICE, first.getLogId());

        assertEquals("CLOSED", stopped.getState());
        assertEquals("STOPPED", stopped.getCloseReason());
        assertEquals(42L, stopped.getDurationSec().longValue());
        assertEquals(stopped.getEndTime(), again.getEndTime());
        assertEquals(1, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
    }

    @Test
    void stopByAnotherAccountShouldLookLikeMissingSession() {
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, null);

        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.stop(BOB, start.getLogId()));

        assertEquals("STREAM_SESSION_NOT_FOUND", exception.getCode());
        assertEquals(1L, streamLogMapper.countActiveByUser(1L));
    }

    @Test
    void relayShouldRejectClosedForeignAndAlreadyClaimedSessions() {
        upstream.serve(new byte[] {1}, "video/mp2t");
        aliceAccount.setMaxConnections(3);
        StreamStartResponse closed = service.start(ALICE, 10L, ORIGIN, null);
        service.stop(ALICE, closed.getLogId());
        StreamStartResponse claimed = service.start(ALICE, 10L, ORIGIN, null);
        streamLogMapper.markRelaying(claimed.getLogId(), LocalDateTime.now(clock));
        StreamStartResponse other = service.start(ALICE, 10L, ORIGIN, null);

        BusinessException closedError = assertThrows(BusinessException.class,
                () -> service.relay(ALICE, 10L, closed.getLogId(), null, null, new MockHttpServletResponse()));
        BusinessException claimedError = assertThrows(BusinessException.class,
                () -> service.relay(ALICE, 10L, claimed.getLogId(), null, null, new MockHttpServletResponse()));
        BusinessException foreignError = assertThrows(BusinessException.class,
                () -> service.relay(BOB, 10L, other.getLogId(), null, null, new MockHttpServletResponse()));
        BusinessException channelError = assertThrows(BusinessException.class,
                () -> service.relay(ALICE, 11L, other.getLogId(), null, null, new MockHttpServletResponse()));

        assertEquals("STREAM_SESSION_CLOSED", closedError.getCode());
        assertEquals("STREAM_ALREADY_RELAYING", claimedError.getCode());
        assertEquals("STREAM_SESSION_NOT_FOUND", foreignError.getCode());
        assertEquals("STREAM_SESSION_NOT_FOUND", channelError.getCode());
        assertEquals(0, upstream.getOpenCount());
    }

    @Test
    void fullLicenseShouldRejectBeforeTouchingAccountQuota() {
        service.start(BOB, 10L, ORIGIN, "KEY-TWO");
        aliceAccount.setMaxConnections(5);
        service.start(ALICE, 10L, ORIGIN, "KEY-TWO");

        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.start(ALICE, 10L, ORIGIN, "KEY-TWO"));

        assertEquals("LICENSE_QUOTA_EXCEEDED", exception.getCode());
        assertEquals(1L, streamLogMapper.countActiveByUser(1L));
    }

    @Test
    void accountQuotaRejectionShouldGiveBackLicenseSlot() {
        service.start(ALICE, 10L, ORIGIN, null);

        assertThrows(BusinessException.class, () -> service.start(ALICE, 10L, ORIGIN, "KEY-TWO"));

        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
    }

    @Test
    void requiredLicenseShouldRejectStartWithoutKey() {
        licenseProperties.setRequiredForStreams(true);

        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.start(ALICE, 10L, ORIGIN, null));

        assertEquals("LICENSE_INVALID", exception.getCode());
    }

    @Test
    void unclaimedHandleShouldBeReapedAfterClaimTimeout() {
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");

        clock.plusSeconds(30);
        assertEquals(0, service.reapUnclaimed());

        clock.plusSeconds(31);
        assertEquals(1, service.reapUnclaimed());

        StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
        assertEquals("UNCLAIMED", row.getCloseReason());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        BusinessException exception = assertThrows(BusinessException.class,
                () -> service.relay(ALICE, 10L, start.getLogId(), null, null, new MockHttpServletResponse()));
        assertEquals("STREAM_SESSION_CLOSED", exception.getCode());
    }

    @Test
    void deferredCloseShouldReleaseLicenseWhenRetried() {
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        streamLogMapper.setFailWrites(true);
        service.forceStop(start.getLogId());
        assertEquals(1, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());

        streamLogMapper.setFailWrites(false);
        assertEquals(1, service.retryPendingCloses());

        assertEquals("FORCE_STOPPED", streamLogMapper.selectById(start.getLogId()).getCloseReason());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
    }

    @Test
    void stopDuringRelayShouldAbortUpstreamAndEndTheRelay() throws Exception {
        BlockingInputStream body = new BlockingInputStream();
        upstream.serveStream(body);
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> relay = executor.submit(() ->
                    service.relay(ALICE, 10L, start.getLogId(), null, null, new MockHttpServletResponse()));
            assertTrue(body.firstChunkServed.await(5, TimeUnit.SECONDS));

            StreamSessionResponse stopped = service.stop(ALICE, start.getLogId());

            relay.get(5, TimeUnit.SECONDS);
            assertEquals("STOPPED", stopped.getCloseReason());
            assertEquals(0, service.activeRelayCount());
            assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
            assertEquals("STOPPED", streamLogMapper.selectById(start.getLogId()).getCloseReason());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void listActiveShouldReportStates() {
        aliceAccount.setMaxConnections(2);
        StreamStartResponse first = service.start(ALICE, 10L, ORIGIN, null);
        service.start(ALICE, 10L, ORIGIN, null);
        streamLogMapper.markRelaying(first.getLogId(), LocalDateTime.now(clock));

        assertEquals(2, service.listActive(1L).size());
        assertEquals("RELAYING", service.listActive(1L).stream()
                .filter(s -> s.getLogId().equals(first.getLogId())).findFirst().get().getState());
    }

    @Test
    void upstreamFailureMidStreamShouldCloseAsInterruptedWithPartialUsage() {
        upstream.serveStream(new FailingAfterFirstChunkInputStream(clock, 1000, 30));
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        MockHttpServletResponse response = new MockHttpServletResponse();

        service.relay(ALICE, 10L, start.getLogId(), null, null, response);

        assertEquals(1000, response.getContentAsByteArray().length);
        StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
        assertEquals("UPSTREAM_INTERRUPTED", row.getCloseReason());
        assertEquals(1000L, row.getBytesTransferred().longValue());
        assertEquals(30L, row.getDurationSec().longValue());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        assertEquals(0, service.activeRelayCount());
    }

    @Test
    void stopRightAfterClaimShouldKeepUpstreamClosed() {
        HookedStreamLogMapper hooked = new HookedStreamLogMapper();
        StreamSessionService hookedService = buildService(hooked);
        upstream.serve(new byte[4096], "video/mp2t");
        StreamStartResponse start = hookedService.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        hooked.afterClaim(() -> hookedService.stop(ALICE, start.getLogId()));
        MockHttpServletResponse response = new MockHttpServletResponse();

        hookedService.relay(ALICE, 10L, start.getLogId(), null, null, response);

        assertEquals(0, response.getContentAsByteArray().length);
        assertEquals(0, upstream.getOpenCount());
        StreamLogEntity row = hooked.selectById(start.getLogId());
        assertEquals("STOPPED", row.getCloseReason());
        assertEquals(0L, row.getBytesTransferred().longValue());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        assertEquals(0, hookedService.activeRelayCount());
    }

    @Test
    void stopJustBeforeClaimShouldFailTheRelayAsClosed() {
        HookedStreamLogMapper hooked = new HookedStreamLogMapper();
        StreamSessionService hookedService = buildService(hooked);
        upstream.serve(new byte[4096], "video/mp2t");
        StreamStartResponse start = hookedService.start(ALICE, 10L, ORIGIN, null);
        hooked.beforeClaim(() -> hookedService.stop(ALICE, start.getLogId()));

        BusinessException exception = assertThrows(BusinessException.class, () -> hookedService.relay(
                ALICE, 10L, start.getLogId(), null, null, new MockHttpServletResponse()));

        assertEquals("STREAM_SESSION_CLOSED", exception.getCode());
        assertEquals(0, upstream.getOpenCount());
        assertEquals(0, hookedService.activeRelayCount());
        assertEquals("STOPPED", hooked.selectById(start.getLogId()).getCloseReason());
    }

    @Test
    void relayLeftOpenByDeadInstanceShouldBeReclaimed() {
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        streamLogMapper.markRelaying(start.getLogId(), LocalDateTime.now(clock));
        StreamSessionService restarted = buildService(streamLogMapper);

        clock.plusSeconds(60);
        assertEquals(0, restarted.reapOrphaned());

        clock.plusSeconds(3 * 24 * 3600);
        assertEquals(1, restarted.reapOrphaned());

        StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
        assertEquals("ORPHANED", row.getCloseReason());
        assertEquals(0L, row.getDurationSec().longValue());
        assertEquals(0, licenseMapper.selectByKey("KEY-TWO").getCurrentConnections().intValue());
        assertEquals(0, restarted.reapOrphaned());
        assertNotNull(restarted.start(ALICE, 10L, ORIGIN, "KEY-TWO").getLogId());
    }

    @Test
    void liveRelayShouldSurviveOrphanSweepsWhileHeartbeating() throws Exception {
        BlockingInputStream body = new BlockingInputStream();
        upstream.serveStream(body);
        StreamStartResponse start = service.start(ALICE, 10L, ORIGIN, "KEY-TWO");
        StreamSessionService otherInstance = buildService(streamLogMapper);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> relay = executor.submit(() ->
                    service.relay(ALICE, 10L, start.getLogId(), null, null, new MockHttpServletResponse()));
            assertTrue(body.firstChunkServed.await(5, TimeUnit.SECONDS));
            clock.plusSeconds(200);

            assertEquals(0, service.reapOrphaned());
            assertEquals(1, service.heartbeatActiveRelays());
            assertEquals(0, otherInstance.reapOrphaned());
            StreamLogEntity row = streamLogMapper.selectById(start.getLogId());
            assertNull(row.getEndTime());
            assertEquals(LocalDateTime.now(clock), row.getRelayHeartbeatAt());

            service.stop(ALICE, start.getLogId());
            relay.get(5, TimeUnit.SECONDS);
            assertEquals("STOPPED", streamLogMapper.selectById(start.getLogId()).getCloseReason());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void historyShouldPageClosedStreamsNewestFirst() {
        Long[] logIds = new Long[3];
        for (int i = 0; i < 3; i++) {
            logIds[i] = service.start(ALICE, 10L, ORIGIN, null).getLogId();
            clock.plusSeconds(10);
            service.stop(ALICE, logIds[i]);
        }
        service.start(ALICE, 10L, ORIGIN, null);

        PageResponse<StreamSessionResponse> first = service.history(1L, 1, 2);
        PageResponse<StreamSessionResponse> second = service.history(1L, 2, 2);

        assertEquals(3L, first.getTotal());
        assertEquals(2, first.getPages());
        assertEquals(logIds[2], first.getRecords().get(0).getLogId());
        assertEquals(logIds[1], first.getRecords().get(1).getLogId());
        assertEquals(1, second.getRecords().size());
        assertEquals(logIds[0], second.getRecords().get(0).getLogId());
        assertEquals("CLOSED", second.getRecords().get(0).getState());
        assertEquals(0L, service.history(2L, 1, 20).getTotal());
    }

    private StreamSessionService buildService(InMemoryStreamLogMapper logMapper) {
        UsageLedgerService ledger = new UsageLedgerService(logMapper, clock);
        QuotaGuard quotaGuard = new QuotaGuard(accountMapper, logMapper,
                TransactionOperations.withoutTransaction(), MeterProviders.of(meterRegistry));
        LicenseQuotaService licenseQuotaService = new LicenseQuotaService(licenseMapper, logMapper, clock,
                MeterProviders.of(meterRegistry));
        return new StreamSessionService(channelMapper, quotaGuard, licenseQuotaService, ledger, upstream,
                new AppStreamProperties(), licenseProperties, clock, MeterProviders.of(meterRegistry));
    }

    private AccountEntity account(Long id, int maxConnections) {
        AccountEntity account = new AccountEntity();
        account.setId(id);
        account.setStatus("active");
        account.setMaxConnections(maxConnections);
        return account;
    }

    /**
     * Runs a hook around the relay claim, standing in for a stop racing the proxy request.
     */
    private static final class HookedStreamLogMapper extends InMemoryStreamLogMapper {

        private volatile Runnable beforeClaim = () -> { };
        private volatile Runnable afterClaim = () -> { };

        void beforeClaim(Runnable hook) {
            this.beforeClaim = hook;
        }

        void afterClaim(Runnable hook) {
            this.afterClaim = hook;
        }

        @Override
        public int markRelaying(Long id, LocalDateTime now) {
            beforeClaim.run();
            int updated = super.markRelaying(id, now);
            if (updated == 1) {
                afterClaim.run();
            }
            return updated;
        }
    }

    /**
     * Serves one chunk, lets time pass, then fails like a reset upstream socket.
     */
    private static final class FailingAfterFirstChunkInputStream extends InputStream {

        private final MutableClock clock;
        private final int chunkSize;
        private final long secondsBeforeFailure;
        private boolean served;

        FailingAfterFirstChunkInputStream(MutableClock clock, int chunkSize, long secondsBeforeFailure) {
            this.clock = clock;
            this.chunkSize = chunkSize;
            this.secondsBeforeFailure = secondsBeforeFailure;
        }

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            return read(one, 0, 1) == -1 ? -1 : one[0];
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (!served) {
                served = true;
                int count = Math.min(len, chunkSize);
                for (int i = 0; i < count; i++) {
                    b[off + i] = (byte) i;
                }
                return count;
            }
            clock.plusSeconds(secondsBeforeFailure);
            throw new IOException("Connection reset");
        }
    }

    private static final class BrokenPipeOutputStream extends ServletOutputStream {

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
        }

        @Override
        public void write(int b) throws IOException {
            throw new IOException("Broken pipe");
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            throw new IOException("Broken pipe");
        }
    }

    /**
     * Serves one byte, then blocks until closed, like a live feed whose socket is aborted.
     */
    private static final class BlockingInputStream extends InputStream {

        private final CountDownLatch firstChunkServed = new CountDownLatch(1);
        private final CountDownLatch closed = new CountDownLatch(1);
        private volatile boolean served;

        @Override
        public int read() throws IOException {
            byte[] one = new byte[1];
            return read(one, 0, 1) == -1 ? -1 : one[0];
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (!served) {
                served = true;
                b[off] = 7;
                firstChunkServed.countDown();
                return 1;
            }
            try {
                closed.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new IOException("Socket closed");
        }

        @Override
        public void close() {
            closed.countDown();
        }
    }
}
