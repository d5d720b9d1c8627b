package com.example.streampanel.application.job;

import com.example.streampanel.application.service.StreamSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps this instance's relays marked alive, replays ledger closes that failed earlier,
 * then closes play handles nobody claimed and relays nobody reports for. The first run
 * right after startup reclaims streams left open by a previous process.
 */
@Component
public class StreamReaperJob {

    private static final Logger log = LoggerFactory.getLogger(StreamReaperJob.class);

    private final StreamSessionService streamSessionService;

    public StreamReaperJob(StreamSessionService streamSessionService) {
        this.streamSessionService = streamSessionService;
    }

    @Scheduled(fixedDelayString = "${app.stream.reaper-interval-ms:15000}")
    public void reap() {
        try {
            streamSessionService.heartbeatActiveRelays();
            int retried = streamSessionService.retryPendingCloses();
            int unclaimed = streamSessionService.reapUnclaimed();
            int orphaned = streamSessionService.reapOrphaned();
            if (retried > 0 || unclaimed > 0 || orphaned > 0) {
                log.info("Stream reaper finished: retriedCloses={} unclaimedClosed={} orphanedClosed={}",
                        retried, unclaimed, orphaned);
            }
        } catch (Exception e) {
            log.error("Stream reaper failed", e);
        }
    }
}
