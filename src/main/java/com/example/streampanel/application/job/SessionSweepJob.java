package com.example.streampanel.application.job;

import com.example.streampanel.application.service.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionSweepJob {

    private static final Logger log = LoggerFactory.getLogger(SessionSweepJob.class);

    private final SessionRegistry sessionRegistry;

    public SessionSweepJob(SessionRegistry sessionRegistry) {
        this.sessionRegistry = sessionRegistry;
    }

    @Scheduled(cron = "${app.auth.session-sweep-cron:0 15 * * * ?}")
    public void sweep() {
        try {
            int removed = sessionRegistry.sweepExpired();
            if (removed > 0) {
                log.info("Expired session sweep removed {} rows", removed);
            }
        } catch (Exception e) {
            log.error("Expired session sweep failed", e);
        }
    }
}
