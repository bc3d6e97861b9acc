package com.ideabridge.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SessionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(SessionSweepScheduler.class);

    private final SessionStore sessionStore;

    public SessionSweepScheduler(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(cron = "${auth.session.sweep-cron:0 0 * * * *}")
    public void sweepExpiredSessions() {
        int removed = sessionStore.sweepExpired();
        if (removed > 0) {
            log.info("Removed {} expired sessions", removed);
        }
    }
}
