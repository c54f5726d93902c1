package com.truledgr.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically persists the expired status of lapsed impersonation sessions. Off by default;
 * identity resolution checks expiry on its own whether or not this runs.
 */
@Component
@ConditionalOnProperty(name = "app.auth.impersonation.sweep.enabled", havingValue = "true")
public class ImpersonationExpiryScheduler {

    private static final Logger log = LoggerFactory.getLogger(ImpersonationExpiryScheduler.class);

    private final ImpersonationService impersonationService;

    public ImpersonationExpiryScheduler(ImpersonationService impersonationService) {
        this.impersonationService = impersonationService;
    }

    @Scheduled(fixedDelayString = "${app.auth.impersonation.sweep.interval:PT5M}")
    public void expireLapsedSessions() {
        int expired = impersonationService.markLapsedSessionsExpired();
        if (expired > 0) {
            log.info("Marked {} lapsed impersonation sessions as expired", expired);
        }
    }
}
