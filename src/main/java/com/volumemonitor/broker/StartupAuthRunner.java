package com.volumemonitor.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Restores the persisted Kite session once the application has fully started.
 *
 * <p>A restored session publishes a SessionEvent, which in turn loads today's instrument
 * catalog. Without a valid session the service starts in degraded mode: monitoring refuses to
 * start until the trader logs in via /api/auth/login-url.
 */
@Component
public class StartupAuthRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupAuthRunner.class);

    private final KiteAuthService kiteAuthService;

    public StartupAuthRunner(KiteAuthService kiteAuthService) {
        this.kiteAuthService = kiteAuthService;
    }

    @Override
    @Async("eventExecutor")
    public void onApplicationEvent(ApplicationReadyEvent event) {
        log.info("Startup: restoring Kite session...");
        if (!kiteAuthService.restoreSession()) {
            log.warn("Starting without a Kite session. Manual login required via /api/auth/login-url");
        }
    }
}
