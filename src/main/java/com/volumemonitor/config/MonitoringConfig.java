package com.volumemonitor.config;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the clock and the polling thread factory. Both are beans so tests can swap in a
 * fixed clock and a thread factory that never actually starts the loop.
 */
@Configuration
public class MonitoringConfig {

    private static final Logger log = LoggerFactory.getLogger(MonitoringConfig.class);

    @Bean
    public Clock clock(@Value("${trading-calendar.timezone:Asia/Kolkata}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }

    @Bean
    public ThreadFactory pollingThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "volume-poller-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler(
                    (t, e) -> log.error("Polling thread {} died: {}", t.getName(), e.getMessage(), e));
            return thread;
        };
    }
}
