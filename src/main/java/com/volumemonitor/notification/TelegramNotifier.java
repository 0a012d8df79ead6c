package com.volumemonitor.notification;

import com.volumemonitor.domain.enums.AlertSeverity;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends messages through the Telegram Bot API under the bot's per-minute limit.
 *
 * <p>Each send takes a permit that is returned one minute-slot later. When no permit is free
 * the message waits in a priority queue (CRITICAL first) drained every second. CRITICAL
 * messages, such as monitoring stopping on an expired session, skip the limiter.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Semaphore rateLimiter;
    private final long permitReleaseMillis;

    private final BlockingQueue<TelegramMessage> messageQueue = new PriorityBlockingQueue<>(
            100, Comparator.comparingInt(m -> m.getSeverity().ordinal()));

    @Autowired
    public TelegramNotifier(TelegramConfig telegramConfig) {
        this(telegramConfig, new RestTemplate());
    }

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        int perMinute = Math.max(1, telegramConfig.getMaxMessagesPerMinute());
        this.rateLimiter = new Semaphore(perMinute);
        this.permitReleaseMillis = 60_000L / perMinute;
    }

    public void send(String message, AlertSeverity severity) {
        if (!telegramConfig.isUsable()) {
            log.debug("Telegram notifications disabled or not configured");
            return;
        }

        TelegramMessage telegramMessage = TelegramMessage.builder()
                .text(message)
                .severity(severity)
                .timestamp(System.currentTimeMillis())
                .build();

        if (severity == AlertSeverity.CRITICAL) {
            sendMessage(telegramMessage);
            return;
        }

        if (rateLimiter.tryAcquire()) {
            sendMessage(telegramMessage);
            scheduleRateLimiterRelease();
        } else {
            messageQueue.offer(telegramMessage);
            log.warn("Telegram rate limit reached, message queued. Queue size: {}", messageQueue.size());
        }
    }

    @Scheduled(fixedRate = 1000)
    public void processQueue() {
        while (!messageQueue.isEmpty() && rateLimiter.tryAcquire()) {
            TelegramMessage message = messageQueue.poll();
            if (message == null) {
                rateLimiter.release();
                return;
            }
            sendMessage(message);
            scheduleRateLimiterRelease();
        }
    }

    private void sendMessage(TelegramMessage message) {
        String url = String.format(TELEGRAM_API_URL, telegramConfig.getBotToken());
        Map<String, Object> payload = Map.of(
                "chat_id", telegramConfig.getChatId(),
                "text", message.getText(),
                "disable_web_page_preview", true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.debug("Telegram message sent ({})", message.getSeverity());
        } catch (RestClientException e) {
            // the URL carries the bot token
            log.error("Failed to send Telegram message: {}", e.getClass().getSimpleName());
        }
    }

    private void scheduleRateLimiterRelease() {
        CompletableFuture.delayedExecutor(permitReleaseMillis, TimeUnit.MILLISECONDS).execute(rateLimiter::release);
    }

    public int getQueueSize() {
        return messageQueue.size();
    }

    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }

    /** Takes every free permit. Used by tests to simulate an exhausted limiter. */
    public void drainPermits() {
        rateLimiter.drainPermits();
    }
}
