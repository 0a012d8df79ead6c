package com.volumemonitor.broker;

import com.volumemonitor.config.KiteConfig;
import com.volumemonitor.entity.KiteSessionEntity;
import com.volumemonitor.event.SessionEvent;
import com.volumemonitor.event.SessionEventType;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.exception.BrokerException;
import com.volumemonitor.repository.jpa.KiteSessionJpaRepository;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.models.User;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Manages the Kite Connect OAuth lifecycle: login URL generation, callback handling,
 * session restore on startup, and logout.
 *
 * <p>Operates on the shared {@link KiteConnect} bean from {@link KiteConfig}. After a successful
 * login this service sets the access token, user ID, and public token on that bean so the quote,
 * instrument, and order calls all use the authenticated client.
 *
 * <p>The session is persisted in H2 so a restart on the same trading day reuses it.
 * Kite tokens expire at 6 AM IST the next day.
 */
@Service
public class KiteAuthService implements CredentialProvider {

    private static final Logger log = LoggerFactory.getLogger(KiteAuthService.class);

    private static final LocalTime TOKEN_EXPIRY_TIME = LocalTime.of(6, 0);

    private final KiteConfig kiteConfig;
    private final KiteConnect kiteConnect;
    private final KiteSessionJpaRepository kiteSessionJpaRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    private volatile String accessToken;
    private volatile String currentUserId;
    private volatile String currentUserName;
    private volatile LocalDateTime tokenExpiry;

    public KiteAuthService(
            KiteConfig kiteConfig,
            KiteConnect kiteConnect,
            KiteSessionJpaRepository kiteSessionJpaRepository,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.kiteConfig = kiteConfig;
        this.kiteConnect = kiteConnect;
        this.kiteSessionJpaRepository = kiteSessionJpaRepository;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    /**
     * Restores a non-expired session from H2, if there is one.
     *
     * @return true when a session was restored
     */
    public boolean restoreSession() {
        Optional<KiteSessionEntity> existing =
                kiteSessionJpaRepository.findFirstByExpiresAtAfterOrderByLoginTimeDesc(LocalDateTime.now(clock));
        if (existing.isEmpty()) {
            log.warn("No valid Kite session in H2. Log in via /api/auth/login-url before starting monitoring");
            return false;
        }

        KiteSessionEntity session = existing.get();
        this.accessToken = session.getAccessToken();
        this.currentUserId = session.getUserId();
        this.currentUserName = session.getUserName();
        this.tokenExpiry = session.getExpiresAt();

        kiteConnect.setAccessToken(session.getAccessToken());
        kiteConnect.setUserId(session.getUserId());
        if (session.getPublicToken() != null) {
            kiteConnect.setPublicToken(session.getPublicToken());
        }
        log.info("Reusing valid token from H2 for user {} (expires: {})", session.getUserId(), session.getExpiresAt());
        publishSessionEvent(SessionEventType.RESTORED, session.getUserId());
        return true;
    }

    /**
     * Generates the Kite OAuth login URL for browser-based login.
     *
     * @return the Kite login URL with the configured API key
     */
    public String getLoginUrl() {
        return kiteConnect.getLoginURL();
    }

    /**
     * Handles the OAuth redirect after login: exchanges the request token for an access token,
     * configures the shared client, and persists the session.
     *
     * @param requestToken the request_token from the Kite OAuth redirect
     * @throws AuthException if Kite rejects the request token
     * @throws BrokerException if the exchange fails for any other reason
     */
    public void handleCallback(String requestToken) {
        try {
            User user = kiteConnect.generateSession(requestToken, kiteConfig.getApiSecret());

            kiteConnect.setAccessToken(user.accessToken);
            kiteConnect.setPublicToken(user.publicToken);
            kiteConnect.setUserId(user.userId);

            this.accessToken = user.accessToken;
            this.currentUserId = user.userId;
            this.currentUserName = user.userName;
            this.tokenExpiry = computeTokenExpiry();

            saveSession(user);
            log.info("Login successful for user: {}", currentUserName);
        } catch (TokenException e) {
            throw new AuthException("Kite rejected the request token: " + e.message, e);
        } catch (KiteException e) {
            throw new BrokerException("Failed to exchange request token: " + e.message, e);
        } catch (JSONException | IOException e) {
            throw new BrokerException("Failed to exchange request token: " + e.getMessage(), e);
        }
        publishSessionEvent(SessionEventType.LOGGED_IN, currentUserId);
    }

    /**
     * Invalidates the token on Kite's side, clears local state, and removes the persisted session.
     *
     * <p>If Kite refuses the invalidation (e.g., token already expired), local state is
     * still cleared so the user can log in again.
     */
    public void logout() {
        if (accessToken != null) {
            try {
                kiteConnect.invalidateAccessToken();
                log.info("Kite access token invalidated via API");
            } catch (KiteException e) {
                log.warn("Failed to invalidate Kite access token (may already be expired): {}", e.message);
            } catch (JSONException | IOException e) {
                log.warn("Failed to invalidate Kite access token (may already be expired): {}", e.getMessage());
            }
        }

        String previousUserId = this.currentUserId;
        this.accessToken = null;
        this.currentUserId = null;
        this.currentUserName = null;
        this.tokenExpiry = null;
        kiteSessionJpaRepository.deleteAll();

        log.info("Logout complete, session state cleared");
        publishSessionEvent(SessionEventType.LOGGED_OUT, previousUserId);
    }

    @Override
    public Optional<String> currentToken() {
        return isAuthenticated() ? Optional.of(accessToken) : Optional.empty();
    }

    public boolean isAuthenticated() {
        return accessToken != null && !isTokenExpired();
    }

    public String getCurrentUserId() {
        return currentUserId;
    }

    public String getCurrentUserName() {
        return currentUserName;
    }

    public LocalDateTime getTokenExpiry() {
        return tokenExpiry;
    }

    // ---- Private helpers ----

    private void publishSessionEvent(SessionEventType eventType, String userId) {
        applicationEventPublisher.publishEvent(new SessionEvent(this, eventType, userId, LocalDateTime.now(clock)));
    }

    private void saveSession(User user) {
        // only one active session at a time
        kiteSessionJpaRepository.deleteAll();

        LocalDateTime now = LocalDateTime.now(clock);
        KiteSessionEntity entity = KiteSessionEntity.builder()
                .id(UUID.randomUUID().toString())
                .userId(user.userId)
                .accessToken(user.accessToken)
                .publicToken(user.publicToken)
                .userName(user.userName)
                .loginTime(now)
                .expiresAt(tokenExpiry)
                .build();

        kiteSessionJpaRepository.save(entity);
        log.info("Session saved to H2, expires at {}", entity.getExpiresAt());
    }

    /**
     * Kite tokens expire at 6:00 AM IST the next day.
     * Before 6 AM the token expires at 6 AM today; otherwise at 6 AM tomorrow.
     */
    LocalDateTime computeTokenExpiry() {
        LocalDateTime now = LocalDateTime.now(clock);
        if (now.toLocalTime().isBefore(TOKEN_EXPIRY_TIME)) {
            return now.toLocalDate().atTime(TOKEN_EXPIRY_TIME);
        }
        return now.toLocalDate().plusDays(1).atTime(TOKEN_EXPIRY_TIME);
    }

    private boolean isTokenExpired() {
        LocalDateTime expiry = tokenExpiry;
        return expiry != null && LocalDateTime.now(clock).isAfter(expiry);
    }
}
