package com.volumemonitor.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.volumemonitor.broker.KiteAuthService;
import com.volumemonitor.config.KiteConfig;
import com.volumemonitor.entity.KiteSessionEntity;
import com.volumemonitor.event.SessionEvent;
import com.volumemonitor.event.SessionEventType;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.exception.BrokerException;
import com.volumemonitor.repository.jpa.KiteSessionJpaRepository;
import com.volumemonitor.support.MutableClock;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.models.User;
import java.time.LocalDateTime;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Unit tests for {@link KiteAuthService}.
 *
 * <p>Tests session restore from H2, the OAuth callback, token expiry and logout.
 * KiteConnect and the repository are mocked so no HTTP call is made.
 */
@ExtendWith(MockitoExtension.class)
class KiteAuthServiceTest {

    @Mock
    private KiteConnect kiteConnect;

    @Mock
    private KiteSessionJpaRepository kiteSessionJpaRepository;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private MutableClock clock;
    private KiteAuthService kiteAuthService;

    @BeforeEach
    void setUp() {
        KiteConfig kiteConfig = new KiteConfig();
        kiteConfig.setApiKey("test-api-key");
        kiteConfig.setApiSecret("test-api-secret");
        clock = MutableClock.at(LocalDateTime.of(2026, 10, 19, 8, 30));
        kiteAuthService = new KiteAuthService(
                kiteConfig, kiteConnect, kiteSessionJpaRepository, applicationEventPublisher, clock);
    }

    private static User user() {
        User user = new User();
        user.accessToken = "access-123";
        user.publicToken = "public-456";
        user.userId = "AB1234";
        user.userName = "Test Trader";
        return user;
    }

    private SessionEvent lastSessionEvent() {
        ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Callback")
    class Callback {

        @Test
        @DisplayName("Exchanges the request token, configures the client and persists the session")
        void successfulLogin() throws Throwable {
            when(kiteConnect.generateSession("req-token", "test-api-secret")).thenReturn(user());

            kiteAuthService.handleCallback("req-token");

            verify(kiteConnect).setAccessToken("access-123");
            verify(kiteConnect).setUserId("AB1234");
            verify(kiteSessionJpaRepository).deleteAll();
            ArgumentCaptor<KiteSessionEntity> saved = ArgumentCaptor.forClass(KiteSessionEntity.class);
            verify(kiteSessionJpaRepository).save(saved.capture());
            assertThat(saved.getValue().getAccessToken()).isEqualTo("access-123");

            assertThat(kiteAuthService.isAuthenticated()).isTrue();
            assertThat(kiteAuthService.currentToken()).contains("access-123");
            assertThat(lastSessionEvent().getEventType()).isEqualTo(SessionEventType.LOGGED_IN);
        }

        @Test
        @DisplayName("A login after 6 AM expires at 6 AM the next day")
        void expiryNextMorning() throws Throwable {
            when(kiteConnect.generateSession("req-token", "test-api-secret")).thenReturn(user());

            kiteAuthService.handleCallback("req-token");

            assertThat(kiteAuthService.getTokenExpiry()).isEqualTo(LocalDateTime.of(2026, 10, 20, 6, 0));
        }

        @Test
        @DisplayName("A login before 6 AM expires at 6 AM the same day")
        void expirySameMorning() throws Throwable {
            clock.set(LocalDateTime.of(2026, 10, 19, 5, 30));
            when(kiteConnect.generateSession("req-token", "test-api-secret")).thenReturn(user());

            kiteAuthService.handleCallback("req-token");

            assertThat(kiteAuthService.getTokenExpiry()).isEqualTo(LocalDateTime.of(2026, 10, 19, 6, 0));
        }

        @Test
        @DisplayName("A rejected request token raises AuthException and publishes nothing")
        void rejectedToken() throws Throwable {
            when(kiteConnect.generateSession("bad", "test-api-secret"))
                    .thenThrow(new TokenException("Token is invalid or has expired.", 403));

            assertThatThrownBy(() -> kiteAuthService.handleCallback("bad")).isInstanceOf(AuthException.class);
            assertThat(kiteAuthService.isAuthenticated()).isFalse();
            verify(applicationEventPublisher, never()).publishEvent(any(SessionEvent.class));
        }

        @Test
        @DisplayName("Other Kite failures raise BrokerException")
        void brokerFailure() throws Throwable {
            when(kiteConnect.generateSession("req", "test-api-secret")).thenThrow(new KiteException("Gateway timeout"));

            assertThatThrownBy(() -> kiteAuthService.handleCallback("req")).isInstanceOf(BrokerException.class);
        }
    }

    @Nested
    @DisplayName("Restore and expiry")
    class RestoreAndExpiry {

        @Test
        @DisplayName("Restores a persisted, unexpired session")
        void restores() {
            KiteSessionEntity entity = KiteSessionEntity.builder()
                    .id("s1")
                    .userId("AB1234")
                    .userName("Test Trader")
                    .accessToken("persisted-token")
                    .publicToken("public-456")
                    .loginTime(LocalDateTime.of(2026, 10, 19, 8, 0))
                    .expiresAt(LocalDateTime.of(2026, 10, 20, 6, 0))
                    .build();
            when(kiteSessionJpaRepository.findFirstByExpiresAtAfterOrderByLoginTimeDesc(LocalDateTime.now(clock)))
                    .thenReturn(Optional.of(entity));

            assertThat(kiteAuthService.restoreSession()).isTrue();

            verify(kiteConnect).setAccessToken("persisted-token");
            assertThat(kiteAuthService.currentToken()).contains("persisted-token");
            assertThat(lastSessionEvent().getEventType()).isEqualTo(SessionEventType.RESTORED);
        }

        @Test
        @DisplayName("No persisted session leaves the service unauthenticated")
        void nothingToRestore() {
            when(kiteSessionJpaRepository.findFirstByExpiresAtAfterOrderByLoginTimeDesc(any()))
                    .thenReturn(Optional.empty());

            assertThat(kiteAuthService.restoreSession()).isFalse();
            assertThat(kiteAuthService.currentToken()).isEmpty();
        }

        @Test
        @DisplayName("The token stops being offered once it expires")
        void expiredTokenNotOffered() throws Throwable {
            when(kiteConnect.generateSession("req-token", "test-api-secret")).thenReturn(user());
            kiteAuthService.handleCallback("req-token");

            clock.set(LocalDateTime.of(2026, 10, 20, 6, 1));

            assertThat(kiteAuthService.isAuthenticated()).isFalse();
            assertThat(kiteAuthService.currentToken()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Logout")
    class Logout {

        @Test
        @DisplayName("Invalidates the token, clears state and publishes LOGGED_OUT")
        void logout() throws Throwable {
            when(kiteConnect.generateSession("req-token", "test-api-secret")).thenReturn(user());
            kiteAuthService.handleCallback("req-token");

            kiteAuthService.logout();

            verify(kiteConnect).invalidateAccessToken();
            assertThat(kiteAuthService.isAuthenticated()).isFalse();
            assertThat(kiteAuthService.getCurrentUserId()).isNull();
            ArgumentCaptor<SessionEvent> captor = ArgumentCaptor.forClass(SessionEvent.class);
            verify(applicationEventPublisher, times(2)).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(SessionEventType.LOGGED_OUT);
            assertThat(captor.getValue().getUserId()).isEqualTo("AB1234");
        }

        @Test
        @DisplayName("Local state is cleared even when Kite refuses the invalidation")
        void logoutWhenKiteRefuses() throws Throwable {
            when(kiteConnect.generateSession("req-token", "test-api-secret")).thenReturn(user());
            kiteAuthService.handleCallback("req-token");
            doThrow(new KiteException("Token already expired")).when(kiteConnect).invalidateAccessToken();

            kiteAuthService.logout();

            assertThat(kiteAuthService.currentToken()).isEmpty();
            verify(kiteSessionJpaRepository, times(2)).deleteAll();
        }
    }
}
