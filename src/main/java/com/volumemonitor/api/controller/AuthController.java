package com.volumemonitor.api.controller;

import com.volumemonitor.api.dto.response.AuthStatusResponse;
import com.volumemonitor.broker.KiteAuthService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final KiteAuthService kiteAuthService;

    public AuthController(KiteAuthService kiteAuthService) {
        this.kiteAuthService = kiteAuthService;
    }

    /**
     * Kite login URL. The operator opens it in a browser; Kite redirects back to
     * {@code /api/auth/callback} with a request_token.
     */
    @GetMapping("/login-url")
    public ResponseEntity<Map<String, String>> getLoginUrl() {
        return ResponseEntity.ok(Map.of("loginUrl", kiteAuthService.getLoginUrl()));
    }

    /**
     * Redirect target registered with the Kite app. Exchanges the request_token for an
     * access token and persists the session.
     */
    @GetMapping("/callback")
    public ResponseEntity<AuthStatusResponse> handleCallback(@RequestParam("request_token") String requestToken) {
        log.info("Received Kite login callback");
        kiteAuthService.handleCallback(requestToken);
        return ResponseEntity.ok(currentStatus());
    }

    @GetMapping("/status")
    public ResponseEntity<AuthStatusResponse> getStatus() {
        return ResponseEntity.ok(currentStatus());
    }

    /** Invalidates the access token. Monitoring, if active, stops. */
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout() {
        log.info("Logout requested");
        kiteAuthService.logout();
        return ResponseEntity.ok(Map.of("message", "Logged out successfully"));
    }

    private AuthStatusResponse currentStatus() {
        return AuthStatusResponse.builder()
                .authenticated(kiteAuthService.isAuthenticated())
                .userId(kiteAuthService.getCurrentUserId())
                .userName(kiteAuthService.getCurrentUserName())
                .sessionExpiresAt(kiteAuthService.getTokenExpiry())
                .build();
    }
}
