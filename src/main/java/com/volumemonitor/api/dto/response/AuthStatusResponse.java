package com.volumemonitor.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

/**
 * Kite session state for GET /api/auth/status and the OAuth callback.
 */
@Getter
@Builder
public class AuthStatusResponse {

    // Lombok's isAuthenticated() would serialize as "authenticated"
    @JsonProperty("isAuthenticated")
    private final boolean authenticated;

    private final String userId;
    private final String userName;
    private final LocalDateTime sessionExpiresAt;
}
