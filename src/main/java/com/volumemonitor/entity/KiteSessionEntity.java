package com.volumemonitor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the kite_sessions table.
 * Persists the Kite Connect access token so a restart on the same trading day needs no new login.
 */
@Entity
@Table(name = "kite_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KiteSessionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 36)
    private String userId;

    @Column(name = "access_token", length = 255)
    private String accessToken;

    @Column(name = "public_token", length = 255)
    private String publicToken;

    @Column(name = "user_name", length = 100)
    private String userName;

    @Column(name = "login_time")
    private LocalDateTime loginTime;

    /** Kite tokens expire at 6 AM IST next day. */
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;
}
