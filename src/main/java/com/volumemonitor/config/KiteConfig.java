package com.volumemonitor.config;

import com.zerodhatech.kiteconnect.KiteConnect;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and bean definitions for Kite Connect API integration.
 *
 * <p>Binds to the {@code kite.*} prefix. Provides a singleton {@link KiteConnect} bean shared
 * across the application: after login, the access token is set on this instance and the quote,
 * instrument, and order calls all use the same connection.
 */
@Configuration
@ConfigurationProperties(prefix = "kite")
@Getter
@Setter
public class KiteConfig {

    private static final Logger log = LoggerFactory.getLogger(KiteConfig.class);

    /** Kite Connect API key (from Zerodha developer console). */
    private String apiKey;

    /** Kite Connect API secret (from Zerodha developer console). */
    private String apiSecret;

    /**
     * Singleton KiteConnect SDK client.
     *
     * <p>Created once with the API key. {@link com.volumemonitor.broker.KiteAuthService} sets the
     * access token, user ID, and public token on this instance after login or session restore.
     */
    @Bean
    public KiteConnect kiteConnect() {
        log.info("Creating KiteConnect bean with API key: {}...", maskApiKey(apiKey));
        KiteConnect kiteConnect = new KiteConnect(apiKey);
        kiteConnect.setSessionExpiryHook(() -> log.warn("Kite session expired (detected by SDK SessionExpiryHook)"));
        return kiteConnect;
    }

    static String maskApiKey(String key) {
        if (key == null || key.length() < 4) {
            return "****";
        }
        return key.substring(0, 4) + "****";
    }
}
