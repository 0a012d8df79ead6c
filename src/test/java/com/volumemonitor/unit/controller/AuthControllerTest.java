package com.volumemonitor.unit.controller;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.volumemonitor.api.controller.AuthController;
import com.volumemonitor.broker.KiteAuthService;
import com.volumemonitor.config.ApiResponseAdvice;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the AuthController.
 */
@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    private MockMvc mockMvc;

    @Mock
    private KiteAuthService kiteAuthService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuthController(kiteAuthService))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("GET /api/auth/login-url returns the Kite login URL")
    void loginUrl() throws Exception {
        when(kiteAuthService.getLoginUrl()).thenReturn("https://kite.zerodha.com/connect/login?v=3&api_key=abc");

        mockMvc.perform(get("/api/auth/login-url"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.loginUrl").value("https://kite.zerodha.com/connect/login?v=3&api_key=abc"));
    }

    @Test
    @DisplayName("callback exchanges the request token and reports the session")
    void callbackSuccess() throws Exception {
        when(kiteAuthService.isAuthenticated()).thenReturn(true);
        when(kiteAuthService.getCurrentUserId()).thenReturn("AB1234");
        when(kiteAuthService.getCurrentUserName()).thenReturn("Trader");

        mockMvc.perform(get("/api/auth/callback").param("request_token", "req-123"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isAuthenticated").value(true))
                .andExpect(jsonPath("$.data.userId").value("AB1234"))
                .andExpect(jsonPath("$.data.userName").value("Trader"));

        verify(kiteAuthService).handleCallback("req-123");
    }

    @Test
    @DisplayName("callback without a request token returns 400")
    void callbackMissingToken() throws Exception {
        mockMvc.perform(get("/api/auth/callback"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Missing request parameter: request_token"));

        verifyNoInteractions(kiteAuthService);
    }

    @Test
    @DisplayName("callback rejected by Kite returns 401")
    void callbackRejected() throws Exception {
        doThrow(new AuthException("Kite rejected the request token"))
                .when(kiteAuthService)
                .handleCallback("stale");

        mockMvc.perform(get("/api/auth/callback").param("request_token", "stale"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }

    @Test
    @DisplayName("GET /api/auth/status without a session")
    void statusLoggedOut() throws Exception {
        when(kiteAuthService.isAuthenticated()).thenReturn(false);

        mockMvc.perform(get("/api/auth/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isAuthenticated").value(false))
                .andExpect(jsonPath("$.data.userId").doesNotExist());
    }

    @Test
    @DisplayName("POST /api/auth/logout invalidates the session")
    void logout() throws Exception {
        mockMvc.perform(post("/api/auth/logout"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("Logged out successfully"));

        verify(kiteAuthService).logout();
    }
}
