package com.example.devopsgateway.controller;

import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.security.IdentityProvider;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.RequestAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Session endpoints: who am I, and logout.
 */
@Slf4j
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final RequestAuthenticator authenticator;
    private final IdentityProvider identityProvider;

    @GetMapping("/me")
    public ResponseEntity<Principal> me(HttpServletRequest request) {
        return ResponseEntity.ok(authenticator.authenticate(request));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout(HttpServletRequest request) {
        String refreshToken = authenticator.credentials(request).refreshToken();
        if (refreshToken == null) {
            throw new ValidationException("A refresh token is required to log out");
        }
        if (!identityProvider.isConfigured()) {
            throw new AuthenticationException("Identity provider is not configured");
        }
        if (!identityProvider.logout(refreshToken)) {
            throw new AuthenticationException("Logout rejected by identity provider");
        }
        return ResponseEntity.ok(Map.of("success", true, "message", "Logged out"));
    }
}
