package com.example.devopsgateway.security;

import com.example.devopsgateway.config.GatewayProperties;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Pulls session credentials off an inbound request and resolves the caller.
 * The bearer header wins over the session cookie; the refresh token only
 * travels in its cookie.
 */
@Component
@RequiredArgsConstructor
public class RequestAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final PrincipalResolver principalResolver;
    private final GatewayProperties properties;

    public Principal authenticate(HttpServletRequest request) {
        Credentials credentials = credentials(request);
        return principalResolver.resolve(credentials.sessionToken(), credentials.refreshToken());
    }

    public Credentials credentials(HttpServletRequest request) {
        String sessionToken = bearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (sessionToken == null) {
            sessionToken = cookie(request, properties.getAuth().getSessionCookie());
        }
        String refreshToken = cookie(request, properties.getAuth().getRefreshCookie());
        return new Credentials(sessionToken, refreshToken);
    }

    static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private static String cookie(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null || name == null) return null;
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return cookie.getValue();
            }
        }
        return null;
    }

    public record Credentials(String sessionToken, String refreshToken) {
    }
}
