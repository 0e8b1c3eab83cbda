package com.sitecheck.api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;

/**
 * Authenticates the queue trigger and the admin endpoints against shared secrets.
 *
 * The trigger accepts the secret as a bearer token or as a {@code secret} query parameter,
 * since some schedulers cannot set headers. Admin endpoints take the bearer form only.
 * When a secret is not configured the matching endpoints are open.
 */
@Slf4j
public class SharedSecretAuthenticationFilter extends OncePerRequestFilter {

    public static final String QUEUE_PATH = "/api/process-queue";
    public static final String ADMIN_PATH = "/api/admin";
    public static final String ROLE_QUEUE = "ROLE_QUEUE";
    public static final String ROLE_ADMIN = "ROLE_ADMIN";

    private static final String BEARER_PREFIX = "Bearer ";

    private final String queueSecret;
    private final String adminSecret;

    public SharedSecretAuthenticationFilter(String queueSecret, String adminSecret) {
        this.queueSecret = queueSecret;
        this.adminSecret = adminSecret;
        if (isBlank(queueSecret)) {
            log.warn("[SECURITY] QUEUE_SECRET not set, {} is open to anyone", QUEUE_PATH);
        }
        if (isBlank(adminSecret)) {
            log.warn("[SECURITY] ADMIN_SECRET not set, {}/** is open to anyone", ADMIN_PATH);
        }
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String path = request.getRequestURI();

        if (path.startsWith(QUEUE_PATH)) {
            authenticate(request, queueSecret, ROLE_QUEUE, true);
        } else if (path.startsWith(ADMIN_PATH)) {
            authenticate(request, adminSecret, ROLE_ADMIN, false);
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, String secret, String role, boolean allowQueryParam) {
        if (isBlank(secret)) {
            grant(role);
            return;
        }

        String presented = bearerToken(request);
        if (presented == null && allowQueryParam) {
            presented = request.getParameter("secret");
        }

        if (presented != null && constantTimeEquals(presented, secret)) {
            grant(role);
        } else {
            log.warn("[SECURITY] Rejected request with missing or invalid secret | path={} | remote={}",
                request.getRequestURI(), request.getRemoteAddr());
        }
    }

    private void grant(String role) {
        Authentication authentication = new UsernamePasswordAuthenticationToken(
            role.substring("ROLE_".length()).toLowerCase(),
            null,
            Collections.singletonList(new SimpleGrantedAuthority(role))
        );
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    private String bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            return header.substring(BEARER_PREFIX.length()).trim();
        }
        return null;
    }

    private boolean constantTimeEquals(String presented, String expected) {
        return MessageDigest.isEqual(
            presented.getBytes(StandardCharsets.UTF_8),
            expected.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
