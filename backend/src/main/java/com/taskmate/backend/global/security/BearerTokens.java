package com.taskmate.backend.global.security;

import java.util.Optional;

import org.springframework.util.StringUtils;

public final class BearerTokens {

    public static final String BEARER_PREFIX = "Bearer ";

    private BearerTokens() {
    }

    /**
     * Extracts the credential from an {@code Authorization} header value.
     * Returns empty when the header is absent, uses another scheme, or carries no token.
     */
    public static Optional<String> resolve(String authorizationHeader) {
        if (authorizationHeader == null
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return Optional.empty();
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? Optional.of(token) : Optional.empty();
    }
}
