package com.taskmate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;

import com.taskmate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Issues and verifies the stateless HS256 access tokens.
 * <p>
 * Verification is a pure function of the token, the configured key and the clock: there is no
 * server-side session, so a token stays valid until {@code exp} unless the secret is rotated.
 */
@Service
public class JwtTokenService {

    static final String TOKEN_TYPE_CLAIM = "type";
    static final String ACCESS_TOKEN_TYPE = "access";
    private static final String SIGNING_ALGORITHM = SIG.HS256.getId();

    private final JwtTokenProvider tokenProvider;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.expiration:604800000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        if (accessTokenTtlMillis <= 0) {
            throw new IllegalArgumentException("jwt.expiration must be positive");
        }
        this.tokenProvider = tokenProvider;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public IssuedToken issue(UUID userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        // JWT NumericDate has second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiry = now.plusMillis(accessTokenTtlMillis).truncatedTo(ChronoUnit.SECONDS);

        String token = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(TOKEN_TYPE_CLAIM, ACCESS_TOKEN_TYPE)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    /**
     * @throws InvalidTokenException with reason {@code EXPIRED} when the signature is valid but
     *                               {@code exp} has been reached, {@code MALFORMED} for anything else
     */
    public ParsedToken verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new InvalidTokenException(Reason.MALFORMED, "Access token is empty", null);
        }

        Jws<Claims> jws;
        try {
            jws = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token);
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException(Reason.EXPIRED, "Access token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Invalid access token", e);
        }

        if (!SIGNING_ALGORITHM.equals(jws.getHeader().getAlgorithm())) {
            throw new InvalidTokenException(Reason.MALFORMED, "Unexpected signing algorithm", null);
        }

        Claims claims = jws.getPayload();
        if (!ACCESS_TOKEN_TYPE.equals(claims.get(TOKEN_TYPE_CLAIM, String.class))) {
            throw new InvalidTokenException(Reason.MALFORMED, "Unexpected token type", null);
        }
        if (claims.getExpiration() == null) {
            throw new InvalidTokenException(Reason.MALFORMED, "Access token has no expiry", null);
        }

        String subject = claims.getSubject();
        if (subject == null) {
            throw new InvalidTokenException(Reason.MALFORMED, "Access token has no subject", null);
        }
        UUID userId;
        try {
            userId = UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(Reason.MALFORMED, "Access token subject is not a user id", e);
        }

        Instant now = clock.instant();
        Instant expiresAt = claims.getExpiration().toInstant();
        if (!now.isBefore(expiresAt)) {
            throw new InvalidTokenException(Reason.EXPIRED, "Access token expired", null);
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : now;

        return new ParsedToken(
                userId,
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public record IssuedToken(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public record ParsedToken(UUID userId, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public enum Reason {
        MALFORMED,
        EXPIRED
    }

    public static class InvalidTokenException extends RuntimeException {

        private final Reason reason;

        public InvalidTokenException(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = reason;
        }

        public Reason getReason() {
            return reason;
        }
    }
}
