package com.taskmate.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import com.taskmate.backend.global.error.ProblemException;
import com.taskmate.backend.global.security.RestAuthenticationEntryPoint;
import com.taskmate.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.taskmate.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.taskmate.backend.modules.auth.domain.AppUser;
import com.taskmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskmate.backend.modules.auth.presentation.dto.AuthResponse;
import com.taskmate.backend.modules.auth.presentation.dto.SigninRequest;
import com.taskmate.backend.modules.auth.presentation.dto.SignoutResponse;
import com.taskmate.backend.modules.auth.presentation.dto.SignupRequest;
import com.taskmate.backend.modules.auth.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    public static final String EMAIL_TAKEN = "EMAIL_TAKEN";
    public static final String INVALID_CREDENTIALS = "INVALID_CREDENTIALS";
    public static final String PASSWORD_TOO_LONG = "PASSWORD_TOO_LONG";
    // BCrypt ignores everything past the first 72 bytes
    static final int MAX_PASSWORD_BYTES = 72;
    static final String SIGNOUT_MESSAGE = "Successfully signed out";

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            AppUserRepository appUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public AuthResponse signup(SignupRequest request) {
        if (request.password().getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, PASSWORD_TOO_LONG,
                    "Password must be at most " + MAX_PASSWORD_BYTES + " bytes");
        }
        if (appUserRepository.existsByEmail(request.email())) {
            throw emailTaken(null);
        }

        AppUser user = new AppUser();
        user.setEmail(request.email());
        user.setPasswordHash(passwordEncoder.encode(request.password()));

        AppUser saved;
        try {
            saved = appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race against a concurrent signup for the same email
            throw emailTaken(ex);
        }

        log.info("Registered user {}", saved.getId());
        return buildResponse(saved);
    }

    @Transactional(readOnly = true)
    public AuthResponse signin(SigninRequest request) {
        AppUser user = appUserRepository.findByEmail(request.email())
                .orElseThrow(this::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }

        log.info("User {} signed in", user.getId());
        return buildResponse(user);
    }

    /**
     * Tokens are stateless, so signing out only acknowledges the request; the client drops the token.
     * The token is still checked so that unusable tokens show up in the logs.
     */
    @Transactional(propagation = Propagation.SUPPORTS)
    public SignoutResponse signout(String token) {
        try {
            UUID userId = jwtTokenService.verify(token).userId();
            log.info("User {} signed out", userId);
        } catch (InvalidTokenException ex) {
            log.debug("Sign-out acknowledged for unverifiable token: {}", ex.getReason());
        }
        return new SignoutResponse(SIGNOUT_MESSAGE);
    }

    @Transactional(readOnly = true)
    public UserResponse loadProfile(UUID userId) {
        return appUserRepository.findById(userId)
                .map(UserResponse::from)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED,
                        RestAuthenticationEntryPoint.UNAUTHENTICATED, "Invalid authentication credentials"));
    }

    private AuthResponse buildResponse(AppUser user) {
        IssuedToken token = jwtTokenService.issue(user.getId());
        return new AuthResponse(token.token(), UserResponse.from(user));
    }

    private ProblemException emailTaken(Throwable cause) {
        return new ProblemException(HttpStatus.CONFLICT, EMAIL_TAKEN, "Email already registered", cause);
    }

    private ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS, "Invalid email or password");
    }
}
