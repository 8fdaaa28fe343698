package com.taskmate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.taskmate.backend.global.error.ProblemException;
import com.taskmate.backend.modules.auth.domain.AppUser;
import com.taskmate.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taskmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.taskmate.backend.modules.auth.presentation.dto.AuthResponse;
import com.taskmate.backend.modules.auth.presentation.dto.SigninRequest;
import com.taskmate.backend.modules.auth.presentation.dto.SignupRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String EMAIL = "alice@example.com";
    private static final String PASSWORD = "correct-horse-battery";

    @Mock
    private AppUserRepository appUserRepository;

    private PasswordEncoder passwordEncoder;
    private JwtTokenService jwtTokenService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        // low cost factor keeps the suite fast
        passwordEncoder = new BCryptPasswordEncoder(4);
        Clock clock = Clock.fixed(OffsetDateTime.parse("2026-02-01T00:00:00Z").toInstant(), ZoneOffset.UTC);
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider("taskmate-unit-test-signing-secret-0123456789"), 3_600_000L, clock);
        authService = new AuthService(appUserRepository, passwordEncoder, jwtTokenService);
    }

    @Test
    void signupHashesPasswordAndIssuesTokenForNewUser() {
        when(appUserRepository.existsByEmail(EMAIL)).thenReturn(false);
        when(appUserRepository.saveAndFlush(any(AppUser.class)))
                .thenAnswer(invocation -> withId(invocation.getArgument(0)));

        AuthResponse response = authService.signup(new SignupRequest(EMAIL, PASSWORD));

        ArgumentCaptor<AppUser> captor = ArgumentCaptor.forClass(AppUser.class);
        verify(appUserRepository).saveAndFlush(captor.capture());
        AppUser stored = captor.getValue();
        assertThat(stored.getPasswordHash()).isNotEqualTo(PASSWORD);
        assertThat(passwordEncoder.matches(PASSWORD, stored.getPasswordHash())).isTrue();

        assertThat(response.user().email()).isEqualTo(EMAIL);
        assertThat(jwtTokenService.verify(response.token()).userId()).isEqualTo(stored.getId());
    }

    @Test
    @DisplayName("Signup with a registered email is 409 and stores nothing")
    void signupWithTakenEmailIsConflict() {
        when(appUserRepository.existsByEmail(EMAIL)).thenReturn(true);

        assertThatThrownBy(() -> authService.signup(new SignupRequest(EMAIL, PASSWORD)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo(AuthService.EMAIL_TAKEN);
                });
        verify(appUserRepository, never()).saveAndFlush(any());
    }

    @Test
    void signupRejectsPasswordBeyondBcryptLimit() {
        // 40 characters but 80 UTF-8 bytes
        String password = "\u00e9".repeat(40);

        assertThatThrownBy(() -> authService.signup(new SignupRequest(EMAIL, password)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo(AuthService.PASSWORD_TOO_LONG);
                });
        verify(appUserRepository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentDuplicateInsertIsReportedAsEmailTaken() {
        when(appUserRepository.existsByEmail(EMAIL)).thenReturn(false);
        when(appUserRepository.saveAndFlush(any(AppUser.class)))
                .thenThrow(new DataIntegrityViolationException("uq_users_email"));

        assertThatThrownBy(() -> authService.signup(new SignupRequest(EMAIL, PASSWORD)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(AuthService.EMAIL_TAKEN));
    }

    @Test
    void signinReturnsTokenForMatchingPassword() {
        AppUser user = storedUser();
        when(appUserRepository.findByEmail(EMAIL)).thenReturn(Optional.of(user));

        AuthResponse response = authService.signin(new SigninRequest(EMAIL, PASSWORD));

        assertThat(response.user().id()).isEqualTo(user.getId());
        assertThat(jwtTokenService.verify(response.token()).userId()).isEqualTo(user.getId());
    }

    @Test
    void unknownEmailAndWrongPasswordFailIdentically() {
        when(appUserRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        when(appUserRepository.findByEmail(EMAIL)).thenReturn(Optional.of(storedUser()));

        ProblemException unknown = catchProblem(() -> authService.signin(new SigninRequest("nobody@example.com", PASSWORD)));
        ProblemException wrong = catchProblem(() -> authService.signin(new SigninRequest(EMAIL, "wrong-password")));

        assertThat(unknown.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(unknown.getCode()).isEqualTo(AuthService.INVALID_CREDENTIALS);
        assertThat(wrong.getCode()).isEqualTo(unknown.getCode());
        assertThat(wrong.getDetailMessage()).isEqualTo(unknown.getDetailMessage());
    }

    @Test
    void emailLookupIsExact() {
        when(appUserRepository.findByEmail("Alice@Example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.signin(new SigninRequest("Alice@Example.com", PASSWORD)))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    void signoutIsAcknowledgedEvenForInvalidToken() {
        assertThat(authService.signout("not-a-token").message()).isEqualTo("Successfully signed out");

        String valid = jwtTokenService.issue(UUID.randomUUID()).token();
        assertThat(authService.signout(valid).message()).isEqualTo("Successfully signed out");
    }

    @Test
    void profileOfDeletedUserIsUnauthenticated() {
        UUID userId = UUID.randomUUID();
        when(appUserRepository.findById(userId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.loadProfile(userId))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    private AppUser storedUser() {
        AppUser user = new AppUser();
        user.setEmail(EMAIL);
        user.setPasswordHash(passwordEncoder.encode(PASSWORD));
        return withId(user);
    }

    private static AppUser withId(AppUser user) {
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        return user;
    }

    private static ProblemException catchProblem(Runnable action) {
        try {
            action.run();
        } catch (ProblemException ex) {
            return ex;
        }
        throw new AssertionError("expected ProblemException");
    }
}
