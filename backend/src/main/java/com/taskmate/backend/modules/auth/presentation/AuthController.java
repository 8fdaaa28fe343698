package com.taskmate.backend.modules.auth.presentation;

import com.taskmate.backend.global.error.ProblemException;
import com.taskmate.backend.global.security.BearerTokens;
import com.taskmate.backend.global.security.JwtAuthenticationPrincipal;
import com.taskmate.backend.global.security.RestAuthenticationEntryPoint;
import com.taskmate.backend.modules.auth.application.AuthService;
import com.taskmate.backend.modules.auth.presentation.dto.AuthResponse;
import com.taskmate.backend.modules.auth.presentation.dto.SigninRequest;
import com.taskmate.backend.modules.auth.presentation.dto.SignoutResponse;
import com.taskmate.backend.modules.auth.presentation.dto.SignupRequest;
import com.taskmate.backend.modules.auth.presentation.dto.UserResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created, token issued"),
            @ApiResponse(responseCode = "409", description = "Email already registered"),
            @ApiResponse(responseCode = "422", description = "Invalid email or password format")
    })
    @PostMapping("/signup")
    public ResponseEntity<AuthResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.signup(request));
    }

    @PostMapping("/signin")
    public ResponseEntity<AuthResponse> signin(@Valid @RequestBody SigninRequest request) {
        return ResponseEntity.ok(authService.signin(request));
    }

    @Operation(
            summary = "Sign out",
            description = """
                    Acknowledges sign-out. Tokens are stateless and stay valid until they expire; \
                    the client is expected to discard its token. An expired or invalid token is still acknowledged.
                    """
    )
    @PostMapping("/signout")
    public ResponseEntity<SignoutResponse> signout(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization
    ) {
        String token = BearerTokens.resolve(authorization)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED,
                        RestAuthenticationEntryPoint.UNAUTHENTICATED, "Invalid authentication credentials"));
        return ResponseEntity.ok(authService.signout(token));
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponse> currentUser(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }
}
