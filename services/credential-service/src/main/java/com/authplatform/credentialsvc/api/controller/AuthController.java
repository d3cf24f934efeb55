package com.authplatform.credentialsvc.api.controller;

import com.authplatform.credentialsvc.api.dto.request.EmailAddressRequest;
import com.authplatform.credentialsvc.api.dto.request.LoginRequest;
import com.authplatform.credentialsvc.api.dto.request.PasswordResetRequest;
import com.authplatform.credentialsvc.api.dto.request.RegisterRequest;
import com.authplatform.credentialsvc.api.dto.request.VerifyEmailRequest;
import com.authplatform.credentialsvc.api.dto.response.MessageResponse;
import com.authplatform.credentialsvc.api.dto.response.RegistrationResponse;
import com.authplatform.credentialsvc.api.dto.response.SessionResponse;
import com.authplatform.credentialsvc.api.support.SessionCookieFactory;
import com.authplatform.credentialsvc.domain.passwordreset.PasswordResetService;
import com.authplatform.credentialsvc.domain.registration.RegistrationService;
import com.authplatform.credentialsvc.domain.session.LoginService;
import com.authplatform.credentialsvc.domain.session.SessionService;
import com.authplatform.credentialsvc.domain.session.SessionTokens;
import com.authplatform.credentialsvc.domain.verification.ResendVerificationService;
import com.authplatform.credentialsvc.domain.verification.VerificationCodeService;
import com.authplatform.credentialsvc.shared.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.CookieValue;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Authentication", description = "Registration, verification, sessions and password reset")
public class AuthController {

    static final String RESEND_ACCEPTED = "If an unverified account exists for this email, a new code has been sent";
    static final String RESET_ACCEPTED = "If an account exists for this email, a password reset link has been sent";

    private final RegistrationService registrationService;
    private final VerificationCodeService verificationCodeService;
    private final ResendVerificationService resendVerificationService;
    private final LoginService loginService;
    private final SessionService sessionService;
    private final PasswordResetService passwordResetService;
    private final SessionCookieFactory cookieFactory;
    private final SecurityUtils securityUtils;

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Creates an unverified account and emails a 6-digit code")
    @ApiResponse(responseCode = "201", description = "Account created")
    @ApiResponse(responseCode = "400", description = "Invalid input")
    @ApiResponse(responseCode = "409", description = "Email or display name already taken")
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegisterRequest request) {
        var result = registrationService.register(request.email(), request.password(), request.displayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegistrationResponse(
                result.userId(), result.email(), "Registration successful. Check your email for the verification code."));
    }

    @PostMapping("/verify-email")
    @Operation(summary = "Verify email", description = "Consumes the 6-digit code sent at registration")
    @ApiResponse(responseCode = "200", description = "Email verified")
    @ApiResponse(responseCode = "400", description = "Malformed, invalid or expired code")
    public ResponseEntity<MessageResponse> verifyEmail(@Valid @RequestBody VerifyEmailRequest request) {
        verificationCodeService.consumeVerificationCode(request.email(), request.code());
        return ResponseEntity.ok(new MessageResponse("Email verified successfully"));
    }

    @PostMapping("/resend-verification")
    @Operation(summary = "Resend verification code")
    @ApiResponse(responseCode = "202", description = "Request accepted")
    @ApiResponse(responseCode = "429", description = "Too many codes requested for this email")
    public ResponseEntity<MessageResponse> resendVerification(@Valid @RequestBody EmailAddressRequest request) {
        resendVerificationService.resend(request.email());
        // same body whether or not the account exists
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(RESEND_ACCEPTED));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Returns an access token and sets the session cookie")
    @ApiResponse(responseCode = "200", description = "Logged in")
    @ApiResponse(responseCode = "401", description = "Invalid credentials")
    @ApiResponse(responseCode = "403", description = "Email not verified")
    public ResponseEntity<SessionResponse> login(@Valid @RequestBody LoginRequest request,
                                                 HttpServletRequest httpRequest) {
        SessionTokens session = loginService.login(request.email(), request.password(),
                securityUtils.resolveClientIp(httpRequest));
        return sessionResponse(session);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Rotate session", description = "Exchanges the session cookie for a new one and a new access token")
    @ApiResponse(responseCode = "200", description = "Session rotated")
    @ApiResponse(responseCode = "401", description = "Invalid or expired session")
    public ResponseEntity<SessionResponse> refresh(
            @CookieValue(name = SessionCookieFactory.COOKIE_NAME, required = false) String sessionToken) {
        return sessionResponse(sessionService.rotateSession(sessionToken));
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Revokes the current session and clears the cookie")
    @ApiResponse(responseCode = "200", description = "Logged out")
    public ResponseEntity<MessageResponse> logout(
            @CookieValue(name = SessionCookieFactory.COOKIE_NAME, required = false) String sessionToken) {
        sessionService.revokeSession(sessionToken);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clearedCookie().toString())
                .body(new MessageResponse("Logged out"));
    }

    @PostMapping("/logout-all")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Log out everywhere", description = "Revokes every session of the authenticated user")
    @ApiResponse(responseCode = "200", description = "All sessions revoked")
    @ApiResponse(responseCode = "401", description = "Missing or invalid access token")
    public ResponseEntity<MessageResponse> logoutAll(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = UUID.fromString(jwt.getSubject());
        int revoked = sessionService.revokeAllSessions(userId);
        log.info("All sessions revoked: userId={}, count={}", userId, revoked);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.clearedCookie().toString())
                .body(new MessageResponse("Logged out from all devices"));
    }

    @PostMapping("/forgot-password")
    @Operation(summary = "Request password reset")
    @ApiResponse(responseCode = "202", description = "Request accepted")
    public ResponseEntity<MessageResponse> forgotPassword(@Valid @RequestBody EmailAddressRequest request) {
        passwordResetService.requestPasswordReset(request.email());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(RESET_ACCEPTED));
    }

    @PostMapping("/reset-password")
    @Operation(summary = "Reset password", description = "Sets a new password with a single-use reset token")
    @ApiResponse(responseCode = "200", description = "Password changed")
    @ApiResponse(responseCode = "400", description = "Invalid or expired token, or weak password")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody PasswordResetRequest request) {
        passwordResetService.consumePasswordReset(request.token(), request.newPassword());
        return ResponseEntity.ok(new MessageResponse("Password has been reset. Please log in again."));
    }

    private ResponseEntity<SessionResponse> sessionResponse(SessionTokens session) {
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cookieFactory.sessionCookie(session.sessionToken()).toString())
                .body(new SessionResponse(
                        session.accessToken().value(),
                        SessionResponse.BEARER,
                        session.accessToken().expiresAt(),
                        session.userId()));
    }
}
