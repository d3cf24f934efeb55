package com.authplatform.credentialsvc.api.controller;

import com.authplatform.credentialsvc.api.dto.response.CurrentUserResponse;
import com.authplatform.credentialsvc.domain.profile.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/me")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Profile", description = "Authenticated user")
@SecurityRequirement(name = "bearer-jwt")
public class MeController {

    private final ProfileService profileService;

    @GetMapping
    @Operation(summary = "Current user", description = "Returns the authenticated user's profile")
    @ApiResponse(responseCode = "200", description = "Profile retrieved")
    @ApiResponse(responseCode = "401", description = "Missing or invalid access token")
    @ApiResponse(responseCode = "404", description = "Account no longer exists")
    public ResponseEntity<CurrentUserResponse> currentUser(@AuthenticationPrincipal Jwt jwt) {
        UUID userId = UUID.fromString(jwt.getSubject());
        log.debug("Resolving current user: {}", userId);
        return ResponseEntity.ok(CurrentUserResponse.from(profileService.getProfile(userId)));
    }
}
