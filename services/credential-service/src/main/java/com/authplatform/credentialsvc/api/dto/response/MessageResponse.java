package com.authplatform.credentialsvc.api.dto.response;

public record MessageResponse(String message) {}
