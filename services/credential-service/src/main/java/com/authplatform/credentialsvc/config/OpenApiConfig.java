package com.authplatform.credentialsvc.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Declares the {@code bearer-jwt} scheme referenced by the authenticated endpoints.
 */
@Configuration
public class OpenApiConfig {

    public static final String BEARER_SCHEME = "bearer-jwt";

    @Bean
    public OpenAPI credentialServiceOpenAPI(@Value("${spring.application.name:credential-service}") String appName) {
        return new OpenAPI()
                .info(new Info()
                        .title("Credential Service API")
                        .version("1.0.0")
                        .description(appName + ": sessions, email verification, password reset"))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")
                                .description("Access token returned by /api/v1/auth/login or /api/v1/auth/refresh")));
    }
}
