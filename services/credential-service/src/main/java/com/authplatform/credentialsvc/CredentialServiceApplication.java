package com.authplatform.credentialsvc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
public class CredentialServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredentialServiceApplication.class, args);
    }

    /**
     * Scheduled jobs (outbox dispatch, ghost-account sweep) stay off under the test profile;
     * tests drive them directly.
     */
    @Configuration
    @Profile("!test")
    @EnableScheduling
    static class SchedulingConfig {
    }
}
