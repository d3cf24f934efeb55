package com.authplatform.credentialsvc.domain.reaper;

import com.authplatform.credentialsvc.config.CredentialMetrics;
import com.authplatform.credentialsvc.infra.persistence.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes accounts whose email was never verified within the grace period.
 * Their tokens and codes go with them through the foreign key cascade.
 */
@Component
@Slf4j
public class GhostAccountReaper {

    private final UserRepository userRepository;
    private final TransactionTemplate transactionTemplate;
    private final CredentialMetrics metrics;
    private final Clock clock;
    private final Duration gracePeriod;

    public GhostAccountReaper(
            UserRepository userRepository,
            TransactionTemplate transactionTemplate,
            CredentialMetrics metrics,
            Clock clock,
            @Value("${app.reaper.grace-days:3}") long graceDays) {
        this.userRepository = userRepository;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.clock = clock;
        this.gracePeriod = Duration.ofDays(graceDays);
    }

    @Scheduled(cron = "${app.reaper.cron:0 0 3 * * *}", zone = "${app.reaper.zone:UTC}")
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Ghost account sweep failed, next run retries: error={}", e.getMessage(), e);
        }
    }

    /**
     * Deletes unverified users created before {@code now - grace period}.
     *
     * @return number of accounts deleted
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(gracePeriod);
        Integer deleted = transactionTemplate.execute(status -> userRepository.deleteUnverifiedCreatedBefore(cutoff));
        int count = deleted == null ? 0 : deleted;

        metrics.ghostAccountsReaped(count);
        log.info("Ghost account sweep finished: deleted={}, cutoff={}", count, cutoff);
        return count;
    }
}
