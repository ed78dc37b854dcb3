package com.fintech.resolution.scheduler;

import com.fintech.resolution.matching.DisambiguationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Purges clarifications whose session went quiet.
 * <p>
 * Expired entries are already ignored when a session reads them; this job
 * only keeps abandoned sessions from holding memory.
 * <p>
 * Default: every minute
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DisambiguationExpiryScheduler {

    private final DisambiguationService disambiguationService;

    @Value("${resolution.disambiguation.sweeper-enabled:true}")
    private boolean sweeperEnabled;

    /**
     * fixedDelay: the next sweep starts only after the previous one finished.
     */
    @Scheduled(fixedDelayString = "${resolution.disambiguation.sweep-interval-ms:60000}")
    public void purgeExpiredClarifications() {
        if (!sweeperEnabled) {
            log.debug("Expiry sweeper is disabled, skipping run");
            return;
        }
        try {
            int removed = disambiguationService.purgeExpired();
            log.debug("Expiry sweep removed {} clarification(s), {} still pending",
                    removed, disambiguationService.pendingCount());
        } catch (Exception e) {
            log.error("Expiry sweep failed with unexpected error", e);
        }
    }
}
