package com.ticketexchange.offer.service;

import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.service.OfferLifecycleService.ExpiryOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Periodic sweep releasing the holds of offers that reached their expiry unmatched.
 * Each offer is expired in its own transaction; one failing offer never stops the rest.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "offers.expiry.enabled", havingValue = "true", matchIfMissing = true)
public class OfferExpiryJob {

    private final BuyerOfferRepository offerRepository;
    private final OfferLifecycleService lifecycleService;
    private final DistributedLockService lockService;
    private final Clock clock;

    @Value("${offers.expiry.batch-size:200}")
    private int batchSize;

    @Value("${offers.expiry.lock-ttl-seconds:300}")
    private long lockTtlSeconds;

    @Scheduled(fixedDelayString = "${offers.expiry.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        boolean ran = lockService.runWithLock(DistributedLockService.expirySweepLock(),
                Duration.ofSeconds(lockTtlSeconds), this::expireSweep);
        if (!ran) {
            log.debug("Expiry sweep skipped, another instance holds the lock");
        }
    }

    /**
     * Expire one batch of overdue offers.
     *
     * @return count of offers per outcome
     */
    public Map<ExpiryOutcome, Integer> expireSweep() {
        List<Long> offerIds = offerRepository.findExpiredOfferIds(
                OfferStatus.ACTIVE, LocalDateTime.now(clock), PageRequest.of(0, batchSize));

        Map<ExpiryOutcome, Integer> outcomes = new EnumMap<>(ExpiryOutcome.class);
        if (offerIds.isEmpty()) {
            return outcomes;
        }

        log.info("Expiry sweep: found {} overdue offers", offerIds.size());

        int failed = 0;
        for (Long offerId : offerIds) {
            try {
                ExpiryOutcome outcome = lifecycleService.expireOffer(offerId);
                outcomes.merge(outcome, 1, Integer::sum);
            } catch (Exception e) {
                failed++;
                log.error("Failed to expire offer {}", offerId, e);
            }
        }

        log.info("Expiry sweep finished: {} (unexpected failures: {})", outcomes, failed);
        return outcomes;
    }
}
