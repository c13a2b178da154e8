package com.ticketexchange.offer.service;

import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.PaymentHold.HoldStatus;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
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
import java.util.List;

/**
 * Retries capture for matched offers whose payment never landed:
 * <ul>
 *   <li>holds marked capture-failed after a settlement</li>
 *   <li>holds still only authorized well after the match, left behind when the process
 *       stopped between the settlement commit and the capture call</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(value = "offers.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class CaptureReconciliationJob {

    private final BuyerOfferRepository offerRepository;
    private final OfferSettlementService settlementService;
    private final DistributedLockService lockService;
    private final Clock clock;

    @Value("${offers.reconciliation.grace-minutes:10}")
    private long graceMinutes;

    @Value("${offers.reconciliation.batch-size:100}")
    private int batchSize;

    @Value("${offers.reconciliation.lock-ttl-seconds:300}")
    private long lockTtlSeconds;

    @Scheduled(fixedDelayString = "${offers.reconciliation.interval-ms:300000}")
    public void scheduledReconciliation() {
        lockService.runWithLock(DistributedLockService.captureReconciliationLock(),
                Duration.ofSeconds(lockTtlSeconds), this::reconcilePendingCaptures);
    }

    /**
     * @return number of offers whose payment is now captured
     */
    public int reconcilePendingCaptures() {
        LocalDateTime matchedBefore = LocalDateTime.now(clock).minusMinutes(graceMinutes);
        List<Long> offerIds = offerRepository.findOfferIdsPendingCapture(
                OfferStatus.MATCHED, HoldStatus.CAPTURE_FAILED, HoldStatus.AUTHORIZED,
                matchedBefore, PageRequest.of(0, batchSize));

        if (offerIds.isEmpty()) {
            return 0;
        }

        log.info("Capture reconciliation: {} matched offers with outstanding payment", offerIds.size());

        int captured = 0;
        for (Long offerId : offerIds) {
            try {
                if (settlementService.retryCapture(offerId)) {
                    captured++;
                }
            } catch (Exception e) {
                log.error("Capture reconciliation failed for offer {}", offerId, e);
            }
        }

        log.info("Capture reconciliation: {}/{} offers captured", captured, offerIds.size());
        return captured;
    }
}
