package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.AcceptOfferRequest;
import com.ticketexchange.common.dto.AcceptOfferResponse;
import com.ticketexchange.common.dto.SettledTransactionDto;
import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.PaymentHold.HoldStatus;
import com.ticketexchange.offer.payment.PaymentAuthorizationException;
import com.ticketexchange.offer.payment.PaymentAuthorizationService;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.repository.SettledTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Turns a seller's acceptance into a settled match: the store write commits first,
 * then the held payment is captured. A failed capture never undoes the match; it is
 * flagged and handed to reconciliation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OfferSettlementService {

    public static final String PAYMENT_CAPTURED = "CAPTURED";
    public static final String PAYMENT_CAPTURE_FAILED = "CAPTURE_FAILED";

    private final SettlementWriter settlementWriter;
    private final PaymentAuthorizationService paymentService;
    private final OfferMessagingService messagingService;
    private final BuyerOfferRepository offerRepository;
    private final SettledTransactionRepository transactionRepository;

    public AcceptOfferResponse acceptOffer(Long offerId, Long sellerId, AcceptOfferRequest request) {
        SettlementRecord record = writeSettlement(offerId, sellerId, request);

        boolean captured = captureAndRecord(record.getOfferId(), record.getAuthorizationId(),
                record.getTransaction(), true);

        return AcceptOfferResponse.builder()
            .offerId(record.getOfferId())
            .fulfillmentId(record.getFulfillmentId())
            .transaction(record.getTransaction())
            .paymentStatus(captured ? PAYMENT_CAPTURED : PAYMENT_CAPTURE_FAILED)
            .reconciliationRequired(!captured)
            .message(captured
                ? "Offer accepted and payment captured"
                : "Offer accepted; payment capture is pending reconciliation")
            .build();
    }

    /**
     * Re-attempt capture for a matched offer whose payment is still outstanding.
     * Capture is idempotent at the payment service, so a hold that was in fact
     * captured earlier is only recorded.
     *
     * @return true if the payment is now recorded as captured
     */
    public boolean retryCapture(Long offerId) {
        BuyerOffer offer = offerRepository.findById(offerId)
            .orElseThrow(() -> new OfferNotFoundException("Offer not found: " + offerId));

        if (offer.getStatus() != OfferStatus.MATCHED || !offer.getPaymentHold().isCapturePending()) {
            log.debug("Offer {} needs no capture (status={}, hold={})",
                     offerId, offer.getStatus(), offer.getPaymentHold().getStatus());
            return offer.getPaymentHold().isCaptured();
        }

        SettledTransactionDto transaction = transactionRepository.findByBuyerOfferId(offerId)
            .map(OfferDtoMapper::toDto)
            .orElseThrow(() -> new InvalidOfferStateException(
                "Offer " + offerId + " is matched but has no settled transaction"));

        // Escalate only once; an offer already flagged keeps its original reason
        boolean escalate = offer.getPaymentHold().getStatus() == HoldStatus.AUTHORIZED
            && !offer.isReconciliationRequired();

        log.info("Retrying capture for offer {} (hold {})", offerId, offer.getPaymentHold().getAuthorizationId());
        return captureAndRecord(offerId, offer.getPaymentHold().getAuthorizationId(), transaction, escalate);
    }

    private SettlementRecord writeSettlement(Long offerId, Long sellerId, AcceptOfferRequest request) {
        try {
            return settlementWriter.recordSettlement(offerId, sellerId, request);
        } catch (OfferException e) {
            throw e;
        } catch (ConcurrencyFailureException e) {
            log.info("Seller {} lost the race for offer {}", sellerId, offerId);
            throw new OfferNotAvailableException("Offer " + offerId + " is no longer available", e);
        } catch (DataIntegrityViolationException e) {
            // Unique buyer_offer_id: another settlement for this offer committed first
            log.info("Seller {} lost the race for offer {} at commit", sellerId, offerId);
            throw new OfferNotAvailableException("Offer " + offerId + " is no longer available", e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Settlement write failed for offer {} by seller {}", offerId, sellerId, e);
            throw new SettlementWriteFailedException("Settlement could not be recorded, offer remains open", e);
        }
    }

    private boolean captureAndRecord(Long offerId, String authorizationId,
                                     SettledTransactionDto transaction, boolean escalate) {
        try {
            paymentService.capture(authorizationId);
        } catch (RuntimeException e) {
            String reason = captureFailureReason(e);
            log.error("Capture failed for offer {} hold {}: {}; escalating to reconciliation",
                    offerId, authorizationId, reason, e);
            try {
                settlementWriter.markCaptureFailed(offerId, reason);
            } catch (RuntimeException markError) {
                log.error("Could not flag offer {} as capture-failed, reconciliation will pick it up",
                        offerId, markError);
            }
            if (escalate) {
                messagingService.publishReconciliationRequired(offerId, authorizationId, reason);
            }
            return false;
        }

        log.info("Payment captured for offer {} hold {}", offerId, authorizationId);

        // offer-matched goes out only from the call that records the capture
        boolean recorded;
        try {
            recorded = settlementWriter.markCaptured(offerId);
        } catch (RuntimeException e) {
            log.error("Hold {} captured but offer {} not updated, reconciliation will record it",
                    authorizationId, offerId, e);
            return true;
        }

        if (recorded) {
            messagingService.publishOfferMatched(transaction);
        } else {
            log.debug("Capture of offer {} was already recorded", offerId);
        }
        return true;
    }

    private static String captureFailureReason(RuntimeException e) {
        if (e instanceof PaymentAuthorizationException && ((PaymentAuthorizationException) e).isTimedOut()) {
            return "Capture timed out";
        }
        return OfferLifecycleService.abbreviate("Capture failed: " + e.getMessage());
    }
}
