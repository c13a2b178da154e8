package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.dto.CreateOfferRequest;
import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.Event;
import com.ticketexchange.common.entity.PaymentHold;
import com.ticketexchange.offer.payment.PaymentAuthorizationException;
import com.ticketexchange.offer.payment.PaymentAuthorizationService;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Owns buyer offer state transitions: creation behind a payment hold, buyer
 * cancellation, and expiry of offers nobody accepted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OfferLifecycleService {

    private static final int MAX_REASON_LENGTH = 200;

    private final BuyerOfferRepository offerRepository;
    private final EventRepository eventRepository;
    private final PaymentAuthorizationService paymentService;
    private final PricingEngine pricingEngine;
    private final InstantMatchHook instantMatchHook;
    private final OfferMessagingService messagingService;
    private final Clock clock;

    @Value("${offers.expiry.buffer-minutes:60}")
    private long expiryBufferMinutes;

    @Value("${offers.expiry.max-attempts:5}")
    private int maxExpiryAttempts;

    @Value("${offers.settlement.currency:usd}")
    private String currency;

    public enum ExpiryOutcome {
        EXPIRED, RETRY_SCHEDULED, ERRORED, SKIPPED
    }

    /**
     * Create an offer behind a hold of {@code maxPrice × quantity}.
     *
     * <p>The hold is requested before anything is written; a declined hold leaves no
     * offer behind. If the offer then fails to commit, the hold is released again.
     */
    @Transactional
    public BuyerOfferDto createOffer(Long buyerId, CreateOfferRequest request) {
        validateCreateRequest(request);

        Event event = eventRepository.findById(request.getEventId())
            .orElseThrow(() -> new EventNotAvailableException("Event not found: " + request.getEventId()));

        if (!event.acceptsOffers()) {
            throw new EventNotAvailableException("Event " + event.getId() + " is " + event.getStatus()
                + " and is not accepting offers");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = event.getEventDate().minusMinutes(expiryBufferMinutes);
        if (!expiresAt.isAfter(now)) {
            throw new EventNotAvailableException("Event " + event.getId() + " starts too soon to accept offers");
        }

        Integer quantity = request.getQuantity();
        Set<String> sections = new HashSet<>(request.getSections());
        PriceSuggestion suggestion = pricingEngine.suggest(event.getId(), sections, request.getMaxPrice(), quantity);

        BigDecimal holdAmount = BuyerOffer.holdAmount(request.getMaxPrice(), quantity);
        String authorizationId = placeHold(buyerId, request, holdAmount);

        AtomicReference<BuyerOfferDto> created = new AtomicReference<>();

        // Register before saving so a failed insert also releases the hold
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED && created.get() != null) {
                    triggerInstantMatch(created.get());
                } else {
                    log.warn("Offer for buyer {} was not persisted, releasing hold {}", buyerId, authorizationId);
                    releaseHoldQuietly(authorizationId);
                }
            }
        });

        BuyerOffer offer = BuyerOffer.builder()
            .buyerId(buyerId)
            .eventId(event.getId())
            .sections(sections)
            .maxPrice(request.getMaxPrice())
            .quantity(quantity)
            .suggestedPrice(suggestion.getSuggestedPrice())
            .acceptanceProbability(suggestion.getProbability())
            .paymentCustomerRef(request.getPaymentCustomerRef())
            .paymentHold(PaymentHold.authorized(authorizationId, holdAmount, now))
            .status(OfferStatus.ACTIVE)
            .expiresAt(expiresAt)
            .build();

        offer = offerRepository.save(offer);
        BuyerOfferDto dto = OfferDtoMapper.toDto(offer);
        created.set(dto);

        log.info("Offer created: id={} buyer={} event={} maxPrice={} quantity={} hold={}",
                offer.getId(), buyerId, event.getId(), request.getMaxPrice(), quantity, authorizationId);
        return dto;
    }

    /**
     * Cancel an active offer. The hold is released first; if the payment service
     * refuses, the offer stays active and the failure is reported.
     */
    @Transactional
    public BuyerOfferDto cancelOffer(Long offerId, Long buyerId) {
        BuyerOffer offer = offerRepository.findByIdForUpdate(offerId)
            .filter(o -> o.isOwnedBy(buyerId))
            .orElseThrow(() -> new OfferNotFoundException("Offer not found: " + offerId));

        if (!offer.isActive()) {
            throw new InvalidOfferStateException("Offer " + offerId + " is " + offer.getStatus()
                + " and can no longer be cancelled");
        }

        String authorizationId = offer.getPaymentHold().getAuthorizationId();
        try {
            paymentService.cancel(authorizationId);
        } catch (PaymentAuthorizationException e) {
            log.warn("Hold {} for offer {} could not be released, offer stays active", authorizationId, offerId, e);
            throw new HoldCancelFailedException("Could not release the payment hold, please retry", e);
        }

        offer.cancel(LocalDateTime.now(clock));
        offer = offerRepository.save(offer);
        BuyerOfferDto dto = OfferDtoMapper.toDto(offer);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                messagingService.publishOfferCancelled(dto);
            }
        });

        log.info("Offer cancelled: id={} buyer={} hold={}", offerId, buyerId, authorizationId);
        return dto;
    }

    /**
     * Expire one offer if it is still active and past its expiry. Runs in its own
     * transaction under the row lock so a concurrent accept or cancel wins cleanly.
     */
    @Transactional
    public ExpiryOutcome expireOffer(Long offerId) {
        LocalDateTime now = LocalDateTime.now(clock);
        BuyerOffer offer = offerRepository.findByIdForUpdate(offerId).orElse(null);

        if (offer == null || !offer.isActive() || !offer.isExpiredAt(now)) {
            return ExpiryOutcome.SKIPPED;
        }

        String authorizationId = offer.getPaymentHold().getAuthorizationId();
        try {
            paymentService.cancel(authorizationId);
        } catch (PaymentAuthorizationException e) {
            return recordExpiryFailure(offer, authorizationId, e);
        }

        offer.expire(now);
        offer = offerRepository.save(offer);
        BuyerOfferDto dto = OfferDtoMapper.toDto(offer);

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                messagingService.publishOfferExpired(dto);
            }
        });

        log.info("Offer expired: id={} hold={} released", offerId, authorizationId);
        return ExpiryOutcome.EXPIRED;
    }

    @Transactional(readOnly = true)
    public BuyerOfferDto getOffer(Long offerId, Long buyerId) {
        return offerRepository.findById(offerId)
            .filter(o -> o.isOwnedBy(buyerId))
            .map(OfferDtoMapper::toDto)
            .orElseThrow(() -> new OfferNotFoundException("Offer not found: " + offerId));
    }

    @Transactional(readOnly = true)
    public List<BuyerOfferDto> getBuyerOffers(Long buyerId) {
        return offerRepository.findByBuyerIdOrderByCreatedAtDesc(buyerId).stream()
            .map(OfferDtoMapper::toDto)
            .collect(Collectors.toList());
    }

    private ExpiryOutcome recordExpiryFailure(BuyerOffer offer, String authorizationId,
                                              PaymentAuthorizationException cause) {
        int attempts = offer.recordExpiryFailure();

        if (attempts < maxExpiryAttempts) {
            offerRepository.save(offer);
            log.warn("Hold {} for expired offer {} could not be released (attempt {}/{}), will retry",
                    authorizationId, offer.getId(), attempts, maxExpiryAttempts, cause);
            return ExpiryOutcome.RETRY_SCHEDULED;
        }

        String reason = abbreviate("Hold release failed after " + attempts + " attempts: " + cause.getMessage());
        offer.markErrored(reason);
        offerRepository.save(offer);

        Long offerId = offer.getId();
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                messagingService.publishReconciliationRequired(offerId, authorizationId, reason);
            }
        });

        log.error("Offer {} moved to ERROR: hold {} could not be released after {} attempts",
                offerId, authorizationId, attempts, cause);
        return ExpiryOutcome.ERRORED;
    }

    private String placeHold(Long buyerId, CreateOfferRequest request, BigDecimal holdAmount) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("buyerId", String.valueOf(buyerId));
        metadata.put("eventId", String.valueOf(request.getEventId()));
        metadata.put("quantity", String.valueOf(request.getQuantity()));
        metadata.put("maxPrice", request.getMaxPrice().toPlainString());

        try {
            return paymentService.hold(holdAmount, currency, request.getPaymentCustomerRef(), metadata);
        } catch (PaymentAuthorizationException e) {
            log.warn("Payment hold of {} declined for buyer {} (timedOut={})", holdAmount, buyerId, e.isTimedOut());
            throw new PaymentHoldFailedException("Payment hold failed: " + e.getMessage(), e);
        }
    }

    private void triggerInstantMatch(BuyerOfferDto offer) {
        try {
            instantMatchHook.checkForInstantMatch(offer);
        } catch (Exception e) {
            log.warn("Instant match check failed for offer {}", offer.getId(), e);
        }
    }

    private void releaseHoldQuietly(String authorizationId) {
        try {
            paymentService.cancel(authorizationId);
        } catch (Exception e) {
            log.error("Failed to release orphaned hold {}", authorizationId, e);
        }
    }

    private void validateCreateRequest(CreateOfferRequest request) {
        if (request.getEventId() == null) {
            throw new InvalidOfferException("Event ID is required");
        }
        if (request.getSections() == null || request.getSections().isEmpty()) {
            throw new InvalidOfferException("At least one section is required");
        }
        if (request.getMaxPrice() == null || request.getMaxPrice().signum() <= 0) {
            throw new InvalidOfferException("Max price must be greater than zero");
        }
        if (request.getQuantity() == null || request.getQuantity() < 1) {
            throw new InvalidOfferException("Quantity must be at least 1");
        }
    }

    static String abbreviate(String reason) {
        if (reason == null || reason.length() <= MAX_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_REASON_LENGTH);
    }
}
