package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.AcceptOfferRequest;
import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.SellerFulfillment;
import com.ticketexchange.common.entity.SellerFulfillment.FulfillmentStatus;
import com.ticketexchange.common.entity.SettledTransaction;
import com.ticketexchange.common.util.SettlementTerms;
import com.ticketexchange.common.util.TokenGenerator;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.repository.SellerFulfillmentRepository;
import com.ticketexchange.offer.repository.SettledTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Store-side half of settlement. Each public method is one transaction; the payment
 * capture in between is driven by {@link OfferSettlementService}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SettlementWriter {

    private final BuyerOfferRepository offerRepository;
    private final SellerFulfillmentRepository fulfillmentRepository;
    private final SettledTransactionRepository transactionRepository;
    private final Clock clock;

    @Value("${offers.settlement.fee-rate:0.10}")
    private BigDecimal feeRate;

    /**
     * Lock the offer row, re-validate it, and write fulfillment, transaction and the
     * matched offer together. Nothing is visible unless all three commit.
     */
    @Transactional
    public SettlementRecord recordSettlement(Long offerId, Long sellerId, AcceptOfferRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);

        // A missing offer is reported like one that is no longer open
        BuyerOffer offer = offerRepository.findByIdForUpdate(offerId)
            .orElseThrow(() -> new OfferNotAvailableException("Offer " + offerId + " is not available"));

        if (!offer.isAvailableAt(now)) {
            throw new OfferNotAvailableException("Offer " + offerId + " is no longer available");
        }
        if (offer.isOwnedBy(sellerId)) {
            throw new InvalidOfferException("Sellers cannot accept their own offer");
        }
        if (!offer.acceptsSection(request.getSection())) {
            throw new SectionMismatchException("Section " + request.getSection()
                + " is not one of the offer's sections " + offer.getSections());
        }

        List<String> seats = request.getSeats() != null ? new ArrayList<>(request.getSeats()) : new ArrayList<>();
        if (!seats.isEmpty() && seats.size() != offer.getQuantity()) {
            throw new InvalidOfferException("Offer is for " + offer.getQuantity()
                + " tickets but " + seats.size() + " seats were assigned");
        }

        SellerFulfillment fulfillment = SellerFulfillment.builder()
            .sellerId(sellerId)
            .eventId(offer.getEventId())
            .section(request.getSection())
            .row(request.getRow())
            .seats(seats)
            .quantity(offer.getQuantity())
            .askingPrice(offer.getMaxPrice())
            .deliveryMethod(request.getDeliveryMethod())
            .deliveryDetails(request.getDeliveryDetails())
            .status(FulfillmentStatus.MATCHED)
            .live(false)
            .build();
        fulfillment = fulfillmentRepository.save(fulfillment);

        offer.match(fulfillment.getId(), now);
        offerRepository.save(offer);

        SettlementTerms terms = SettlementTerms.of(offer.getMaxPrice(), feeRate);
        String authorizationId = offer.getPaymentHold().getAuthorizationId();

        SettledTransaction transaction = SettledTransaction.builder()
            .transactionReference(TokenGenerator.generateTransactionReference())
            .buyerId(offer.getBuyerId())
            .sellerId(sellerId)
            .buyerOfferId(offerId)
            .sellerFulfillmentId(fulfillment.getId())
            .eventId(offer.getEventId())
            .section(request.getSection())
            .row(request.getRow())
            .seats(new ArrayList<>(seats))
            .quantity(offer.getQuantity())
            .salePrice(terms.getSalePrice())
            .buyerPaid(offer.getPaymentHold().getAmount())
            .sellerFee(terms.getSellerFee())
            .sellerPayout(terms.getSellerPayout())
            .paymentAuthorizationId(authorizationId)
            .deliveryMethod(request.getDeliveryMethod())
            .build();
        transaction = transactionRepository.save(transaction);

        log.info("Settlement written: offer={} seller={} fulfillment={} txn={} salePrice={} fee={}",
                offerId, sellerId, fulfillment.getId(), transaction.getTransactionReference(),
                terms.getSalePrice(), terms.getSellerFee());

        return new SettlementRecord(offerId, fulfillment.getId(), authorizationId, OfferDtoMapper.toDto(transaction));
    }

    /**
     * Record a successful capture. Returns false if the hold was already captured.
     */
    @Transactional
    public boolean markCaptured(Long offerId) {
        BuyerOffer offer = offerRepository.findByIdForUpdate(offerId)
            .orElseThrow(() -> new OfferNotFoundException("Offer not found: " + offerId));

        if (offer.getPaymentHold().isCaptured()) {
            return false;
        }
        offer.recordCaptured(LocalDateTime.now(clock));
        offerRepository.save(offer);
        return true;
    }

    /**
     * Mark the hold capture-failed and raise the reconciliation flag. A hold that was
     * captured in the meantime is left alone.
     */
    @Transactional
    public boolean markCaptureFailed(Long offerId, String reason) {
        BuyerOffer offer = offerRepository.findByIdForUpdate(offerId)
            .orElseThrow(() -> new OfferNotFoundException("Offer not found: " + offerId));

        if (offer.getPaymentHold().isCaptured()) {
            return false;
        }
        offer.recordCaptureFailed(reason);
        offerRepository.save(offer);
        return true;
    }
}
