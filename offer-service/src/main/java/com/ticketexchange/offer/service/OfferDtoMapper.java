package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.dto.SellerFulfillmentDto;
import com.ticketexchange.common.dto.SettledTransactionDto;
import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.PaymentHold;
import com.ticketexchange.common.entity.SellerFulfillment;
import com.ticketexchange.common.entity.SettledTransaction;

import java.util.HashSet;
import java.util.List;

final class OfferDtoMapper {

    private OfferDtoMapper() {
    }

    static BuyerOfferDto toDto(BuyerOffer offer) {
        PaymentHold hold = offer.getPaymentHold();
        return BuyerOfferDto.builder()
            .id(offer.getId())
            .buyerId(offer.getBuyerId())
            .eventId(offer.getEventId())
            .sections(new HashSet<>(offer.getSections()))
            .maxPrice(offer.getMaxPrice())
            .quantity(offer.getQuantity())
            .suggestedPrice(offer.getSuggestedPrice())
            .acceptanceProbability(offer.getAcceptanceProbability())
            .paymentAuthorizationId(hold != null ? hold.getAuthorizationId() : null)
            .heldAmount(hold != null ? hold.getAmount() : null)
            .holdStatus(hold != null && hold.getStatus() != null ? hold.getStatus().name() : null)
            .status(offer.getStatus().name())
            .expiresAt(offer.getExpiresAt())
            .matchedAt(offer.getMatchedAt())
            .matchedFulfillmentId(offer.getMatchedFulfillmentId())
            .reconciliationRequired(offer.isReconciliationRequired())
            .viewCount(offer.getViewCount())
            .createdAt(offer.getCreatedAt())
            .build();
    }

    static SettledTransactionDto toDto(SettledTransaction transaction) {
        return SettledTransactionDto.builder()
            .id(transaction.getId())
            .transactionReference(transaction.getTransactionReference())
            .buyerId(transaction.getBuyerId())
            .sellerId(transaction.getSellerId())
            .buyerOfferId(transaction.getBuyerOfferId())
            .sellerFulfillmentId(transaction.getSellerFulfillmentId())
            .eventId(transaction.getEventId())
            .section(transaction.getSection())
            .row(transaction.getRow())
            .seats(List.copyOf(transaction.getSeats()))
            .quantity(transaction.getQuantity())
            .salePrice(transaction.getSalePrice())
            .buyerPaid(transaction.getBuyerPaid())
            .sellerFee(transaction.getSellerFee())
            .sellerPayout(transaction.getSellerPayout())
            .paymentAuthorizationId(transaction.getPaymentAuthorizationId())
            .deliveryMethod(transaction.getDeliveryMethod() != null ? transaction.getDeliveryMethod().name() : null)
            .createdAt(transaction.getCreatedAt())
            .build();
    }

    static SellerFulfillmentDto toDto(SellerFulfillment fulfillment) {
        return SellerFulfillmentDto.builder()
            .id(fulfillment.getId())
            .sellerId(fulfillment.getSellerId())
            .eventId(fulfillment.getEventId())
            .section(fulfillment.getSection())
            .row(fulfillment.getRow())
            .seats(List.copyOf(fulfillment.getSeats()))
            .quantity(fulfillment.getQuantity())
            .askingPrice(fulfillment.getAskingPrice())
            .deliveryMethod(fulfillment.getDeliveryMethod() != null ? fulfillment.getDeliveryMethod().name() : null)
            .status(fulfillment.getStatus().name())
            .live(fulfillment.isLive())
            .goLiveAt(fulfillment.getGoLiveAt())
            .createdAt(fulfillment.getCreatedAt())
            .build();
    }
}
