package com.ticketexchange.offer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.dto.SettledTransactionDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget offer notifications. Publishing failures are logged and never reach
 * the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OfferMessagingService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topics.offer-created:offer-created}")
    private String offerCreatedTopic;

    @Value("${kafka.topics.offer-cancelled:offer-cancelled}")
    private String offerCancelledTopic;

    @Value("${kafka.topics.offer-expired:offer-expired}")
    private String offerExpiredTopic;

    @Value("${kafka.topics.offer-matched:offer-matched}")
    private String offerMatchedTopic;

    @Value("${kafka.topics.payment-reconciliation-required:payment-reconciliation-required}")
    private String reconciliationRequiredTopic;

    /**
     * Publish offer created event (consumed by the instant-match search)
     */
    public void publishOfferCreated(BuyerOfferDto offer) {
        send(offerCreatedTopic, String.valueOf(offer.getId()), createOfferEvent(offer, "CREATED"));
    }

    /**
     * Publish offer cancelled event
     */
    public void publishOfferCancelled(BuyerOfferDto offer) {
        send(offerCancelledTopic, String.valueOf(offer.getId()), createOfferEvent(offer, "CANCELLED"));
    }

    /**
     * Publish offer expired event (hold released by the expiry sweep)
     */
    public void publishOfferExpired(BuyerOfferDto offer) {
        send(offerExpiredTopic, String.valueOf(offer.getId()), createOfferEvent(offer, "EXPIRED"));
    }

    /**
     * Publish match notification for buyer and seller
     */
    public void publishOfferMatched(SettledTransactionDto transaction) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "OFFER_MATCHED");
        event.put("transactionReference", transaction.getTransactionReference());
        event.put("offerId", transaction.getBuyerOfferId());
        event.put("fulfillmentId", transaction.getSellerFulfillmentId());
        event.put("buyerId", transaction.getBuyerId());
        event.put("sellerId", transaction.getSellerId());
        event.put("eventId", transaction.getEventId());
        event.put("section", transaction.getSection());
        event.put("row", transaction.getRow());
        event.put("seats", transaction.getSeats());
        event.put("quantity", transaction.getQuantity());
        event.put("salePrice", transaction.getSalePrice());
        event.put("sellerPayout", transaction.getSellerPayout());
        event.put("deliveryMethod", transaction.getDeliveryMethod());
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", "offer-service");

        send(offerMatchedTopic, transaction.getTransactionReference(), event);
    }

    /**
     * Publish escalation for a settlement whose payment state needs operator follow-up
     */
    public void publishReconciliationRequired(Long offerId, String authorizationId, String reason) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "PAYMENT_RECONCILIATION_REQUIRED");
        event.put("offerId", offerId);
        event.put("authorizationId", authorizationId);
        event.put("reason", reason);
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", "offer-service");

        send(reconciliationRequiredTopic, String.valueOf(offerId), event);
    }

    private void send(String topic, String key, Map<String, Object> event) {
        try {
            String eventJson = objectMapper.writeValueAsString(event);

            CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(topic, key, eventJson);

            future.whenComplete((result, throwable) -> {
                if (throwable != null) {
                    log.error("Failed to publish {} event: {}", topic, key, throwable);
                } else {
                    log.debug("Published {} event: {} to partition: {}",
                             topic, key, result.getRecordMetadata().partition());
                }
            });

        } catch (Exception e) {
            log.error("Error creating {} event: {}", topic, key, e);
        }
    }

    private Map<String, Object> createOfferEvent(BuyerOfferDto offer, String eventType) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", "OFFER_" + eventType);
        event.put("offerId", offer.getId());
        event.put("buyerId", offer.getBuyerId());
        event.put("eventId", offer.getEventId());
        event.put("sections", offer.getSections());
        event.put("maxPrice", offer.getMaxPrice());
        event.put("quantity", offer.getQuantity());
        event.put("status", offer.getStatus());
        event.put("expiresAt", offer.getExpiresAt());
        event.put("timestamp", System.currentTimeMillis());
        event.put("source", "offer-service");
        return event;
    }
}
