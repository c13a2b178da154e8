package com.ticketexchange.common.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AcceptOfferResponse {

    private Long offerId;
    private Long fulfillmentId;
    private SettledTransactionDto transaction;

    // CAPTURED, or CAPTURE_FAILED when the payment is pending reconciliation
    private String paymentStatus;
    private boolean reconciliationRequired;

    private String message;
}
