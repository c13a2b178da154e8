package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.SettledTransactionDto;
import lombok.Value;

/**
 * Committed outcome of a settlement write, carried to the capture step.
 */
@Value
public class SettlementRecord {

    Long offerId;
    Long fulfillmentId;
    String authorizationId;
    SettledTransactionDto transaction;
}
