package com.ticketexchange.offer.service;

public class SettlementWriteFailedException extends OfferException {

    public SettlementWriteFailedException(String message) {
        super(ErrorCode.SETTLEMENT_WRITE_FAILED, message);
    }

    public SettlementWriteFailedException(String message, Throwable cause) {
        super(ErrorCode.SETTLEMENT_WRITE_FAILED, message, cause);
    }
}
