package com.ticketexchange.offer.service;

public class PaymentHoldFailedException extends OfferException {

    public PaymentHoldFailedException(String message) {
        super(ErrorCode.PAYMENT_HOLD_FAILED, message);
    }

    public PaymentHoldFailedException(String message, Throwable cause) {
        super(ErrorCode.PAYMENT_HOLD_FAILED, message, cause);
    }
}
