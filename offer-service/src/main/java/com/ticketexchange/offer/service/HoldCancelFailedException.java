package com.ticketexchange.offer.service;

public class HoldCancelFailedException extends OfferException {

    public HoldCancelFailedException(String message) {
        super(ErrorCode.HOLD_CANCEL_FAILED, message);
    }

    public HoldCancelFailedException(String message, Throwable cause) {
        super(ErrorCode.HOLD_CANCEL_FAILED, message, cause);
    }
}
