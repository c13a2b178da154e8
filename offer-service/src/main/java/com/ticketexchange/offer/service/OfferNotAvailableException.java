package com.ticketexchange.offer.service;

public class OfferNotAvailableException extends OfferException {

    public OfferNotAvailableException(String message) {
        super(ErrorCode.OFFER_NOT_AVAILABLE, message);
    }

    public OfferNotAvailableException(String message, Throwable cause) {
        super(ErrorCode.OFFER_NOT_AVAILABLE, message, cause);
    }
}
