package com.ticketexchange.offer.service;

public class InvalidOfferStateException extends OfferException {

    public InvalidOfferStateException(String message) {
        super(ErrorCode.INVALID_OFFER_STATE, message);
    }
}
