package com.ticketexchange.offer.service;

public class InvalidOfferException extends OfferException {

    public InvalidOfferException(String message) {
        super(ErrorCode.INVALID_OFFER, message);
    }
}
