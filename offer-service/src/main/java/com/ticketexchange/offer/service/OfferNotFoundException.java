package com.ticketexchange.offer.service;

public class OfferNotFoundException extends OfferException {

    public OfferNotFoundException(String message) {
        super(ErrorCode.OFFER_NOT_FOUND, message);
    }
}
