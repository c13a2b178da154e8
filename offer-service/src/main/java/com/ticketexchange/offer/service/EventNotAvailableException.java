package com.ticketexchange.offer.service;

public class EventNotAvailableException extends OfferException {

    public EventNotAvailableException(String message) {
        super(ErrorCode.EVENT_NOT_AVAILABLE, message);
    }
}
