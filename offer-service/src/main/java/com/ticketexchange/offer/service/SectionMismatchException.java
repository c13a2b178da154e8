package com.ticketexchange.offer.service;

public class SectionMismatchException extends OfferException {

    public SectionMismatchException(String message) {
        super(ErrorCode.SECTION_MISMATCH, message);
    }
}
