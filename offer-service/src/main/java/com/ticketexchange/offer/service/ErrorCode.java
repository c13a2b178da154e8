package com.ticketexchange.offer.service;

import org.springframework.http.HttpStatus;

/**
 * Machine-checkable failure kinds returned to API clients.
 */
public enum ErrorCode {
    OFFER_NOT_FOUND(HttpStatus.NOT_FOUND),
    EVENT_NOT_AVAILABLE(HttpStatus.BAD_REQUEST),
    INVALID_OFFER(HttpStatus.BAD_REQUEST),
    INVALID_OFFER_STATE(HttpStatus.CONFLICT),
    OFFER_NOT_AVAILABLE(HttpStatus.CONFLICT),
    SECTION_MISMATCH(HttpStatus.BAD_REQUEST),
    PAYMENT_HOLD_FAILED(HttpStatus.PAYMENT_REQUIRED),
    HOLD_CANCEL_FAILED(HttpStatus.BAD_GATEWAY),
    SETTLEMENT_WRITE_FAILED(HttpStatus.SERVICE_UNAVAILABLE);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
