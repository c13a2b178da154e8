package com.ticketexchange.offer.service;

import lombok.Getter;

@Getter
public class OfferException extends RuntimeException {

    private final ErrorCode errorCode;

    public OfferException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public OfferException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
