package com.ticketexchange.offer.payment;

import lombok.Getter;

@Getter
public class PaymentAuthorizationException extends RuntimeException {

    public enum Kind {
        HOLD_DECLINED, CAPTURE_FAILED, CANCEL_FAILED
    }

    private final Kind kind;
    private final String authorizationId;

    // Network failure or timeout: the outcome at the provider is unknown
    private final boolean timedOut;

    public PaymentAuthorizationException(Kind kind, String authorizationId, boolean timedOut,
                                         String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.authorizationId = authorizationId;
        this.timedOut = timedOut;
    }

    public PaymentAuthorizationException(Kind kind, String authorizationId, String message) {
        this(kind, authorizationId, false, message, null);
    }
}
