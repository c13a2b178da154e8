package com.ticketexchange.common.util;

import java.util.UUID;

public class TokenGenerator {

    /**
     * Generate a settled transaction reference
     */
    public static String generateTransactionReference() {
        return "TXN_" + UUID.randomUUID().toString().replace("-", "").toUpperCase();
    }

    /**
     * Generate idempotency key for a new payment hold
     */
    public static String generateIdempotencyKey() {
        return UUID.randomUUID().toString();
    }
}
