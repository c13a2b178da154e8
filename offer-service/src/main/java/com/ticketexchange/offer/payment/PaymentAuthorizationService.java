package com.ticketexchange.offer.payment;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Reversible fund holds against a payer's payment method.
 *
 * <p>All three operations may be retried by the caller; capture and cancel use the
 * authorization id as their dedup key, so repeating a successful call has no further effect.
 */
public interface PaymentAuthorizationService {

    /**
     * Reserve {@code amount} on the payer's payment method without transferring it.
     *
     * @return the authorization id of the new hold
     * @throws PaymentAuthorizationException with kind HOLD_DECLINED if no hold was placed
     */
    String hold(BigDecimal amount, String currency, String payerRef, Map<String, String> metadata);

    /**
     * Convert a hold into a funds transfer. Capturing an already captured hold succeeds.
     *
     * @throws PaymentAuthorizationException with kind CAPTURE_FAILED
     */
    void capture(String authorizationId);

    /**
     * Release a hold. Cancelling an already cancelled hold succeeds.
     *
     * @throws PaymentAuthorizationException with kind CANCEL_FAILED
     */
    void cancel(String authorizationId);
}
