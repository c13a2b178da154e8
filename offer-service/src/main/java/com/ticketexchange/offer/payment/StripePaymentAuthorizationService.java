package com.ticketexchange.offer.payment;

import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.PaymentIntent;
import com.stripe.net.RequestOptions;
import com.stripe.param.PaymentIntentCancelParams;
import com.stripe.param.PaymentIntentCaptureParams;
import com.stripe.param.PaymentIntentCreateParams;
import com.ticketexchange.common.util.TokenGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Holds are Stripe PaymentIntents created with manual capture. Every call carries bounded
 * connect/read timeouts; capture and cancel are keyed on the PaymentIntent id so Stripe
 * deduplicates retries, and both check the intent state first so a repeated call is a no-op.
 */
@Service
@Slf4j
public class StripePaymentAuthorizationService implements PaymentAuthorizationService {

    static final String STATUS_SUCCEEDED = "succeeded";
    static final String STATUS_CANCELED = "canceled";

    private final String apiKey;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final int maxNetworkRetries;

    public StripePaymentAuthorizationService(
            @Value("${payment.stripe.api-key}") String apiKey,
            @Value("${payment.stripe.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${payment.stripe.read-timeout-ms:15000}") int readTimeoutMs,
            @Value("${payment.stripe.max-network-retries:2}") int maxNetworkRetries) {
        this.apiKey = apiKey;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.maxNetworkRetries = maxNetworkRetries;
    }

    @Override
    public String hold(BigDecimal amount, String currency, String payerRef, Map<String, String> metadata) {
        PaymentIntentCreateParams.Builder params = PaymentIntentCreateParams.builder()
            .setAmount(toMinorUnits(amount))
            .setCurrency(currency)
            .setCaptureMethod(PaymentIntentCreateParams.CaptureMethod.MANUAL)
            .putAllMetadata(metadata);
        if (payerRef != null) {
            params.setCustomer(payerRef);
        }

        try {
            PaymentIntent intent = PaymentIntent.create(params.build(),
                requestOptions(TokenGenerator.generateIdempotencyKey()));
            log.info("Payment hold authorized: authorization={} amount={} {}", intent.getId(), amount, currency);
            return intent.getId();
        } catch (StripeException e) {
            log.warn("Payment hold declined for payer={} amount={}: {}", payerRef, amount, e.getMessage());
            throw new PaymentAuthorizationException(PaymentAuthorizationException.Kind.HOLD_DECLINED,
                null, isTimeout(e), "Payment hold declined: " + e.getMessage(), e);
        }
    }

    @Override
    public void capture(String authorizationId) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(authorizationId, requestOptions(null));

            if (STATUS_SUCCEEDED.equals(intent.getStatus())) {
                log.info("Authorization {} already captured, nothing to do", authorizationId);
                return;
            }
            if (STATUS_CANCELED.equals(intent.getStatus())) {
                throw new PaymentAuthorizationException(PaymentAuthorizationException.Kind.CAPTURE_FAILED,
                    authorizationId, "Authorization " + authorizationId + " was cancelled and cannot be captured");
            }

            intent.capture(PaymentIntentCaptureParams.builder().build(),
                requestOptions("capture-" + authorizationId));
            log.info("Payment captured: authorization={}", authorizationId);

        } catch (StripeException e) {
            throw new PaymentAuthorizationException(PaymentAuthorizationException.Kind.CAPTURE_FAILED,
                authorizationId, isTimeout(e), "Capture failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void cancel(String authorizationId) {
        try {
            PaymentIntent intent = PaymentIntent.retrieve(authorizationId, requestOptions(null));

            if (STATUS_CANCELED.equals(intent.getStatus())) {
                log.info("Authorization {} already cancelled, nothing to do", authorizationId);
                return;
            }
            if (STATUS_SUCCEEDED.equals(intent.getStatus())) {
                throw new PaymentAuthorizationException(PaymentAuthorizationException.Kind.CANCEL_FAILED,
                    authorizationId, "Authorization " + authorizationId + " was already captured");
            }

            intent.cancel(PaymentIntentCancelParams.builder().build(),
                requestOptions("cancel-" + authorizationId));
            log.info("Payment hold cancelled: authorization={}", authorizationId);

        } catch (StripeException e) {
            throw new PaymentAuthorizationException(PaymentAuthorizationException.Kind.CANCEL_FAILED,
                authorizationId, isTimeout(e), "Hold cancellation failed: " + e.getMessage(), e);
        }
    }

    private RequestOptions requestOptions(String idempotencyKey) {
        RequestOptions.RequestOptionsBuilder builder = RequestOptions.builder()
            .setApiKey(apiKey)
            .setConnectTimeout(connectTimeoutMs)
            .setReadTimeout(readTimeoutMs)
            .setMaxNetworkRetries(maxNetworkRetries);
        if (idempotencyKey != null) {
            builder.setIdempotencyKey(idempotencyKey);
        }
        return builder.build();
    }

    // Stripe amounts are in the currency's minor unit
    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static boolean isTimeout(StripeException e) {
        return e instanceof ApiConnectionException;
    }
}
