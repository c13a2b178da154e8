package com.ticketexchange.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Reversible authorization of buyer funds taken when an offer is created.
 * The authorization id doubles as the dedup key for capture and cancel calls.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentHold {

    @Column(name = "payment_authorization_id", nullable = false, length = 100)
    private String authorizationId;

    @Column(name = "held_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "hold_status", nullable = false, length = 20)
    private HoldStatus status;

    @Column(name = "authorized_at", nullable = false)
    private LocalDateTime authorizedAt;

    @Column(name = "captured_at")
    private LocalDateTime capturedAt;

    @Column(name = "hold_cancelled_at")
    private LocalDateTime cancelledAt;

    public enum HoldStatus {
        AUTHORIZED, CAPTURED, CANCELLED, CAPTURE_FAILED
    }

    public static PaymentHold authorized(String authorizationId, BigDecimal amount, LocalDateTime authorizedAt) {
        return PaymentHold.builder()
            .authorizationId(authorizationId)
            .amount(amount)
            .status(HoldStatus.AUTHORIZED)
            .authorizedAt(authorizedAt)
            .build();
    }

    public boolean isCaptured() {
        return status == HoldStatus.CAPTURED;
    }

    public boolean isCapturePending() {
        return status == HoldStatus.AUTHORIZED || status == HoldStatus.CAPTURE_FAILED;
    }

    public void capture(LocalDateTime now) {
        this.status = HoldStatus.CAPTURED;
        this.capturedAt = now;
    }

    public void captureFailed() {
        this.status = HoldStatus.CAPTURE_FAILED;
    }

    public void cancel(LocalDateTime now) {
        this.status = HoldStatus.CANCELLED;
        this.cancelledAt = now;
    }
}
