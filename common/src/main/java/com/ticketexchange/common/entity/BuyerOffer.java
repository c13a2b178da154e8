package com.ticketexchange.common.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * A buyer's standing commitment to pay up to {@code maxPrice} per ticket for
 * {@code quantity} tickets in any of the desired sections.
 *
 * <p>Lifecycle: ACTIVE moves to exactly one of MATCHED, CANCELLED, EXPIRED or ERROR,
 * all of which are terminal. Offers are never deleted.
 */
@Entity
@Table(name = "buyer_offers", indexes = {
    @Index(name = "idx_offer_buyer", columnList = "buyer_id"),
    @Index(name = "idx_offer_event_status", columnList = "event_id, status"),
    @Index(name = "idx_offer_status_expiry", columnList = "status, expires_at"),
    @Index(name = "idx_offer_hold_status", columnList = "hold_status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuyerOffer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @NotNull
    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @NotEmpty
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "buyer_offer_sections",
        joinColumns = @JoinColumn(name = "offer_id")
    )
    @Column(name = "section", nullable = false)
    @Builder.Default
    private Set<String> sections = new HashSet<>();

    @NotNull
    @DecimalMin("0.01")
    @Column(name = "max_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal maxPrice;

    @NotNull
    @Min(1)
    @Column(nullable = false)
    private Integer quantity;

    // Written once at creation by the pricing engine
    @Column(name = "suggested_price", precision = 10, scale = 2, updatable = false)
    private BigDecimal suggestedPrice;

    @Column(name = "acceptance_probability", updatable = false)
    private Double acceptanceProbability;

    @Size(max = 100)
    @Column(name = "payment_customer_ref")
    private String paymentCustomerRef;

    @Embedded
    private PaymentHold paymentHold;

    @NotNull
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OfferStatus status;

    @NotNull
    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "matched_at")
    private LocalDateTime matchedAt;

    @Column(name = "matched_fulfillment_id")
    private Long matchedFulfillmentId;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "expired_at")
    private LocalDateTime expiredAt;

    @Column(name = "reconciliation_required", nullable = false)
    @Builder.Default
    private boolean reconciliationRequired = false;

    @Size(max = 500)
    @Column(name = "reconciliation_reason", length = 500)
    private String reconciliationReason;

    @Column(name = "expiry_attempts", nullable = false)
    @Builder.Default
    private int expiryAttempts = 0;

    @Column(name = "view_count", nullable = false)
    @Builder.Default
    private long viewCount = 0L;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    public enum OfferStatus {
        ACTIVE, MATCHED, CANCELLED, EXPIRED, ERROR
    }

    /**
     * Amount reserved on the buyer's payment method: max unit price times quantity.
     */
    public static BigDecimal holdAmount(BigDecimal maxPrice, int quantity) {
        return maxPrice.multiply(BigDecimal.valueOf(quantity));
    }

    // Helper methods
    public boolean isActive() {
        return status == OfferStatus.ACTIVE;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isAvailableAt(LocalDateTime now) {
        return isActive() && !isExpiredAt(now);
    }

    public boolean acceptsSection(String section) {
        return section != null && sections.contains(section);
    }

    public boolean isOwnedBy(Long userId) {
        return buyerId != null && buyerId.equals(userId);
    }

    public void match(Long fulfillmentId, LocalDateTime now) {
        transitionTo(OfferStatus.MATCHED);
        this.matchedFulfillmentId = fulfillmentId;
        this.matchedAt = now;
    }

    public void cancel(LocalDateTime now) {
        transitionTo(OfferStatus.CANCELLED);
        this.cancelledAt = now;
        paymentHold.cancel(now);
    }

    public void expire(LocalDateTime now) {
        transitionTo(OfferStatus.EXPIRED);
        this.expiredAt = now;
        paymentHold.cancel(now);
    }

    public void markErrored(String reason) {
        transitionTo(OfferStatus.ERROR);
        flagForReconciliation(reason);
    }

    public void recordCaptured(LocalDateTime now) {
        paymentHold.capture(now);
        this.reconciliationRequired = false;
        this.reconciliationReason = null;
    }

    public void recordCaptureFailed(String reason) {
        paymentHold.captureFailed();
        flagForReconciliation(reason);
    }

    public int recordExpiryFailure() {
        return ++expiryAttempts;
    }

    public void flagForReconciliation(String reason) {
        this.reconciliationRequired = true;
        this.reconciliationReason = reason;
    }

    private void transitionTo(OfferStatus target) {
        if (status != OfferStatus.ACTIVE) {
            throw new IllegalStateException(
                "Offer " + id + " is " + status + " and cannot move to " + target);
        }
        this.status = target;
    }
}
