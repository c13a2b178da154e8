package com.ticketexchange.common.entity;

import com.ticketexchange.common.enums.DeliveryMethod;
import jakarta.persistence.*;
import jakarta.validation.constraints.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Financial record of a match. Exactly one exists per matched offer (unique on
 * {@code buyer_offer_id}) and it is never updated after insert.
 */
@Entity
@Table(name = "settled_transactions", indexes = {
    @Index(name = "idx_txn_buyer", columnList = "buyer_id"),
    @Index(name = "idx_txn_seller", columnList = "seller_id"),
    @Index(name = "idx_txn_event", columnList = "event_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_txn_buyer_offer", columnNames = "buyer_offer_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettledTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Size(max = 100)
    @Column(name = "transaction_reference", nullable = false, unique = true, updatable = false)
    private String transactionReference;

    @NotNull
    @Column(name = "buyer_id", nullable = false, updatable = false)
    private Long buyerId;

    @NotNull
    @Column(name = "seller_id", nullable = false, updatable = false)
    private Long sellerId;

    @NotNull
    @Column(name = "buyer_offer_id", nullable = false, updatable = false)
    private Long buyerOfferId;

    @NotNull
    @Column(name = "seller_fulfillment_id", nullable = false, updatable = false)
    private Long sellerFulfillmentId;

    @NotNull
    @Column(name = "event_id", nullable = false, updatable = false)
    private Long eventId;

    @NotBlank
    @Column(nullable = false, length = 50, updatable = false)
    private String section;

    @Column(name = "row_label", length = 20, updatable = false)
    private String row;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "settled_transaction_seats",
        joinColumns = @JoinColumn(name = "transaction_id")
    )
    @OrderColumn(name = "seat_order")
    @Column(name = "seat", nullable = false)
    @Builder.Default
    private List<String> seats = new ArrayList<>();

    @NotNull
    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @NotNull
    @Column(name = "sale_price", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal salePrice;

    @NotNull
    @Column(name = "buyer_paid", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal buyerPaid;

    @NotNull
    @Column(name = "seller_fee", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal sellerFee;

    @NotNull
    @Column(name = "seller_payout", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal sellerPayout;

    @NotBlank
    @Column(name = "payment_authorization_id", nullable = false, length = 100, updatable = false)
    private String paymentAuthorizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_method", length = 30, updatable = false)
    private DeliveryMethod deliveryMethod;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
