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
 * Seller ticket allocation. Records created by accepting an offer are MATCHED and
 * never change afterwards; bulk-uploaded listings start as DRAFT or ACTIVE.
 */
@Entity
@Table(name = "seller_fulfillments", indexes = {
    @Index(name = "idx_fulfillment_seller", columnList = "seller_id"),
    @Index(name = "idx_fulfillment_event", columnList = "event_id"),
    @Index(name = "idx_fulfillment_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SellerFulfillment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotNull
    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @NotNull
    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @NotBlank
    @Size(max = 50)
    @Column(nullable = false, length = 50)
    private String section;

    @Size(max = 20)
    @Column(name = "row_label", length = 20)
    private String row;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
        name = "fulfillment_seats",
        joinColumns = @JoinColumn(name = "fulfillment_id")
    )
    @OrderColumn(name = "seat_order")
    @Column(name = "seat", nullable = false)
    @Builder.Default
    private List<String> seats = new ArrayList<>();

    @NotNull
    @Min(1)
    @Column(nullable = false)
    private Integer quantity;

    @NotNull
    @DecimalMin("0.01")
    @Column(name = "asking_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal askingPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_method", length = 30)
    private DeliveryMethod deliveryMethod;

    @Size(max = 1000)
    @Column(name = "delivery_details", length = 1000)
    private String deliveryDetails;

    @NotNull
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private FulfillmentStatus status;

    @Column(name = "go_live_at")
    private LocalDateTime goLiveAt;

    @Column(name = "is_live", nullable = false)
    private boolean live;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public enum FulfillmentStatus {
        DRAFT, ACTIVE, MATCHED
    }

    public boolean isMatched() {
        return status == FulfillmentStatus.MATCHED;
    }
}
