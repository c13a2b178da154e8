package com.ticketexchange.common.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One seller looking at one offer. Insert-only so browsing never rewrites the offer row.
 */
@Entity
@Table(name = "offer_views", indexes = {
    @Index(name = "idx_view_offer", columnList = "offer_id, viewed_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OfferView {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "offer_id", nullable = false)
    private Long offerId;

    @Column(name = "viewer_id", nullable = false)
    private Long viewerId;

    @Column(name = "viewed_at", nullable = false)
    private LocalDateTime viewedAt;
}
