package com.ticketexchange.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuyerOfferDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long buyerId;
    private Long eventId;
    private Set<String> sections;
    private BigDecimal maxPrice;
    private Integer quantity;
    private BigDecimal suggestedPrice;
    private Double acceptanceProbability;

    private String paymentAuthorizationId;
    private BigDecimal heldAmount;
    private String holdStatus; // AUTHORIZED, CAPTURED, CANCELLED, CAPTURE_FAILED

    private String status; // ACTIVE, MATCHED, CANCELLED, EXPIRED, ERROR

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime expiresAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime matchedAt;

    private Long matchedFulfillmentId;
    private boolean reconciliationRequired;
    private long viewCount;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;

    public boolean isActive() {
        return "ACTIVE".equals(status);
    }

    public boolean isMatched() {
        return "MATCHED".equals(status);
    }
}
