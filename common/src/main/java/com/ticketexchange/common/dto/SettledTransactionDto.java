package com.ticketexchange.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettledTransactionDto implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private String transactionReference;
    private Long buyerId;
    private Long sellerId;
    private Long buyerOfferId;
    private Long sellerFulfillmentId;
    private Long eventId;
    private String section;
    private String row;
    private List<String> seats;
    private Integer quantity;
    private BigDecimal salePrice;
    private BigDecimal buyerPaid;
    private BigDecimal sellerFee;
    private BigDecimal sellerPayout;
    private String paymentAuthorizationId;
    private String deliveryMethod;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;
}
