package com.ticketexchange.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SellerFulfillmentDto {

    private Long id;
    private Long sellerId;
    private Long eventId;
    private String section;
    private String row;
    private List<String> seats;
    private Integer quantity;
    private BigDecimal askingPrice;
    private String deliveryMethod;
    private String status; // DRAFT, ACTIVE, MATCHED
    private boolean live;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime goLiveAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime createdAt;
}
