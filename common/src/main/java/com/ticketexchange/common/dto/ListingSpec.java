package com.ticketexchange.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.ticketexchange.common.enums.DeliveryMethod;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * One entry of a bulk upload. Validated per item by the intake service, so a bad
 * entry fails alone instead of rejecting the whole request.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ListingSpec {

    private Long eventId;
    private String section;
    private String row;
    private List<String> seats;
    private Integer quantity;
    private BigDecimal askingPrice;
    private DeliveryMethod deliveryMethod;
    private String deliveryDetails;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime goLiveAt;
}
