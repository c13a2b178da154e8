package com.ticketexchange.common.dto;

import com.ticketexchange.common.enums.DeliveryMethod;
import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AcceptOfferRequest {

    @NotBlank(message = "Section is required")
    @Size(max = 50)
    private String section;

    @Size(max = 20)
    private String row;

    private List<@NotBlank String> seats;

    @NotNull(message = "Delivery method is required")
    private DeliveryMethod deliveryMethod;

    @Size(max = 1000)
    private String deliveryDetails;
}
