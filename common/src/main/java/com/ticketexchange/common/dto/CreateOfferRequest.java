package com.ticketexchange.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateOfferRequest {

    @NotNull(message = "Event ID is required")
    private Long eventId;

    @NotEmpty(message = "At least one section is required")
    private Set<@NotBlank String> sections;

    @NotNull(message = "Max price is required")
    @DecimalMin(value = "0.01", message = "Max price must be greater than zero")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal maxPrice;

    @NotNull(message = "Quantity is required")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 20, message = "Cannot offer for more than 20 tickets at once")
    private Integer quantity;

    // Payer reference at the payment provider (customer id)
    @Size(max = 100)
    private String paymentCustomerRef;
}
