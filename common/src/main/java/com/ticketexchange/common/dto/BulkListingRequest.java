package com.ticketexchange.common.dto;

import jakarta.validation.constraints.*;
import lombok.*;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkListingRequest {

    @NotEmpty(message = "Listings are required")
    @Size(max = 500, message = "Cannot upload more than 500 listings at once")
    private List<ListingSpec> listings;
}
