package com.ticketexchange.common.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BulkListingResult {

    private int created;
    private int failed;

    @Builder.Default
    private List<SellerFulfillmentDto> listings = new ArrayList<>();

    @Builder.Default
    private List<ItemFailure> failures = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemFailure {
        private int index;
        private String reason;
    }
}
