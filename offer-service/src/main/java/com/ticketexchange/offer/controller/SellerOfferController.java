package com.ticketexchange.offer.controller;

import com.ticketexchange.common.dto.AcceptOfferRequest;
import com.ticketexchange.common.dto.AcceptOfferResponse;
import com.ticketexchange.common.dto.BulkListingRequest;
import com.ticketexchange.common.dto.BulkListingResult;
import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.offer.service.BulkListingService;
import com.ticketexchange.offer.service.OfferQueryService;
import com.ticketexchange.offer.service.OfferSettlementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/seller")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Seller Offer Controller", description = "Browse open offers, accept them and upload listings")
public class SellerOfferController {

    private final OfferQueryService queryService;
    private final OfferSettlementService settlementService;
    private final BulkListingService bulkListingService;

    @GetMapping("/events/{eventId}/offers")
    @Operation(
        summary = "Browse open offers for an event",
        description = "Active, unexpired offers filtered by section and minimum price. " +
                     "Each listed offer records a view by the calling seller."
    )
    public ResponseEntity<List<BuyerOfferDto>> viewEventOffers(
            @RequestHeader(BuyerOfferController.USER_HEADER) Long sellerId,
            @Parameter(description = "Event ID") @PathVariable Long eventId,
            @RequestParam(required = false) Set<String> sections,
            @RequestParam(required = false) BigDecimal minPrice,
            @Parameter(description = "price (default) or recent") @RequestParam(defaultValue = "price") String sortBy) {

        return ResponseEntity.ok(queryService.viewEventOffers(eventId, sellerId, sections, minPrice, sortBy));
    }

    @PostMapping("/offers/{offerId}/accept")
    @Operation(
        summary = "Accept an offer",
        description = "Records the fulfillment and settled transaction atomically, then captures the buyer's " +
                     "payment. If capture fails the match stands and is flagged for reconciliation (202)."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Offer matched and payment captured"),
        @ApiResponse(responseCode = "202", description = "Offer matched, payment capture pending reconciliation"),
        @ApiResponse(responseCode = "400", description = "Section mismatch or invalid seat assignment"),
        @ApiResponse(responseCode = "409", description = "Offer missing or no longer available"),
        @ApiResponse(responseCode = "503", description = "Settlement could not be recorded; offer remains open")
    })
    public ResponseEntity<AcceptOfferResponse> acceptOffer(
            @RequestHeader(BuyerOfferController.USER_HEADER) Long sellerId,
            @Parameter(description = "Offer ID") @PathVariable Long offerId,
            @Valid @RequestBody AcceptOfferRequest request) {

        log.info("Seller {} accepting offer {} in section {}", sellerId, offerId, request.getSection());

        AcceptOfferResponse response = settlementService.acceptOffer(offerId, sellerId, request);
        HttpStatus status = response.isReconciliationRequired() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @PostMapping("/listings/bulk")
    @Operation(
        summary = "Bulk upload listings",
        description = "Each listing is stored independently; listings with a future goLiveAt start as DRAFT. " +
                     "Failures are reported per item."
    )
    public ResponseEntity<BulkListingResult> bulkUpload(
            @RequestHeader(BuyerOfferController.USER_HEADER) Long sellerId,
            @Valid @RequestBody BulkListingRequest request) {

        log.info("Bulk upload of {} listings from seller {}", request.getListings().size(), sellerId);
        return ResponseEntity.ok(bulkListingService.bulkUpload(sellerId, request));
    }
}
