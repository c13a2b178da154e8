package com.ticketexchange.offer.controller;

import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.dto.CreateOfferRequest;
import com.ticketexchange.offer.service.OfferLifecycleService;
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

import java.util.List;

@RestController
@RequestMapping("/api/offers")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Buyer Offer Controller", description = "Buyer offers backed by a payment hold")
public class BuyerOfferController {

    public static final String USER_HEADER = "X-User-Id";

    private final OfferLifecycleService lifecycleService;

    @PostMapping
    @Operation(
        summary = "Create an offer",
        description = "Places a hold of maxPrice x quantity on the buyer's payment method and opens an offer " +
                     "that expires offers.expiry.buffer-minutes before the event starts."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Offer created and hold authorized"),
        @ApiResponse(responseCode = "400", description = "Invalid request or event not accepting offers"),
        @ApiResponse(responseCode = "402", description = "Payment hold declined")
    })
    public ResponseEntity<BuyerOfferDto> createOffer(
            @RequestHeader(USER_HEADER) Long buyerId,
            @Valid @RequestBody CreateOfferRequest request) {

        log.info("Offer request from buyer {} for event {}: {} x {}",
                buyerId, request.getEventId(), request.getQuantity(), request.getMaxPrice());

        BuyerOfferDto offer = lifecycleService.createOffer(buyerId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(offer);
    }

    @GetMapping
    @Operation(summary = "List the buyer's offers", description = "Newest first, all states")
    public ResponseEntity<List<BuyerOfferDto>> getMyOffers(@RequestHeader(USER_HEADER) Long buyerId) {
        return ResponseEntity.ok(lifecycleService.getBuyerOffers(buyerId));
    }

    @GetMapping("/{offerId}")
    @Operation(summary = "Get one of the buyer's offers")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Offer found"),
        @ApiResponse(responseCode = "404", description = "Offer not found")
    })
    public ResponseEntity<BuyerOfferDto> getOffer(
            @RequestHeader(USER_HEADER) Long buyerId,
            @Parameter(description = "Offer ID") @PathVariable Long offerId) {
        return ResponseEntity.ok(lifecycleService.getOffer(offerId, buyerId));
    }

    @DeleteMapping("/{offerId}")
    @Operation(
        summary = "Cancel an offer",
        description = "Releases the payment hold, then marks the offer cancelled. " +
                     "If the hold cannot be released the offer stays active."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Offer cancelled"),
        @ApiResponse(responseCode = "404", description = "Offer not found"),
        @ApiResponse(responseCode = "409", description = "Offer is no longer active"),
        @ApiResponse(responseCode = "502", description = "Payment hold could not be released")
    })
    public ResponseEntity<BuyerOfferDto> cancelOffer(
            @RequestHeader(USER_HEADER) Long buyerId,
            @Parameter(description = "Offer ID") @PathVariable Long offerId) {

        log.info("Cancel request for offer {} from buyer {}", offerId, buyerId);
        return ResponseEntity.ok(lifecycleService.cancelOffer(offerId, buyerId));
    }
}
