package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BulkListingRequest;
import com.ticketexchange.common.dto.BulkListingResult;
import com.ticketexchange.common.dto.BulkListingResult.ItemFailure;
import com.ticketexchange.common.dto.ListingSpec;
import com.ticketexchange.common.entity.SellerFulfillment;
import com.ticketexchange.common.entity.SellerFulfillment.FulfillmentStatus;
import com.ticketexchange.offer.repository.EventRepository;
import com.ticketexchange.offer.repository.SellerFulfillmentRepository;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Seller listing intake. Items are saved one by one, each in its own transaction,
 * so a rejected item never takes the rest of the upload with it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BulkListingService {

    // Column limits of seller_fulfillments
    static final int MAX_SECTION_LENGTH = 50;
    static final int MAX_ROW_LENGTH = 20;
    static final int MAX_DELIVERY_DETAILS_LENGTH = 1000;

    private final SellerFulfillmentRepository fulfillmentRepository;
    private final EventRepository eventRepository;
    private final Clock clock;

    public BulkListingResult bulkUpload(Long sellerId, BulkListingRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        BulkListingResult result = BulkListingResult.builder().build();

        List<ListingSpec> listings = request.getListings();
        for (int index = 0; index < listings.size(); index++) {
            ListingSpec item = listings.get(index);
            try {
                validateListing(item);
                SellerFulfillment saved = fulfillmentRepository.save(toListing(sellerId, item, now));
                result.getListings().add(OfferDtoMapper.toDto(saved));
            } catch (OfferException e) {
                result.getFailures().add(new ItemFailure(index, e.getMessage()));
            } catch (ConstraintViolationException e) {
                log.warn("Listing {} of seller {} rejected on save: {}", index, sellerId, e.getMessage());
                result.getFailures().add(new ItemFailure(index, "Listing is invalid: " + e.getMessage()));
            } catch (DataAccessException e) {
                log.warn("Listing {} of seller {} could not be stored", index, sellerId, e);
                result.getFailures().add(new ItemFailure(index, "Listing could not be stored"));
            }
        }

        result.setCreated(result.getListings().size());
        result.setFailed(result.getFailures().size());

        log.info("Bulk upload for seller {}: {} created, {} failed", sellerId, result.getCreated(), result.getFailed());
        return result;
    }

    private SellerFulfillment toListing(Long sellerId, ListingSpec item, LocalDateTime now) {
        boolean scheduled = item.getGoLiveAt() != null && item.getGoLiveAt().isAfter(now);

        return SellerFulfillment.builder()
            .sellerId(sellerId)
            .eventId(item.getEventId())
            .section(item.getSection())
            .row(item.getRow())
            .seats(item.getSeats() != null ? new ArrayList<>(item.getSeats()) : new ArrayList<>())
            .quantity(item.getQuantity())
            .askingPrice(item.getAskingPrice())
            .deliveryMethod(item.getDeliveryMethod())
            .deliveryDetails(item.getDeliveryDetails())
            .status(scheduled ? FulfillmentStatus.DRAFT : FulfillmentStatus.ACTIVE)
            .goLiveAt(item.getGoLiveAt())
            .live(!scheduled)
            .build();
    }

    private void validateListing(ListingSpec item) {
        if (item == null) {
            throw new InvalidOfferException("Listing is empty");
        }
        if (item.getEventId() == null || !eventRepository.existsById(item.getEventId())) {
            throw new EventNotAvailableException("Event not found: " + item.getEventId());
        }
        if (item.getSection() == null || item.getSection().isBlank()) {
            throw new InvalidOfferException("Section is required");
        }
        if (item.getSection().length() > MAX_SECTION_LENGTH) {
            throw new InvalidOfferException("Section must be at most " + MAX_SECTION_LENGTH + " characters");
        }
        if (item.getRow() != null && item.getRow().length() > MAX_ROW_LENGTH) {
            throw new InvalidOfferException("Row must be at most " + MAX_ROW_LENGTH + " characters");
        }
        if (item.getDeliveryDetails() != null && item.getDeliveryDetails().length() > MAX_DELIVERY_DETAILS_LENGTH) {
            throw new InvalidOfferException("Delivery details must be at most "
                + MAX_DELIVERY_DETAILS_LENGTH + " characters");
        }
        if (item.getQuantity() == null || item.getQuantity() < 1) {
            throw new InvalidOfferException("Quantity must be at least 1");
        }
        if (item.getAskingPrice() == null || item.getAskingPrice().signum() <= 0) {
            throw new InvalidOfferException("Asking price must be greater than zero");
        }
        if (item.getSeats() != null && !item.getSeats().isEmpty() && item.getSeats().size() != item.getQuantity()) {
            throw new InvalidOfferException("Listing has " + item.getSeats().size()
                + " seats for a quantity of " + item.getQuantity());
        }
    }
}
