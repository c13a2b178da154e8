package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.OfferView;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.repository.OfferViewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seller-side browsing of open offers. Every listed offer counts as viewed by the
 * seller; view bookkeeping goes through a bulk counter update and an insert-only
 * view log so it never contends with settlement for the offer rows.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OfferQueryService {

    public static final String SORT_BY_PRICE = "price";
    public static final String SORT_BY_RECENT = "recent";

    private final BuyerOfferRepository offerRepository;
    private final OfferViewRepository offerViewRepository;
    private final Clock clock;

    @Transactional
    public List<BuyerOfferDto> viewEventOffers(Long eventId, Long sellerId, Set<String> sections,
                                               BigDecimal minPrice, String sortBy) {
        LocalDateTime now = LocalDateTime.now(clock);
        Set<String> wanted = sections != null ? sections : Collections.emptySet();

        List<BuyerOfferDto> offers = offerRepository
            .findOpenOffersForEvent(eventId, OfferStatus.ACTIVE, now, minPrice, resolveSort(sortBy))
            .stream()
            .filter(offer -> wanted.isEmpty() || wanted.stream().anyMatch(offer::acceptsSection))
            .map(OfferDtoMapper::toDto)
            .collect(Collectors.toList());

        if (offers.isEmpty()) {
            return offers;
        }

        List<Long> offerIds = offers.stream().map(BuyerOfferDto::getId).collect(Collectors.toList());
        offerRepository.incrementViewCounts(offerIds);
        offerViewRepository.saveAll(offerIds.stream()
            .map(offerId -> OfferView.builder().offerId(offerId).viewerId(sellerId).viewedAt(now).build())
            .collect(Collectors.toList()));

        offers.forEach(dto -> dto.setViewCount(dto.getViewCount() + 1));

        log.debug("Seller {} viewed {} offers for event {}", sellerId, offers.size(), eventId);
        return offers;
    }

    private static Sort resolveSort(String sortBy) {
        if (sortBy == null || SORT_BY_PRICE.equalsIgnoreCase(sortBy)) {
            return Sort.by(Sort.Order.desc("maxPrice"), Sort.Order.asc("createdAt"));
        }
        if (SORT_BY_RECENT.equalsIgnoreCase(sortBy)) {
            return Sort.by(Sort.Order.desc("createdAt"));
        }
        throw new InvalidOfferException("Unsupported sort: " + sortBy + " (use price or recent)");
    }
}
