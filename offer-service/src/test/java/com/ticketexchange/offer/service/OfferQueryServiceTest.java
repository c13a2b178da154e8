package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.OfferView;
import com.ticketexchange.common.entity.PaymentHold;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.repository.OfferViewRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OfferQueryServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);

    @Mock
    private BuyerOfferRepository offerRepository;

    @Mock
    private OfferViewRepository offerViewRepository;

    private OfferQueryService queryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        queryService = new OfferQueryService(offerRepository, offerViewRepository, clock);
    }

    @Test
    @SuppressWarnings("unchecked")
    void viewEventOffers_RecordsViewForEachListedOffer() {
        BuyerOffer first = offer(1L, Set.of("A"), "150.00", 4L);
        BuyerOffer second = offer(2L, Set.of("B"), "120.00", 0L);
        when(offerRepository.findOpenOffersForEvent(eq(10L), eq(OfferStatus.ACTIVE), eq(NOW), isNull(), any(Sort.class)))
            .thenReturn(List.of(first, second));

        List<BuyerOfferDto> offers = queryService.viewEventOffers(10L, 8L, null, null, null);

        assertEquals(2, offers.size());
        assertEquals(5L, offers.get(0).getViewCount());
        assertEquals(1L, offers.get(1).getViewCount());

        ArgumentCaptor<Collection<Long>> ids = ArgumentCaptor.forClass(Collection.class);
        verify(offerRepository).incrementViewCounts(ids.capture());
        assertEquals(List.of(1L, 2L), List.copyOf(ids.getValue()));

        ArgumentCaptor<List<OfferView>> views = ArgumentCaptor.forClass(List.class);
        verify(offerViewRepository).saveAll(views.capture());
        assertEquals(2, views.getValue().size());
        assertEquals(8L, views.getValue().get(0).getViewerId());
        assertEquals(NOW, views.getValue().get(0).getViewedAt());

        // Entities are never modified by browsing
        assertEquals(4L, first.getViewCount());
    }

    @Test
    void viewEventOffers_FiltersBySectionOverlap() {
        when(offerRepository.findOpenOffersForEvent(eq(10L), eq(OfferStatus.ACTIVE), eq(NOW),
                eq(new BigDecimal("100")), any(Sort.class)))
            .thenReturn(List.of(offer(1L, Set.of("A", "B"), "150.00", 0L), offer(2L, Set.of("C"), "120.00", 0L)));

        List<BuyerOfferDto> offers = queryService.viewEventOffers(10L, 8L, Set.of("B", "D"),
            new BigDecimal("100"), OfferQueryService.SORT_BY_PRICE);

        assertEquals(1, offers.size());
        assertEquals(1L, offers.get(0).getId());
        verify(offerRepository).incrementViewCounts(List.of(1L));
    }

    @Test
    void viewEventOffers_NothingOpen_NoViewsRecorded() {
        when(offerRepository.findOpenOffersForEvent(any(), any(), any(), any(), any(Sort.class)))
            .thenReturn(List.of());

        assertTrue(queryService.viewEventOffers(10L, 8L, null, null, OfferQueryService.SORT_BY_RECENT).isEmpty());
        verify(offerRepository, never()).incrementViewCounts(any());
        verifyNoInteractions(offerViewRepository);
    }

    @Test
    void viewEventOffers_RecentSortOrdersByCreation() {
        when(offerRepository.findOpenOffersForEvent(any(), any(), any(), any(), any(Sort.class)))
            .thenReturn(List.of());

        queryService.viewEventOffers(10L, 8L, null, null, "recent");

        ArgumentCaptor<Sort> sort = ArgumentCaptor.forClass(Sort.class);
        verify(offerRepository).findOpenOffersForEvent(any(), any(), any(), any(), sort.capture());
        assertEquals(Sort.Direction.DESC, sort.getValue().getOrderFor("createdAt").getDirection());
    }

    @Test
    void viewEventOffers_UnknownSort_Rejected() {
        assertThrows(InvalidOfferException.class,
            () -> queryService.viewEventOffers(10L, 8L, null, null, "popularity"));
        verifyNoInteractions(offerRepository);
    }

    private BuyerOffer offer(Long id, Set<String> sections, String maxPrice, long viewCount) {
        return BuyerOffer.builder()
            .id(id)
            .buyerId(5L)
            .eventId(10L)
            .sections(new HashSet<>(sections))
            .maxPrice(new BigDecimal(maxPrice))
            .quantity(1)
            .paymentHold(PaymentHold.authorized("pi_" + id, new BigDecimal(maxPrice), NOW.minusDays(1)))
            .status(OfferStatus.ACTIVE)
            .expiresAt(NOW.plusDays(2))
            .viewCount(viewCount)
            .build();
    }
}
