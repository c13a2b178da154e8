package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.AcceptOfferRequest;
import com.ticketexchange.common.dto.AcceptOfferResponse;
import com.ticketexchange.common.dto.BuyerOfferDto;
import com.ticketexchange.common.dto.CreateOfferRequest;
import com.ticketexchange.common.entity.BuyerOffer;
import com.ticketexchange.common.entity.BuyerOffer.OfferStatus;
import com.ticketexchange.common.entity.Event;
import com.ticketexchange.common.entity.OfferView;
import com.ticketexchange.common.entity.PaymentHold.HoldStatus;
import com.ticketexchange.common.entity.SettledTransaction;
import com.ticketexchange.common.enums.DeliveryMethod;
import com.ticketexchange.common.enums.EventStatus;
import com.ticketexchange.offer.payment.PaymentAuthorizationException;
import com.ticketexchange.offer.payment.PaymentAuthorizationService;
import com.ticketexchange.offer.repository.BuyerOfferRepository;
import com.ticketexchange.offer.repository.EventRepository;
import com.ticketexchange.offer.repository.OfferViewRepository;
import com.ticketexchange.offer.repository.SellerFulfillmentRepository;
import com.ticketexchange.offer.repository.SettledTransactionRepository;
import com.ticketexchange.offer.service.OfferLifecycleService.ExpiryOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Runs the offer lifecycle against a real H2 store. Not @Transactional: each service
 * call commits on its own, the way it does in production, so row locks and commit
 * callbacks behave for real.
 */
@SpringBootTest
@ActiveProfiles("test")
class OfferSettlementIntegrationTest {

    @Autowired
    private OfferLifecycleService lifecycleService;

    @Autowired
    private OfferSettlementService settlementService;

    @Autowired
    private BuyerOfferRepository offerRepository;

    @Autowired
    private EventRepository eventRepository;

    @Autowired
    private SellerFulfillmentRepository fulfillmentRepository;

    @Autowired
    private SettledTransactionRepository transactionRepository;

    @Autowired
    private OfferViewRepository offerViewRepository;

    @Autowired
    private OfferQueryService queryService;

    @Autowired
    private Clock clock;

    @MockBean
    private PaymentAuthorizationService paymentService;

    @MockBean
    private OfferMessagingService messagingService;

    @MockBean
    private DistributedLockService lockService;

    @MockBean
    private InstantMatchHook instantMatchHook;

    private Event event;

    @BeforeEach
    void setUp() {
        when(paymentService.hold(any(BigDecimal.class), anyString(), any(), anyMap())).thenReturn("pi_integration");

        event = eventRepository.save(Event.builder()
            .title("Integration Test Event")
            .venue("Test Venue")
            .city("Test City")
            .eventDate(LocalDateTime.now(clock).plusDays(3).truncatedTo(ChronoUnit.SECONDS))
            .status(EventStatus.UPCOMING)
            .build());
    }

    @AfterEach
    void tearDown() {
        offerViewRepository.deleteAll();
        transactionRepository.deleteAll();
        fulfillmentRepository.deleteAll();
        offerRepository.deleteAll();
        eventRepository.deleteAll();
    }

    @Test
    void createOffer_HoldsFullAmountAndExpiresBeforeEvent() {
        BuyerOfferDto offer = lifecycleService.createOffer(5L, createRequest());

        verify(paymentService).hold(eq(new BigDecimal("200.00")), eq("usd"), any(), anyMap());

        BuyerOffer stored = offerRepository.findById(offer.getId()).orElseThrow();
        assertEquals(OfferStatus.ACTIVE, stored.getStatus());
        assertEquals(HoldStatus.AUTHORIZED, stored.getPaymentHold().getStatus());
        assertEquals(0, new BigDecimal("200.00").compareTo(stored.getPaymentHold().getAmount()));
        assertEquals(event.getEventDate().minusHours(1), stored.getExpiresAt());
        assertEquals(Set.of("A", "B"), stored.getSections());
        verify(instantMatchHook).checkForInstantMatch(any(BuyerOfferDto.class));
    }

    @Test
    void acceptOffer_SettlesAndCapturesOnce() {
        BuyerOfferDto offer = lifecycleService.createOffer(5L, createRequest());

        AcceptOfferResponse response = settlementService.acceptOffer(offer.getId(), 8L, acceptRequest());

        assertFalse(response.isReconciliationRequired());
        verify(paymentService).capture("pi_integration");

        BuyerOffer stored = offerRepository.findById(offer.getId()).orElseThrow();
        assertEquals(OfferStatus.MATCHED, stored.getStatus());
        assertEquals(HoldStatus.CAPTURED, stored.getPaymentHold().getStatus());
        assertEquals(response.getFulfillmentId(), stored.getMatchedFulfillmentId());
        assertEquals(1, fulfillmentRepository.count());

        SettledTransaction transaction = transactionRepository.findByBuyerOfferId(offer.getId()).orElseThrow();
        assertEquals(0, new BigDecimal("100.00").compareTo(transaction.getSalePrice()));
        assertEquals(0, new BigDecimal("10.00").compareTo(transaction.getSellerFee()));
        assertEquals(0, new BigDecimal("90.00").compareTo(transaction.getSellerPayout()));
        assertEquals(8L, transaction.getSellerId());
    }

    @Test
    void acceptOffer_ConcurrentSellers_ExactlyOneWins() throws Exception {
        BuyerOfferDto offer = lifecycleService.createOffer(5L, createRequest());

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<AcceptOfferResponse>> futures = new ArrayList<>();
        try {
            for (long sellerId : new long[]{8L, 9L}) {
                Callable<AcceptOfferResponse> accept = () -> {
                    start.await();
                    return settlementService.acceptOffer(offer.getId(), sellerId, acceptRequest());
                };
                futures.add(executor.submit(accept));
            }
            start.countDown();

            int succeeded = 0;
            int notAvailable = 0;
            for (Future<AcceptOfferResponse> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertInstanceOf(OfferNotAvailableException.class, e.getCause());
                    notAvailable++;
                }
            }

            assertEquals(1, succeeded);
            assertEquals(1, notAvailable);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1L, transactionRepository.countByBuyerOfferId(offer.getId()));
        assertEquals(1, fulfillmentRepository.count());
        assertEquals(OfferStatus.MATCHED, offerRepository.findById(offer.getId()).orElseThrow().getStatus());
        verify(paymentService, times(1)).capture("pi_integration");
    }

    @Test
    void acceptOffer_CaptureFails_MatchStandsAndIsFlagged() {
        BuyerOfferDto offer = lifecycleService.createOffer(5L, createRequest());
        doThrow(new PaymentAuthorizationException(PaymentAuthorizationException.Kind.CAPTURE_FAILED,
                "pi_integration", true, "Read timed out", null))
            .when(paymentService).capture("pi_integration");

        AcceptOfferResponse response = settlementService.acceptOffer(offer.getId(), 8L, acceptRequest());

        assertTrue(response.isReconciliationRequired());
        BuyerOffer stored = offerRepository.findById(offer.getId()).orElseThrow();
        assertEquals(OfferStatus.MATCHED, stored.getStatus());
        assertEquals(HoldStatus.CAPTURE_FAILED, stored.getPaymentHold().getStatus());
        assertTrue(stored.isReconciliationRequired());
        assertEquals(1L, transactionRepository.countByBuyerOfferId(offer.getId()));
        verify(messagingService).publishReconciliationRequired(offer.getId(), "pi_integration", "Capture timed out");
    }

    @Test
    void cancelOffer_ReleasesHold_MatchedOfferCannotBeCancelled() {
        BuyerOfferDto open = lifecycleService.createOffer(5L, createRequest());

        BuyerOfferDto cancelled = lifecycleService.cancelOffer(open.getId(), 5L);

        assertEquals("CANCELLED", cancelled.getStatus());
        verify(paymentService).cancel("pi_integration");
        BuyerOffer stored = offerRepository.findById(open.getId()).orElseThrow();
        assertEquals(OfferStatus.CANCELLED, stored.getStatus());
        assertEquals(HoldStatus.CANCELLED, stored.getPaymentHold().getStatus());

        BuyerOfferDto matched = lifecycleService.createOffer(5L, createRequest());
        settlementService.acceptOffer(matched.getId(), 8L, acceptRequest());

        assertThrows(InvalidOfferStateException.class, () -> lifecycleService.cancelOffer(matched.getId(), 5L));
        assertEquals(OfferStatus.MATCHED, offerRepository.findById(matched.getId()).orElseThrow().getStatus());
    }

    @Test
    void expireSweep_UnmatchedOfferPastExpiry_ExpiredAndHoldReleased() {
        BuyerOfferDto offer = lifecycleService.createOffer(5L, createRequest());
        BuyerOffer stored = offerRepository.findById(offer.getId()).orElseThrow();
        stored.setExpiresAt(LocalDateTime.now(clock).minusMinutes(1));
        offerRepository.save(stored);

        OfferExpiryJob expiryJob = new OfferExpiryJob(offerRepository, lifecycleService, lockService, clock);
        ReflectionTestUtils.setField(expiryJob, "batchSize", 50);

        Map<ExpiryOutcome, Integer> outcome = expiryJob.expireSweep();

        assertEquals(1, outcome.get(ExpiryOutcome.EXPIRED));
        verify(paymentService).cancel("pi_integration");
        BuyerOffer expired = offerRepository.findById(offer.getId()).orElseThrow();
        assertEquals(OfferStatus.EXPIRED, expired.getStatus());
        assertEquals(HoldStatus.CANCELLED, expired.getPaymentHold().getStatus());
        assertNotNull(expired.getExpiredAt());
    }

    @Test
    void viewEventOffers_CountsViewsAndRecordsViewer() {
        BuyerOfferDto offer = lifecycleService.createOffer(5L, createRequest());

        List<BuyerOfferDto> firstView = queryService.viewEventOffers(event.getId(), 8L, Set.of("B", "C"), null, null);
        queryService.viewEventOffers(event.getId(), 9L, null, new BigDecimal("80.00"), OfferQueryService.SORT_BY_RECENT);

        assertEquals(1, firstView.size());
        assertEquals(1L, firstView.get(0).getViewCount());
        assertEquals(2L, offerRepository.findById(offer.getId()).orElseThrow().getViewCount());
        assertEquals(Set.of(8L, 9L), offerViewRepository.findByOfferIdOrderByViewedAtDesc(offer.getId()).stream()
            .map(OfferView::getViewerId)
            .collect(Collectors.toSet()));
    }

    private CreateOfferRequest createRequest() {
        return CreateOfferRequest.builder()
            .eventId(event.getId())
            .sections(Set.of("A", "B"))
            .maxPrice(new BigDecimal("100.00"))
            .quantity(2)
            .build();
    }

    private AcceptOfferRequest acceptRequest() {
        return AcceptOfferRequest.builder()
            .section("A")
            .row("12")
            .seats(List.of("1", "2"))
            .deliveryMethod(DeliveryMethod.ELECTRONIC)
            .build();
    }
}
