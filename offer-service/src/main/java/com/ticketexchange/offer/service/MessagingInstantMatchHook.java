package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BuyerOfferDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Hands new offers to the matching service through the offer-created topic. The matching
 * service answers by calling the accept endpoint on behalf of the seller it found.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MessagingInstantMatchHook implements InstantMatchHook {

    private final OfferMessagingService messagingService;

    @Async
    @Override
    public void checkForInstantMatch(BuyerOfferDto offer) {
        log.debug("Requesting instant match for offer {}", offer.getId());
        messagingService.publishOfferCreated(offer);
    }
}
