package com.ticketexchange.offer.service;

import com.ticketexchange.common.dto.BuyerOfferDto;

/**
 * Invoked once a new offer is committed to look for a seller who can fill it right away.
 * Best effort: failures must not affect the offer.
 */
public interface InstantMatchHook {

    void checkForInstantMatch(BuyerOfferDto offer);
}
