package com.ticketexchange.offer.service;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Suggested price and acceptance probability for a new offer. Implementations must be
 * free of side effects.
 */
public interface PricingEngine {

    PriceSuggestion suggest(Long eventId, Set<String> sections, BigDecimal maxPrice, int quantity);
}
