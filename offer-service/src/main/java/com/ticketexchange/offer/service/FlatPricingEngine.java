package com.ticketexchange.offer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Stand-in until the pricing service is wired in: echoes the buyer's ceiling with a
 * configured acceptance probability.
 */
@Service
@Slf4j
public class FlatPricingEngine implements PricingEngine {

    @Value("${offers.pricing.default-probability:0.5}")
    private double defaultProbability;

    @Override
    public PriceSuggestion suggest(Long eventId, Set<String> sections, BigDecimal maxPrice, int quantity) {
        log.debug("Pricing offer: eventId={} sections={} maxPrice={} quantity={}",
                 eventId, sections, maxPrice, quantity);
        return new PriceSuggestion(maxPrice, defaultProbability);
    }
}
