package com.ticketexchange.offer.service;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class PriceSuggestion {

    BigDecimal suggestedPrice;
    Double probability;
}
