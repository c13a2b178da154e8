package com.ticketexchange.common.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SettlementTermsTest {

    @Test
    void of_TenPercentFee() {
        SettlementTerms terms = SettlementTerms.of(new BigDecimal("100"), new BigDecimal("0.10"));

        assertEquals(new BigDecimal("100.00"), terms.getSalePrice());
        assertEquals(new BigDecimal("10.00"), terms.getSellerFee());
        assertEquals(new BigDecimal("90.00"), terms.getSellerPayout());
    }

    @Test
    void of_RoundedFee_PayoutTakesRemainder() {
        SettlementTerms terms = SettlementTerms.of(new BigDecimal("33.33"), new BigDecimal("0.10"));

        assertEquals(new BigDecimal("3.33"), terms.getSellerFee());
        assertEquals(new BigDecimal("30.00"), terms.getSellerPayout());
        assertEquals(terms.getSalePrice(), terms.getSellerFee().add(terms.getSellerPayout()));
    }

    @Test
    void of_ZeroFee() {
        SettlementTerms terms = SettlementTerms.of(new BigDecimal("45.50"), BigDecimal.ZERO);

        assertEquals(0, terms.getSellerFee().signum());
        assertEquals(new BigDecimal("45.50"), terms.getSellerPayout());
    }

    @Test
    void of_InvalidInputs_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> SettlementTerms.of(BigDecimal.ZERO, new BigDecimal("0.10")));
        assertThrows(IllegalArgumentException.class, () -> SettlementTerms.of(null, new BigDecimal("0.10")));
        assertThrows(IllegalArgumentException.class, () -> SettlementTerms.of(BigDecimal.TEN, new BigDecimal("-0.01")));
        assertThrows(IllegalArgumentException.class, () -> SettlementTerms.of(BigDecimal.TEN, new BigDecimal("1.5")));
    }

    @Test
    void transactionReference_HasPrefixAndIsUnique() {
        String first = TokenGenerator.generateTransactionReference();

        assertTrue(first.startsWith("TXN_"));
        assertNotEquals(first, TokenGenerator.generateTransactionReference());
    }
}
