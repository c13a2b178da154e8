package com.ticketexchange.common.util;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fee split of a sale. The fee is rounded to cents and the payout takes the remainder,
 * so {@code sellerFee + sellerPayout == salePrice} holds exactly.
 */
@Value
public class SettlementTerms {

    BigDecimal salePrice;
    BigDecimal sellerFee;
    BigDecimal sellerPayout;

    public static SettlementTerms of(BigDecimal salePrice, BigDecimal feeRate) {
        if (salePrice == null || salePrice.signum() <= 0) {
            throw new IllegalArgumentException("Sale price must be positive");
        }
        if (feeRate == null || feeRate.signum() < 0 || feeRate.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Fee rate must be between 0 and 1");
        }
        BigDecimal price = salePrice.setScale(2, RoundingMode.HALF_UP);
        BigDecimal fee = price.multiply(feeRate).setScale(2, RoundingMode.HALF_UP);
        return new SettlementTerms(price, fee, price.subtract(fee));
    }
}
