package com.reclaimradar.claims.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Estimated claim value: unit price times quantity, two decimals. Unknown price gives null, never zero.
 */
public final class ClaimValuation {

    private ClaimValuation() {
    }

    public static BigDecimal estimate(Map<String, BigDecimal> unitPrices, String fnsku, int quantity) {
        BigDecimal price = unitPrices.get(fnsku);
        if (price == null) {
            return null;
        }
        return price.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
    }
}
