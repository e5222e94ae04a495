package com.reclaimradar.claims.analysis;

import com.reclaimradar.domain.ClaimCategory;
import com.reclaimradar.domain.ClaimStatus;
import com.reclaimradar.domain.ClaimableItem;
import com.reclaimradar.domain.CustomerReturn;
import com.reclaimradar.domain.LedgerEvent;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Map;

/**
 * Builders and dedup checks shared by the detection passes.
 */
final class NewClaims {

    static final String DEFAULT_CURRENCY = "USD";
    static final String UNKNOWN_PRODUCT = "Unknown Product";

    private NewClaims() {
    }

    static ClaimableItem fromLedgerEvent(LedgerEvent event, ClaimCategory category, int quantity, String reason,
                                         Map<String, BigDecimal> unitPrices, Instant now) {
        ClaimableItem item = base(category, now);
        item.setFnsku(event.getFnsku());
        item.setAsin(event.getAsin());
        item.setSku(event.getSku());
        item.setProductName(event.getProductTitle());
        item.setQuantity(quantity);
        item.setEstimatedValue(ClaimValuation.estimate(unitPrices, event.getFnsku(), quantity));
        item.setFulfillmentCenter(event.getFulfillmentCenter());
        item.setEventDate(event.getEventDate());
        item.setReferenceId(event.getReferenceId());
        item.setReason(reason);
        return item;
    }

    static ClaimableItem fromCustomerReturn(CustomerReturn customerReturn, ClaimCategory category, String reason,
                                            Map<String, BigDecimal> unitPrices, Instant now) {
        ClaimableItem item = base(category, now);
        item.setFnsku(customerReturn.getFnsku());
        item.setAsin(customerReturn.getAsin());
        item.setSku(customerReturn.getSku());
        String productName = customerReturn.getProductName();
        item.setProductName(productName == null || productName.isBlank() ? UNKNOWN_PRODUCT : productName);
        item.setQuantity(customerReturn.getQuantity());
        item.setEstimatedValue(ClaimValuation.estimate(unitPrices, customerReturn.getFnsku(), customerReturn.getQuantity()));
        item.setEventDate(customerReturn.getReturnDate());
        item.setReferenceId(customerReturn.getOrderId());
        item.setReason(reason);
        return item;
    }

    private static ClaimableItem base(ClaimCategory category, Instant now) {
        ClaimableItem item = new ClaimableItem();
        item.setCategory(category);
        item.setStatus(ClaimStatus.PENDING);
        item.setCurrency(DEFAULT_CURRENCY);
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        return item;
    }

    /**
     * True when a claim of the category exists for the fnsku with eventDate on or after the start of the
     * event's UTC calendar day.
     */
    static boolean claimedSinceDay(Collection<ClaimableItem> claims, String fnsku, ClaimCategory category, Instant eventDate) {
        Instant dayStart = eventDate.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
        return claims.stream().anyMatch(c -> c.getCategory() == category
                && fnsku.equals(c.getFnsku())
                && c.getEventDate() != null
                && !c.getEventDate().isBefore(dayStart));
    }

    /** True when any claim of the category exists for the fnsku. */
    static boolean claimedEver(Collection<ClaimableItem> claims, String fnsku, ClaimCategory category) {
        return claims.stream().anyMatch(c -> c.getCategory() == category && fnsku.equals(c.getFnsku()));
    }
}
