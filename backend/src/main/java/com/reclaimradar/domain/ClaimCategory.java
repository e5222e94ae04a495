package com.reclaimradar.domain;

/**
 * Why a unit is believed to be recoverable.
 */
public enum ClaimCategory {
    LOST_WAREHOUSE("Lost in Warehouse"),
    DAMAGED_WAREHOUSE("Damaged in Warehouse"),
    CUSTOMER_RETURN_NOT_RECEIVED("Customer Return Not Received"),
    CUSTOMER_RETURN_DAMAGED("Customer Return Damaged");

    private final String label;

    ClaimCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
