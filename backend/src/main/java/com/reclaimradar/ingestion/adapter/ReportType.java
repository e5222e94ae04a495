package com.reclaimradar.ingestion.adapter;

/**
 * Reports pulled by the reimbursement sync, with their Selling Partner API report type names.
 */
public enum ReportType {
    REIMBURSEMENTS("GET_FBA_REIMBURSEMENTS_DATA"),
    CUSTOMER_RETURNS("GET_FBA_FULFILLMENT_CUSTOMER_RETURNS_DATA"),
    INVENTORY_LEDGER("GET_LEDGER_DETAIL_VIEW_DATA"),
    UNSUPPRESSED_INVENTORY("GET_FBA_MYI_UNSUPPRESSED_INVENTORY_DATA");

    private final String apiName;

    ReportType(String apiName) {
        this.apiName = apiName;
    }

    public String apiName() {
        return apiName;
    }
}
