package com.reclaimradar.ingestion.sync;

import com.reclaimradar.ingestion.adapter.ReportType;

/**
 * Report steps of a full reimbursement sync, in run order. label appears in step error messages; countKey and
 * reportIdKey name the step in {@link SyncResult} maps.
 */
public enum SyncStep {
    REIMBURSEMENTS(ReportType.REIMBURSEMENTS, "reimbursement", "reimbursed", "reimbursement"),
    CUSTOMER_RETURNS(ReportType.CUSTOMER_RETURNS, "customer returns", "returns", "customerReturns"),
    INVENTORY_LEDGER(ReportType.INVENTORY_LEDGER, "inventory ledger", "ledgerEvents", "inventoryLedger"),
    UNSUPPRESSED_INVENTORY(ReportType.UNSUPPRESSED_INVENTORY, "unsuppressed inventory", "inventory", "unsuppressedInventory");

    private final ReportType reportType;
    private final String label;
    private final String countKey;
    private final String reportIdKey;

    SyncStep(ReportType reportType, String label, String countKey, String reportIdKey) {
        this.reportType = reportType;
        this.label = label;
        this.countKey = countKey;
        this.reportIdKey = reportIdKey;
    }

    public ReportType reportType() {
        return reportType;
    }

    public String label() {
        return label;
    }

    public String countKey() {
        return countKey;
    }

    public String reportIdKey() {
        return reportIdKey;
    }
}
