package com.reclaimradar.ingestion.parser;

import com.reclaimradar.domain.LedgerEventType;
import com.reclaimradar.ingestion.adapter.ReportRow;

import java.time.Instant;

/**
 * Maps GET_LEDGER_DETAIL_VIEW_DATA rows. Accepts kebab-case, camelCase and the report's Title-case headers.
 */
public final class LedgerRowParser {

    static final String DEFAULT_COUNTRY = "US";

    private LedgerRowParser() {
    }

    public static LedgerEventRow parse(ReportRow row) {
        if (row.isMalformed()) {
            throw new RowParseException(row.lineNumber(), row.malformedReason());
        }
        String fnsku = ReportValues.required(row, "fnsku", "fnsku", "FNSKU");
        String asin = ReportValues.required(row, "asin", "asin", "ASIN");
        String sku = ReportValues.required(row, "sku", "msku", "sku", "MSKU", "SKU");
        String rawEventType = ReportValues.required(row, "eventType", "event-type", "eventType", "Event Type");
        Instant eventDate = ReportValues.requiredInstant(row, "eventDate", "date", "eventDate", "Date");
        Instant rawTimestamp = ReportValues.optionalInstant(row, "dateAndTime", "date-and-time", "dateAndTime", "Date and Time");

        return new LedgerEventRow(
                row.lineNumber(),
                fnsku,
                asin,
                sku,
                ReportValues.orDefault(row, "", "title", "productTitle", "product-name", "Title"),
                eventDate,
                rawEventType,
                LedgerEventType.fromReportValue(rawEventType).orElse(null),
                ReportValues.optional(row, "reference-id", "referenceId", "Reference ID"),
                ReportValues.intValue(row, 0, "quantity", "quantity", "Quantity"),
                ReportValues.optional(row, "fulfillment-center", "fulfillmentCenter", "Fulfillment Center"),
                ReportValues.optional(row, "disposition", "Disposition"),
                ReportValues.optional(row, "reason", "Reason"),
                ReportValues.orDefault(row, DEFAULT_COUNTRY, "country", "Country"),
                Math.abs(ReportValues.intValue(row, 0, "reconciledQuantity",
                        "reconciled-quantity", "reconciledQuantity", "Reconciled Quantity")),
                Math.abs(ReportValues.intValue(row, 0, "unreconciledQuantity",
                        "unreconciled-quantity", "unreconciledQuantity", "Unreconciled Quantity")),
                rawTimestamp != null ? rawTimestamp : eventDate);
    }
}
