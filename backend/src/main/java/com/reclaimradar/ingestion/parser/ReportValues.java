package com.reclaimradar.ingestion.parser;

import com.reclaimradar.ingestion.adapter.ReportRow;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Typed reads from a {@link ReportRow} with alias fallback. Failures become {@link RowParseException}.
 * Dates without an offset are taken as UTC.
 */
public final class ReportValues {

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy");
    private static final DateTimeFormatter LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd['T'][' ']HH:mm:ss");

    private static final List<Function<String, Instant>> FORMATS = List.of(
            Instant::parse,
            s -> OffsetDateTime.parse(s).toInstant(),
            s -> LocalDateTime.parse(s, LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
            s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant(),
            s -> LocalDate.parse(s, US_DATE).atStartOfDay(ZoneOffset.UTC).toInstant());

    private ReportValues() {
    }

    public static String required(ReportRow row, String field, String... aliases) {
        String v = row.first(aliases);
        if (v == null) {
            throw new RowParseException(row.lineNumber(), "missing required field " + field);
        }
        return v;
    }

    public static String optional(ReportRow row, String... aliases) {
        return row.first(aliases);
    }

    public static String orDefault(ReportRow row, String defaultValue, String... aliases) {
        String v = row.first(aliases);
        return v != null ? v : defaultValue;
    }

    /** Integer field; absent yields the default. Accepts "3.0"-style values from spreadsheet exports. */
    public static int intValue(ReportRow row, int defaultValue, String field, String... aliases) {
        String v = row.first(aliases);
        if (v == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            try {
                return new BigDecimal(v).intValueExact();
            } catch (NumberFormatException | ArithmeticException ex) {
                throw new RowParseException(row.lineNumber(), "unparseable " + field + ": '" + v + "'", ex);
            }
        }
    }

    /** Nullable integer; absent yields null. */
    public static Integer optionalInt(ReportRow row, String field, String... aliases) {
        String v = row.first(aliases);
        return v == null ? null : intValue(row, 0, field, aliases);
    }

    /** Decimal at scale 2; absent yields the default (may be null). */
    public static BigDecimal decimal(ReportRow row, BigDecimal defaultValue, String field, String... aliases) {
        String v = row.first(aliases);
        if (v == null) {
            return defaultValue;
        }
        try {
            return new BigDecimal(v.replace(",", "")).setScale(2, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            throw new RowParseException(row.lineNumber(), "unparseable " + field + ": '" + v + "'", e);
        }
    }

    public static Instant requiredInstant(ReportRow row, String field, String... aliases) {
        String v = required(row, field, aliases);
        Instant parsed = parseInstant(v);
        if (parsed == null) {
            throw new RowParseException(row.lineNumber(), "unparseable " + field + ": '" + v + "'");
        }
        return parsed;
    }

    public static Instant optionalInstant(ReportRow row, String field, String... aliases) {
        String v = row.first(aliases);
        if (v == null) {
            return null;
        }
        Instant parsed = parseInstant(v);
        if (parsed == null) {
            throw new RowParseException(row.lineNumber(), "unparseable " + field + ": '" + v + "'");
        }
        return parsed;
    }

    /**
     * Accepts ISO instant, ISO offset date-time, ISO local date-time, ISO local date and MM/dd/yyyy. Null if none match.
     */
    public static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String s = raw.trim();
        for (Function<String, Instant> format : FORMATS) {
            Instant parsed = tryParse(format, s);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> format, String s) {
        try {
            return format.apply(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
