package com.chartgate.metering;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * A calendar month in UTC, the unit quotas are counted in.
 */
public record BillingPeriod(YearMonth month) implements Comparable<BillingPeriod> {

    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    public BillingPeriod {
        if (month == null) {
            throw new IllegalArgumentException("month must not be null");
        }
    }

    /** The period containing {@code instant}. */
    public static BillingPeriod of(Instant instant) {
        return new BillingPeriod(YearMonth.from(instant.atOffset(ZoneOffset.UTC)));
    }

    /**
     * @throws IllegalArgumentException if {@code id} is not {@code yyyy-MM}
     */
    public static BillingPeriod parse(String id) {
        try {
            return new BillingPeriod(YearMonth.parse(id, ID_FORMAT));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Billing period must be yyyy-MM: " + id, e);
        }
    }

    /** {@code yyyy-MM}. */
    public String id() {
        return month.format(ID_FORMAT);
    }

    /** Inclusive start, midnight UTC on the first of the month. */
    public Instant start() {
        return month.atDay(1).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    /** Exclusive end, the start of the next period. */
    public Instant end() {
        return next().start();
    }

    public BillingPeriod next() {
        return new BillingPeriod(month.plusMonths(1));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start()) && instant.isBefore(end());
    }

    @Override
    public int compareTo(BillingPeriod other) {
        return month.compareTo(other.month);
    }

    @Override
    public String toString() {
        return id();
    }
}
