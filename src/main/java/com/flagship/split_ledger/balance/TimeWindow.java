package com.flagship.split_ledger.balance;

import lombok.Value;

import java.time.Instant;

/**
 * Half-open time range {@code [from, to)}. Either bound may be null, meaning open.
 */
@Value
public class TimeWindow {
    Instant from;
    Instant to;

    private TimeWindow(Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException(
                String.format("Window start %s must be before end %s", from, to));
        }
        this.from = from;
        this.to = to;
    }

    public static TimeWindow between(Instant from, Instant to) {
        return new TimeWindow(from, to);
    }

    public static TimeWindow since(Instant from) {
        return new TimeWindow(from, null);
    }

    public static TimeWindow until(Instant to) {
        return new TimeWindow(null, to);
    }

    public static TimeWindow unbounded() {
        return new TimeWindow(null, null);
    }

    public boolean contains(Instant instant) {
        if (from != null && instant.isBefore(from)) {
            return false;
        }
        return to == null || instant.isBefore(to);
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }
}
