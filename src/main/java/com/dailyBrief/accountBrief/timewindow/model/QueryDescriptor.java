package com.dailyBrief.accountBrief.timewindow.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * What to ask the provider for: either a half-open day interval {@code [from, to)}
 * or an opaque relative token such as {@code newer_than:1d}. Exactly one is set.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class QueryDescriptor {

    TimeWindow window;
    LocalDate from;
    LocalDate to;
    String relativeToken;

    public static QueryDescriptor interval(TimeWindow window, LocalDate from, LocalDate to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (!from.isBefore(to)) {
            throw new IllegalArgumentException("Empty interval: [" + from + ", " + to + ")");
        }
        return new QueryDescriptor(window, from, to, null);
    }

    public static QueryDescriptor relative(TimeWindow window, String relativeToken) {
        Objects.requireNonNull(relativeToken, "relativeToken");
        return new QueryDescriptor(window, null, null, relativeToken);
    }

    public boolean isRelative() {
        return relativeToken != null;
    }

    /**
     * Last day covered by the interval (to - 1 day).
     */
    public LocalDate lastDay() {
        if (isRelative()) {
            throw new IllegalStateException("Relative descriptor has no bounds");
        }
        return to.minusDays(1);
    }
}
