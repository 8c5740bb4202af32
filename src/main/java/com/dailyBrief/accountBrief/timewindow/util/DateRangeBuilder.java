package com.dailyBrief.accountBrief.timewindow.util;

import com.dailyBrief.accountBrief.timewindow.model.DateRangePolicy;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.timewindow.model.TimeWindow;
import com.dailyBrief.accountBrief.timewindow.model.TimeWindowSelection;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;

/**
 * Turns a time-window selection into a concrete provider query.
 *
 * All math is done on calendar days; "now" only contributes its local date.
 * Intervals are half-open: {@code from} is included, {@code to} is not.
 */
@Slf4j
public class DateRangeBuilder {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ISO_LOCAL_DATE;

    private final DateRangePolicy policy;

    public DateRangeBuilder(DateRangePolicy policy) {
        this.policy = policy;
    }

    /**
     * Builds the query for the selected window.
     *
     * @param selection Time-window flags
     * @param today     Local date of the reference "now"
     * @return Query descriptor for the highest-priority selected window
     * @throws IllegalArgumentException if an explicit date is not YYYY-MM-DD
     */
    public QueryDescriptor build(TimeWindowSelection selection, LocalDate today) {
        TimeWindow window = selection.resolveWindow();
        QueryDescriptor descriptor = switch (window) {
            case DATE -> {
                LocalDate date = parseDate(selection.getDate());
                yield QueryDescriptor.interval(window, date, date.plusDays(1));
            }
            case LAST_WEEK -> {
                LocalDate weekStart = currentWeekStart(today);
                yield QueryDescriptor.interval(window, weekStart.minusDays(7), weekStart);
            }
            case NEXT_WEEK -> {
                LocalDate nextWeekStart = today.with(TemporalAdjusters.next(policy.getWeekStart()));
                yield QueryDescriptor.interval(window, nextWeekStart, nextWeekStart.plusDays(7));
            }
            case THIS_WEEK -> {
                LocalDate weekStart = currentWeekStart(today);
                LocalDate end = policy.getThisWeekUpperBound() == DateRangePolicy.UpperBound.PROGRESSIVE
                        ? today.plusDays(1)
                        : weekStart.plusDays(7);
                yield QueryDescriptor.interval(window, weekStart, end);
            }
            case YESTERDAY -> QueryDescriptor.interval(window, today.minusDays(1), today);
            case TOMORROW -> QueryDescriptor.interval(window, today.plusDays(1), today.plusDays(2));
            case TODAY -> policy.getDefaultRelativeToken() != null
                    ? QueryDescriptor.relative(window, policy.getDefaultRelativeToken())
                    : QueryDescriptor.interval(window, today, today.plusDays(1));
        };

        log.debug("Built date range - window: {}, from: {}, to: {}, token: {}",
                window, descriptor.getFrom(), descriptor.getTo(), descriptor.getRelativeToken());
        return descriptor;
    }

    /**
     * Most recent occurrence of the configured week-start day, today included.
     */
    LocalDate currentWeekStart(LocalDate today) {
        return today.with(TemporalAdjusters.previousOrSame(policy.getWeekStart()));
    }

    private static LocalDate parseDate(String date) {
        try {
            return LocalDate.parse(date.trim(), DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date format: " + date + ". Use YYYY-MM-DD", e);
        }
    }
}
