package com.dailyBrief.accountBrief.timewindow.model;

import lombok.Builder;
import lombok.Value;

/**
 * Time-window flags as given on the command line. Several flags may be set at once;
 * {@link #resolveWindow()} picks one by fixed priority.
 */
@Value
@Builder
public class TimeWindowSelection {

    boolean today;
    boolean yesterday;
    boolean tomorrow;
    boolean thisWeek;
    boolean nextWeek;
    boolean lastWeek;

    /**
     * Explicit day in YYYY-MM-DD form, or null.
     */
    String date;

    public static TimeWindowSelection defaults() {
        return TimeWindowSelection.builder().build();
    }

    public static TimeWindowSelection of(TimeWindow window) {
        TimeWindowSelectionBuilder builder = TimeWindowSelection.builder();
        switch (window) {
            case TODAY -> builder.today(true);
            case YESTERDAY -> builder.yesterday(true);
            case TOMORROW -> builder.tomorrow(true);
            case THIS_WEEK -> builder.thisWeek(true);
            case NEXT_WEEK -> builder.nextWeek(true);
            case LAST_WEEK -> builder.lastWeek(true);
            case DATE -> throw new IllegalArgumentException("DATE window needs an explicit date");
        }
        return builder.build();
    }

    /**
     * Priority, highest first: explicit date, last week, next week, this week,
     * yesterday, tomorrow, today. Nothing set means today.
     */
    public TimeWindow resolveWindow() {
        if (date != null && !date.isBlank()) {
            return TimeWindow.DATE;
        }
        if (lastWeek) {
            return TimeWindow.LAST_WEEK;
        }
        if (nextWeek) {
            return TimeWindow.NEXT_WEEK;
        }
        if (thisWeek) {
            return TimeWindow.THIS_WEEK;
        }
        if (yesterday) {
            return TimeWindow.YESTERDAY;
        }
        if (tomorrow) {
            return TimeWindow.TOMORROW;
        }
        return TimeWindow.TODAY;
    }
}
