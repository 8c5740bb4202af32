package com.dailyBrief.accountBrief.timewindow.model;

import lombok.NonNull;
import lombok.Value;

import java.time.DayOfWeek;

/**
 * Date conventions of one record kind.
 */
@Value
public class DateRangePolicy {

    public enum UpperBound {
        /** "This week" ends at the end of the calendar week. */
        FIXED,
        /** "This week" ends after today. */
        PROGRESSIVE
    }

    @NonNull
    DayOfWeek weekStart;

    @NonNull
    UpperBound thisWeekUpperBound;

    /**
     * Provider token used for the default window instead of explicit bounds, or null.
     */
    String defaultRelativeToken;
}
