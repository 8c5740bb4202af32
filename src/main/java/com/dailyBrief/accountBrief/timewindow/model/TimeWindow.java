package com.dailyBrief.accountBrief.timewindow.model;

/**
 * The time window a brief covers.
 */
public enum TimeWindow {
    TODAY,
    YESTERDAY,
    TOMORROW,
    THIS_WEEK,
    NEXT_WEEK,
    LAST_WEEK,
    DATE
}
