package com.dailyBrief.accountBrief.timewindow.util;

import com.dailyBrief.accountBrief.timewindow.model.DateRangePolicy;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.timewindow.model.TimeWindow;
import com.dailyBrief.accountBrief.timewindow.model.TimeWindowSelection;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateRangeBuilderTest {

    /** Wednesday. */
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);

    private final DateRangeBuilder mondayFixed = new DateRangeBuilder(
            new DateRangePolicy(DayOfWeek.MONDAY, DateRangePolicy.UpperBound.FIXED, null));

    private final DateRangeBuilder sundayProgressive = new DateRangeBuilder(
            new DateRangePolicy(DayOfWeek.SUNDAY, DateRangePolicy.UpperBound.PROGRESSIVE, "newer_than:1d"));

    @Test
    void thisWeekWithMondayStartCoversWholeWeek() {
        QueryDescriptor descriptor = mondayFixed.build(TimeWindowSelection.of(TimeWindow.THIS_WEEK), TODAY);

        assertInterval(descriptor, "2024-01-08", "2024-01-15");
    }

    @Test
    void thisWeekWithSundayStartEndsAfterToday() {
        QueryDescriptor descriptor = sundayProgressive.build(TimeWindowSelection.of(TimeWindow.THIS_WEEK), TODAY);

        assertInterval(descriptor, "2024-01-07", "2024-01-11");
    }

    @Test
    void nextWeekStartsOnFollowingWeekStart() {
        assertInterval(mondayFixed.build(TimeWindowSelection.of(TimeWindow.NEXT_WEEK), TODAY),
                "2024-01-15", "2024-01-22");
        assertInterval(sundayProgressive.build(TimeWindowSelection.of(TimeWindow.NEXT_WEEK), TODAY),
                "2024-01-14", "2024-01-21");
    }

    @Test
    void nextWeekOnWeekStartDayIsTheFollowingWeek() {
        LocalDate monday = LocalDate.of(2024, 1, 8);

        assertInterval(mondayFixed.build(TimeWindowSelection.of(TimeWindow.NEXT_WEEK), monday),
                "2024-01-15", "2024-01-22");
    }

    @Test
    void lastWeekIsTheSevenDaysBeforeCurrentWeekStart() {
        assertInterval(mondayFixed.build(TimeWindowSelection.of(TimeWindow.LAST_WEEK), TODAY),
                "2024-01-01", "2024-01-08");
        assertInterval(sundayProgressive.build(TimeWindowSelection.of(TimeWindow.LAST_WEEK), TODAY),
                "2023-12-31", "2024-01-07");
    }

    @Test
    void yesterdayAndTomorrowAreSingleDays() {
        assertInterval(mondayFixed.build(TimeWindowSelection.of(TimeWindow.YESTERDAY), TODAY),
                "2024-01-09", "2024-01-10");
        assertInterval(mondayFixed.build(TimeWindowSelection.of(TimeWindow.TOMORROW), TODAY),
                "2024-01-11", "2024-01-12");
    }

    @Test
    void todayUsesIntervalWithoutRelativeToken() {
        assertInterval(mondayFixed.build(TimeWindowSelection.defaults(), TODAY), "2024-01-10", "2024-01-11");
    }

    @Test
    void todayUsesRelativeTokenWhenPolicyHasOne() {
        QueryDescriptor descriptor = sundayProgressive.build(TimeWindowSelection.defaults(), TODAY);

        assertThat(descriptor.isRelative()).isTrue();
        assertThat(descriptor.getRelativeToken()).isEqualTo("newer_than:1d");
        assertThat(descriptor.getFrom()).isNull();
        assertThat(descriptor.getWindow()).isEqualTo(TimeWindow.TODAY);
    }

    @Test
    void explicitDateIsASingleDay() {
        TimeWindowSelection selection = TimeWindowSelection.builder().date("2024-02-29").build();

        assertInterval(sundayProgressive.build(selection, TODAY), "2024-02-29", "2024-03-01");
    }

    @Test
    void explicitDateOutranksOtherFlags() {
        TimeWindowSelection selection = TimeWindowSelection.builder()
                .lastWeek(true).today(true).date("2024-03-05").build();

        QueryDescriptor descriptor = mondayFixed.build(selection, TODAY);

        assertThat(descriptor.getWindow()).isEqualTo(TimeWindow.DATE);
        assertInterval(descriptor, "2024-03-05", "2024-03-06");
    }

    @Test
    void invalidDateIsRejected() {
        TimeWindowSelection selection = TimeWindowSelection.builder().date("2024/01/10").build();

        assertThatThrownBy(() -> mondayFixed.build(selection, TODAY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid date format: 2024/01/10. Use YYYY-MM-DD");
    }

    @Test
    void weekStartIsInclusiveOfToday() {
        LocalDate sunday = LocalDate.of(2024, 1, 7);

        assertThat(sundayProgressive.currentWeekStart(sunday)).isEqualTo(sunday);
        assertInterval(sundayProgressive.build(TimeWindowSelection.of(TimeWindow.THIS_WEEK), sunday),
                "2024-01-07", "2024-01-08");
    }

    private static void assertInterval(QueryDescriptor descriptor, String from, String to) {
        assertThat(descriptor.isRelative()).isFalse();
        assertThat(descriptor.getFrom()).isEqualTo(LocalDate.parse(from));
        assertThat(descriptor.getTo()).isEqualTo(LocalDate.parse(to));
    }
}
