package com.dailyBrief.accountBrief.record.kind;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.record.model.CanonicalRecord;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.record.service.CalendarEventNormalizer;
import com.dailyBrief.accountBrief.timewindow.model.DateRangePolicy;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar events of the account's primary calendar. Weeks run Monday to Sunday.
 */
@Component
@RequiredArgsConstructor
public class CalendarRecordKind implements RecordKind {

    public static final String NAME = "calendar";

    private static final DateRangePolicy POLICY =
            new DateRangePolicy(DayOfWeek.MONDAY, DateRangePolicy.UpperBound.FIXED, null);

    private final CalendarEventNormalizer normalizer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String listField() {
        return "events";
    }

    @Override
    public DateRangePolicy dateRangePolicy() {
        return POLICY;
    }

    /**
     * The provider's --to bound is the last day included, one less than the exclusive upper bound.
     */
    @Override
    public List<String> providerArgs(Account account, QueryDescriptor descriptor, int maxResults) {
        List<String> args = new ArrayList<>(List.of(
                "calendar", "events", "primary",
                "--json",
                "--max=" + maxResults,
                "--account=" + account.getEmail()));
        if (descriptor.isRelative()) {
            args.add(descriptor.getRelativeToken());
        } else {
            args.add("--from");
            args.add(descriptor.getFrom().format(DateTimeFormatter.ISO_LOCAL_DATE));
            args.add("--to");
            args.add(descriptor.lastDay().format(DateTimeFormatter.ISO_LOCAL_DATE));
        }
        return args;
    }

    @Override
    public CanonicalRecord normalize(RawRecord record, AccountClassification accountType) {
        return normalizer.normalize(record, accountType);
    }
}
