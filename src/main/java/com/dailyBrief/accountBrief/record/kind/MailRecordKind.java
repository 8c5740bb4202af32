package com.dailyBrief.accountBrief.record.kind;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.record.model.CanonicalRecord;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.record.service.MailMessageNormalizer;
import com.dailyBrief.accountBrief.timewindow.model.DateRangePolicy;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Mail messages found by a mailbox search query. Weeks run Sunday to Saturday and
 * "this week" stops after today.
 */
@Component
@RequiredArgsConstructor
public class MailRecordKind implements RecordKind {

    public static final String NAME = "mail";

    static final String LAST_DAY_TOKEN = "newer_than:1d";

    private static final DateTimeFormatter QUERY_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private static final DateRangePolicy POLICY =
            new DateRangePolicy(DayOfWeek.SUNDAY, DateRangePolicy.UpperBound.PROGRESSIVE, LAST_DAY_TOKEN);

    private final MailMessageNormalizer normalizer;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String listField() {
        return "messages";
    }

    @Override
    public DateRangePolicy dateRangePolicy() {
        return POLICY;
    }

    @Override
    public List<String> providerArgs(Account account, QueryDescriptor descriptor, int maxResults) {
        return List.of(
                "gmail", "messages", "search",
                searchQuery(descriptor),
                "--json",
                "--max=" + maxResults,
                "--account=" + account.getEmail());
    }

    /**
     * Search syntax: "after:" is inclusive, "before:" exclusive, matching the half-open interval.
     */
    static String searchQuery(QueryDescriptor descriptor) {
        if (descriptor.isRelative()) {
            return descriptor.getRelativeToken();
        }
        return "after:" + descriptor.getFrom().format(QUERY_DATE)
                + " before:" + descriptor.getTo().format(QUERY_DATE);
    }

    @Override
    public CanonicalRecord normalize(RawRecord record, AccountClassification accountType) {
        return normalizer.normalize(record, accountType);
    }
}
