package com.dailyBrief.accountBrief.record.kind;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.record.model.CanonicalRecord;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.timewindow.model.DateRangePolicy;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;

import java.util.List;

/**
 * Everything that differs between the record kinds sharing the aggregation pipeline:
 * provider invocation, envelope field, date conventions, and field mapping.
 */
public interface RecordKind {

    /**
     * Name used on the command line and in configuration (e.g., "calendar").
     */
    String name();

    /**
     * Field of an object envelope that holds the record list (e.g., "events").
     */
    String listField();

    DateRangePolicy dateRangePolicy();

    /**
     * Provider arguments (without the executable) fetching this kind for one account.
     */
    List<String> providerArgs(Account account, QueryDescriptor descriptor, int maxResults);

    /**
     * Maps one provider record to this kind's canonical shape. Never throws on malformed input.
     */
    CanonicalRecord normalize(RawRecord record, AccountClassification accountType);
}
