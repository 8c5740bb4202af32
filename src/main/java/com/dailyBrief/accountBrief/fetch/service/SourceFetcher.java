package com.dailyBrief.accountBrief.fetch.service;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.dailyBrief.accountBrief.record.kind.RecordKind;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;

import java.util.List;

/**
 * Fetch path for the accounts of one {@link AccountSource}.
 */
public interface SourceFetcher {

    AccountSource source();

    /**
     * Whether this source can deliver records of the given kind at all.
     */
    boolean supports(RecordKind kind);

    /**
     * @return Raw records in source order
     * @throws com.dailyBrief.accountBrief.fetch.exception.AccountFetchException if the account cannot be read
     */
    List<RawRecord> fetch(RecordKind kind, Account account, QueryDescriptor descriptor);
}
