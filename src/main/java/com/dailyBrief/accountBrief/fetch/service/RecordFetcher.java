package com.dailyBrief.accountBrief.fetch.service;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.dailyBrief.accountBrief.fetch.exception.AccountFetchException;
import com.dailyBrief.accountBrief.record.kind.RecordKind;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.util.EmailMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches one account's raw records through the fetcher of the account's source.
 */
@Slf4j
@Service
public class RecordFetcher {

    private final Map<AccountSource, SourceFetcher> fetchers;

    public RecordFetcher(List<SourceFetcher> fetchers) {
        Map<AccountSource, SourceFetcher> bySource = new EnumMap<>(AccountSource.class);
        for (SourceFetcher fetcher : fetchers) {
            if (bySource.put(fetcher.source(), fetcher) != null) {
                throw new IllegalStateException("Duplicate fetcher for source: " + fetcher.source());
            }
        }
        this.fetchers = Collections.unmodifiableMap(bySource);
    }

    /**
     * Whether records of {@code kind} can be fetched for {@code account} at all.
     */
    public boolean supports(RecordKind kind, Account account) {
        SourceFetcher fetcher = fetchers.get(account.getSource());
        return fetcher != null && fetcher.supports(kind);
    }

    /**
     * @throws AccountFetchException if the account's source cannot serve this kind, or the fetch fails
     */
    public List<RawRecord> fetch(RecordKind kind, Account account, QueryDescriptor descriptor) {
        if (!supports(kind, account)) {
            throw new AccountFetchException(AccountFetchException.Kind.FETCH,
                    String.format("%s accounts do not provide %s records", account.getSource().getValue(), kind.name()));
        }
        log.debug("Dispatching fetch - account: {}, source: {}, kind: {}",
                EmailMasker.mask(account.getEmail()), account.getSource(), kind.name());
        return fetchers.get(account.getSource()).fetch(kind, account, descriptor);
    }
}
