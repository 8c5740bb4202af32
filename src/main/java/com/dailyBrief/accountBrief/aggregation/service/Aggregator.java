package com.dailyBrief.accountBrief.aggregation.service;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.aggregation.model.AccountError;
import com.dailyBrief.accountBrief.aggregation.model.AggregateResult;
import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.fetch.exception.AccountFetchException;
import com.dailyBrief.accountBrief.fetch.service.RecordFetcher;
import com.dailyBrief.accountBrief.record.kind.RecordKind;
import com.dailyBrief.accountBrief.record.model.CanonicalRecord;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.util.EmailMasker;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fetch and normalize for every account and merges the results.
 *
 * Workflow per account: FETCH -> NORMALIZE -> COLLECT.
 * A failing account becomes an {@link AccountError}; the remaining accounts still run.
 * Output order always follows account order, whether accounts run one by one
 * (parallelism 1) or on a bounded pool.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Aggregator {

    private final RecordFetcher recordFetcher;
    private final BriefProperties properties;

    /**
     * @param kind       Record kind of this run
     * @param accounts   Accounts in resolver order
     * @param descriptor Query shared by all accounts
     * @return Merged result; never null, with non-null account and record lists
     */
    public AggregateResult aggregate(RecordKind kind, List<Account> accounts, QueryDescriptor descriptor) {
        int parallelism = Math.min(properties.getFetch().getParallelism(), Math.max(1, accounts.size()));
        log.info("Step AGGREGATE - kind: {}, accounts: {}, window: {}, parallelism: {}",
                kind.name(), accounts.size(), descriptor.getWindow(), parallelism);

        List<AccountOutcome> outcomes = parallelism <= 1
                ? processSequentially(kind, accounts, descriptor)
                : processConcurrently(kind, accounts, descriptor, parallelism);

        List<CanonicalRecord> records = new ArrayList<>();
        List<AccountError> errors = new ArrayList<>();
        for (AccountOutcome outcome : outcomes) {
            if (outcome.getError() != null) {
                errors.add(outcome.getError());
            } else {
                records.addAll(outcome.getRecords());
            }
        }

        log.info("Step AGGREGATE completed - kind: {}, records: {}, failedAccounts: {}",
                kind.name(), records.size(), errors.size());
        return new AggregateResult(accounts, records, errors);
    }

    private List<AccountOutcome> processSequentially(RecordKind kind, List<Account> accounts, QueryDescriptor descriptor) {
        List<AccountOutcome> outcomes = new ArrayList<>(accounts.size());
        for (Account account : accounts) {
            outcomes.add(processAccount(kind, account, descriptor));
        }
        return outcomes;
    }

    private List<AccountOutcome> processConcurrently(RecordKind kind, List<Account> accounts,
                                                     QueryDescriptor descriptor, int parallelism) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "brief-fetch-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            List<Future<AccountOutcome>> futures = new ArrayList<>(accounts.size());
            for (Account account : accounts) {
                futures.add(pool.submit(() -> processAccount(kind, account, descriptor)));
            }

            // Collect in submission order so completion order never reaches the output.
            List<AccountOutcome> outcomes = new ArrayList<>(accounts.size());
            for (int i = 0; i < futures.size(); i++) {
                Account account = accounts.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcomes.add(AccountOutcome.failed(account, "Aggregation was interrupted"));
                } catch (ExecutionException e) {
                    outcomes.add(AccountOutcome.failed(account, String.valueOf(e.getCause())));
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Fetches and normalizes one account. Failures are returned, not thrown.
     */
    private AccountOutcome processAccount(RecordKind kind, Account account, QueryDescriptor descriptor) {
        String maskedEmail = EmailMasker.mask(account.getEmail());
        try {
            List<RawRecord> rawRecords = recordFetcher.fetch(kind, account, descriptor);

            List<CanonicalRecord> records = new ArrayList<>(rawRecords.size());
            for (RawRecord rawRecord : rawRecords) {
                records.add(kind.normalize(rawRecord, account.getClassification()));
            }
            return AccountOutcome.succeeded(records);

        } catch (AccountFetchException e) {
            log.warn("Step FETCH failed - account: {}, source: {}, kind: {}, error: {}",
                    maskedEmail, account.getSource(), e.getKind(), e.getMessage());
            return AccountOutcome.failed(account, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error for account - account: {}", maskedEmail, e);
            return AccountOutcome.failed(account, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    /**
     * Records or error of one account; exactly one is meaningful.
     */
    @Value
    private static class AccountOutcome {
        List<CanonicalRecord> records;
        AccountError error;

        static AccountOutcome succeeded(List<CanonicalRecord> records) {
            return new AccountOutcome(records, null);
        }

        static AccountOutcome failed(Account account, String message) {
            return new AccountOutcome(List.of(), AccountError.of(account, message));
        }
    }
}
