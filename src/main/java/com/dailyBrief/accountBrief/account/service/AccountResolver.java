package com.dailyBrief.accountBrief.account.service;

import com.dailyBrief.accountBrief.account.model.Account;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds the ordered list of accounts to query.
 *
 * Explicit emails win completely over discovery. Accounts from the configured
 * account file are appended afterwards, skipping emails already present.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountResolver {

    private final AccountDiscoveryClient discoveryClient;
    private final AccountClassifier accountClassifier;
    private final ConfiguredAccountLoader configuredAccountLoader;

    /**
     * @param explicitPersonalEmail Personal account from the command line, may be null
     * @param explicitWorkEmail     Work account from the command line, may be null
     * @return Accounts in query order, possibly empty
     */
    public List<Account> resolve(String explicitPersonalEmail, String explicitWorkEmail) {
        List<Account> accounts = new ArrayList<>();
        if (hasText(explicitPersonalEmail)) {
            accounts.add(Account.personal(explicitPersonalEmail.trim()));
        }
        if (hasText(explicitWorkEmail)) {
            accounts.add(Account.work(explicitWorkEmail.trim()));
        }

        if (accounts.isEmpty()) {
            for (String email : discoveryClient.discoverEmails()) {
                accounts.add(new Account(email, accountClassifier.classify(email)));
            }
            log.debug("Resolved accounts from discovery - count: {}", accounts.size());
        } else {
            log.debug("Resolved accounts from explicit input - count: {}", accounts.size());
        }

        appendConfiguredAccounts(accounts);
        return List.copyOf(accounts);
    }

    private void appendConfiguredAccounts(List<Account> accounts) {
        Set<String> seen = new HashSet<>();
        accounts.forEach(account -> seen.add(account.getEmail().toLowerCase(Locale.ROOT)));

        for (Account configured : configuredAccountLoader.loadAccounts()) {
            if (seen.add(configured.getEmail().toLowerCase(Locale.ROOT))) {
                accounts.add(configured);
            }
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
