package com.dailyBrief.accountBrief.account.service;

import com.dailyBrief.accountBrief.account.dto.ConfiguredAccounts;
import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.dailyBrief.accountBrief.account.model.ImapSettings;
import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.util.EmailMasker;
import com.dailyBrief.accountBrief.util.JsonFileLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads accounts that discovery cannot report from the configured account file.
 *
 * Entries are IMAP mailboxes unless they declare {@code "source": "provider"}.
 * IMAP entries without a server are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConfiguredAccountLoader {

    private final BriefProperties properties;
    private final AccountClassifier accountClassifier;

    /**
     * @return Accounts in file order; empty when no file is configured, it is missing, or it is malformed
     */
    public List<Account> loadAccounts() {
        String location = properties.getAccounts().getConfigFile();
        if (location == null || location.isBlank()) {
            return List.of();
        }

        Path path = JsonFileLoader.resolvePath(location.trim());
        ConfiguredAccounts file = JsonFileLoader.loadAsObjectOrNull(path, ConfiguredAccounts.class);
        if (file == null || file.getAccounts() == null) {
            return List.of();
        }

        List<Account> accounts = new ArrayList<>();
        for (ConfiguredAccounts.ConfiguredAccount entry : file.getAccounts()) {
            if (entry == null || entry.getEmail() == null || entry.getEmail().isBlank()) {
                log.warn("Skipping configured account without email - file: {}", path);
                continue;
            }
            String email = entry.getEmail().trim();
            Account account = toAccount(entry, email);
            if (account != null) {
                accounts.add(account);
            }
        }
        log.debug("Loaded configured accounts - file: {}, accounts: {}", path, accounts.size());
        return accounts;
    }

    private Account toAccount(ConfiguredAccounts.ConfiguredAccount entry, String email) {
        AccountSource source = sourceOf(entry, email);
        if (source == null) {
            return null;
        }
        AccountClassification classification = classificationOf(entry, email);
        if (source == AccountSource.PROVIDER) {
            return new Account(email, classification);
        }

        if (entry.getImapServer() == null || entry.getImapServer().isBlank()) {
            log.warn("Skipping IMAP account without imap_server - account: {}", EmailMasker.mask(email));
            return null;
        }
        boolean ssl = entry.getUseSsl() == null || entry.getUseSsl();
        int port = entry.getImapPort() != null
                ? entry.getImapPort()
                : (ssl ? ImapSettings.DEFAULT_SSL_PORT : ImapSettings.DEFAULT_PLAIN_PORT);
        String username = entry.getUsername() == null || entry.getUsername().isBlank() ? email : entry.getUsername();
        return Account.imap(email, classification,
                new ImapSettings(entry.getImapServer().trim(), port, ssl, username, entry.getPassword()));
    }

    private AccountSource sourceOf(ConfiguredAccounts.ConfiguredAccount entry, String email) {
        if (entry.getSource() == null || entry.getSource().isBlank()) {
            return AccountSource.IMAP;
        }
        try {
            return AccountSource.fromValue(entry.getSource());
        } catch (IllegalArgumentException e) {
            log.warn("Skipping configured account with unknown source '{}' - account: {}",
                    entry.getSource(), EmailMasker.mask(email));
            return null;
        }
    }

    private AccountClassification classificationOf(ConfiguredAccounts.ConfiguredAccount entry, String email) {
        if (entry.getType() == null || entry.getType().isBlank()) {
            return accountClassifier.classify(email);
        }
        try {
            return AccountClassification.fromValue(entry.getType());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown account type '{}' for {}, deriving it from the domain",
                    entry.getType(), EmailMasker.mask(email));
            return accountClassifier.classify(email);
        }
    }
}
