package com.dailyBrief.accountBrief.account.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * One account to query. Created once per run, never mutated.
 *
 * IMAP accounts carry their connection settings, which never reach the JSON output.
 */
@Value
@JsonPropertyOrder({"email", "type", "source"})
public class Account {

    String email;

    @JsonProperty("type")
    AccountClassification classification;

    @NonNull AccountSource source;

    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    ImapSettings imapSettings;

    public Account(String email, AccountClassification classification) {
        this(email, classification, AccountSource.PROVIDER, null);
    }

    public Account(String email, AccountClassification classification,
                   @NonNull AccountSource source, ImapSettings imapSettings) {
        if (source == AccountSource.IMAP && imapSettings == null) {
            throw new IllegalArgumentException("IMAP account " + email + " needs connection settings");
        }
        this.email = email;
        this.classification = classification;
        this.source = source;
        this.imapSettings = imapSettings;
    }

    public static Account personal(String email) {
        return new Account(email, AccountClassification.PERSONAL);
    }

    public static Account work(String email) {
        return new Account(email, AccountClassification.WORK);
    }

    public static Account imap(String email, AccountClassification classification, ImapSettings settings) {
        return new Account(email, classification, AccountSource.IMAP, settings);
    }
}
