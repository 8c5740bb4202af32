package com.dailyBrief.accountBrief.account.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an account's records are fetched from.
 */
public enum AccountSource {
    /** The external provider command that also discovers accounts. */
    PROVIDER("provider"),
    /** A mailbox reached directly over IMAP, configured in the account file. */
    IMAP("imap");

    private final String value;

    AccountSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for an unknown source name
     */
    @JsonCreator
    public static AccountSource fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AccountSource source : values()) {
                if (source.value.equals(normalized)) {
                    return source;
                }
            }
        }
        throw new IllegalArgumentException("Unknown account source: " + value);
    }
}
