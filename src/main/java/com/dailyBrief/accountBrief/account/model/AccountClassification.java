package com.dailyBrief.accountBrief.account.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Personal/work tag derived from an account's email domain.
 */
public enum AccountClassification {
    PERSONAL("personal"),
    WORK("work");

    private final String value;

    AccountClassification(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parses "personal" / "work", ignoring case and surrounding whitespace.
     *
     * @throws IllegalArgumentException for any other value
     */
    @JsonCreator
    public static AccountClassification fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (AccountClassification classification : values()) {
                if (classification.value.equals(normalized)) {
                    return classification;
                }
            }
        }
        throw new IllegalArgumentException("Unknown account type: " + value);
    }
}
