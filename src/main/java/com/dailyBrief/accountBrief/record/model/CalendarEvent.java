package com.dailyBrief.accountBrief.record.model;

import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Normalized calendar event. Missing provider data is represented by empty strings, never null.
 */
@Value
@Builder
@JsonPropertyOrder({"summary", "start", "end", "location", "status", "response", "account_type"})
public class CalendarEvent implements CanonicalRecord {

    @NonNull String summary;

    /**
     * Start as dateTime, or as date for all-day events.
     */
    @NonNull String start;

    @NonNull String end;

    @NonNull String location;

    @NonNull String status;

    /**
     * The account owner's own response status (accepted, declined, ...).
     */
    @NonNull String response;

    @NonNull
    @JsonProperty("account_type")
    AccountClassification accountType;
}
