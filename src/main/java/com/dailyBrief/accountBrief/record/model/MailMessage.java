package com.dailyBrief.accountBrief.record.model;

import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Normalized mail message. The UNREAD marker is surfaced as {@link #isUnread()} and
 * never appears in {@link #getLabels()}.
 */
@Value
@Builder
@JsonPropertyOrder({"date", "subject", "from_name", "from_email", "labels", "is_unread", "account_type"})
public class MailMessage implements CanonicalRecord {

    @NonNull String date;

    @NonNull String subject;

    @NonNull
    @JsonProperty("from_name")
    String fromName;

    @NonNull
    @JsonProperty("from_email")
    String fromEmail;

    @NonNull List<String> labels;

    @JsonProperty("is_unread")
    boolean unread;

    @NonNull
    @JsonProperty("account_type")
    AccountClassification accountType;
}
