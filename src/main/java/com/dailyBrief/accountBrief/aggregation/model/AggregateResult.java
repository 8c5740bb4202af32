package com.dailyBrief.accountBrief.aggregation.model;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.record.model.CanonicalRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.util.List;

/**
 * Merged output of one run.
 *
 * {@code accounts} and {@code records} are always present, possibly empty.
 * {@code errors} is left out of the JSON entirely when no account failed.
 */
@Value
@JsonPropertyOrder({"accounts", "records", "errors"})
public class AggregateResult {

    List<Account> accounts;

    List<CanonicalRecord> records;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    List<AccountError> errors;

    public AggregateResult(List<Account> accounts, List<CanonicalRecord> records, List<AccountError> errors) {
        this.accounts = accounts == null ? List.of() : List.copyOf(accounts);
        this.records = records == null ? List.of() : List.copyOf(records);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
