package com.dailyBrief.accountBrief.aggregation.model;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * Why one account contributed no records.
 */
@Value
@JsonPropertyOrder({"email", "error", "source"})
public class AccountError {
    String email;
    String error;
    AccountSource source;

    public static AccountError of(Account account, String error) {
        return new AccountError(account.getEmail(), error, account.getSource());
    }
}
