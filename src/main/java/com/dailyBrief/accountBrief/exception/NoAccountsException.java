package com.dailyBrief.accountBrief.exception;

/**
 * Exception thrown when neither flags, discovery nor the account file yield any account.
 */
public class NoAccountsException extends RuntimeException {

    public NoAccountsException(String providerCommand) {
        super(String.format("No accounts found. Use --personal/--work or configure %s auth.", providerCommand));
    }
}
