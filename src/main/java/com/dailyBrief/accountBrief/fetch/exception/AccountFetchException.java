package com.dailyBrief.accountBrief.fetch.exception;

import lombok.Getter;

/**
 * Failure to obtain records for a single account. Never affects other accounts.
 */
@Getter
public class AccountFetchException extends RuntimeException {

    public enum Kind {
        /** Provider failed, timed out, or could not be started. */
        FETCH,
        /** Provider output was not one of the accepted envelopes. */
        PARSE
    }

    private final Kind kind;

    public AccountFetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AccountFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
