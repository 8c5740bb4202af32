package com.dailyBrief.accountBrief.provider.exception;

/**
 * Thrown when the provider process cannot be started, times out, or is interrupted.
 * A non-zero exit is not an exception at this level; it is reported in the result.
 */
public class ProviderCommandException extends RuntimeException {

    public ProviderCommandException(String message) {
        super(message);
    }

    public ProviderCommandException(String message, Throwable cause) {
        super(message, cause);
    }
}
