package com.dailyBrief.accountBrief.provider.service;

import lombok.Value;

/**
 * Captured outcome of one finished provider invocation.
 */
@Value
public class ProviderCommandResult {

    int exitCode;
    String stdout;
    String stderr;

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
