package com.dailyBrief.accountBrief.account.model;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Connection settings of an IMAP account, read from the account file.
 */
@Value
public class ImapSettings {

    public static final int DEFAULT_SSL_PORT = 993;
    public static final int DEFAULT_PLAIN_PORT = 143;

    @NonNull String host;

    int port;

    boolean ssl;

    @NonNull String username;

    @ToString.Exclude
    String password;
}
