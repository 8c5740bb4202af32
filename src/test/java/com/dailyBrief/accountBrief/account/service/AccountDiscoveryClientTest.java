package com.dailyBrief.accountBrief.account.service;

import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.provider.exception.ProviderCommandException;
import com.dailyBrief.accountBrief.provider.service.ProviderCommandResult;
import com.dailyBrief.accountBrief.provider.service.ProviderCommandRunner;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountDiscoveryClientTest {

    @Mock
    private ProviderCommandRunner commandRunner;

    private AccountDiscoveryClient client;

    @BeforeEach
    void setUp() {
        client = new AccountDiscoveryClient(commandRunner, new ObjectMapper(), new BriefProperties());
    }

    @Test
    void returnsEmailsInProviderOrder() {
        when(commandRunner.run(eq(AccountDiscoveryClient.DISCOVERY_ARGS), eq(Duration.ofSeconds(10))))
                .thenReturn(new ProviderCommandResult(0,
                        "{\"accounts\":[{\"email\":\"b@acme.io\",\"services\":[\"calendar\"]},{\"email\":\"a@gmail.com\"}]}",
                        ""));

        assertThat(client.discoverEmails()).containsExactly("b@acme.io", "a@gmail.com");
    }

    @Test
    void skipsBlankEmails() {
        when(commandRunner.run(any(), any()))
                .thenReturn(new ProviderCommandResult(0,
                        "{\"accounts\":[{\"email\":\"  \"},{},{\"email\":\" a@acme.io \"}]}", ""));

        assertThat(client.discoverEmails()).containsExactly("a@acme.io");
    }

    @Test
    void nonZeroExitYieldsEmptyList() {
        when(commandRunner.run(any(), any())).thenReturn(new ProviderCommandResult(1, "", "not logged in"));

        assertThat(client.discoverEmails()).isEmpty();
    }

    @Test
    void malformedOutputYieldsEmptyList() {
        when(commandRunner.run(any(), any())).thenReturn(new ProviderCommandResult(0, "not json", ""));

        assertThat(client.discoverEmails()).isEmpty();
    }

    @Test
    void missingAccountsFieldYieldsEmptyList() {
        when(commandRunner.run(any(), any())).thenReturn(new ProviderCommandResult(0, "{}", ""));

        assertThat(client.discoverEmails()).isEmpty();
    }

    @Test
    void runnerFailureYieldsEmptyList() {
        when(commandRunner.run(any(), any())).thenThrow(new ProviderCommandException("gog timed out after 10s"));

        assertThat(client.discoverEmails()).isEmpty();
    }
}
