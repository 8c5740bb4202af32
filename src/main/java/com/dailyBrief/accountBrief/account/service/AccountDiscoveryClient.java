package com.dailyBrief.accountBrief.account.service;

import com.dailyBrief.accountBrief.account.dto.DiscoveryResponse;
import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.provider.exception.ProviderCommandException;
import com.dailyBrief.accountBrief.provider.service.ProviderCommandResult;
import com.dailyBrief.accountBrief.provider.service.ProviderCommandRunner;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the accounts the provider is authenticated for.
 *
 * Discovery is best effort: any failure degrades to an empty list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountDiscoveryClient {

    static final List<String> DISCOVERY_ARGS = List.of("auth", "list", "--json");

    private final ProviderCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final BriefProperties properties;

    /**
     * @return Discovered emails in provider order, or an empty list if discovery failed
     */
    public List<String> discoverEmails() {
        ProviderCommandResult result;
        try {
            result = commandRunner.run(DISCOVERY_ARGS, properties.getProvider().getDiscoveryTimeout());
        } catch (ProviderCommandException e) {
            log.warn("Account discovery failed - error: {}", e.getMessage());
            return List.of();
        }

        if (!result.isSuccess()) {
            log.warn("Account discovery failed - exitCode: {}, stderr: {}", result.getExitCode(), result.getStderr().trim());
            return List.of();
        }

        DiscoveryResponse response;
        try {
            response = objectMapper.readValue(result.getStdout(), DiscoveryResponse.class);
        } catch (JsonProcessingException e) {
            log.warn("Account discovery returned malformed output - error: {}", e.getOriginalMessage());
            return List.of();
        }

        if (response == null || response.getAccounts() == null) {
            return List.of();
        }

        List<String> emails = new ArrayList<>();
        for (DiscoveryResponse.DiscoveredAccount account : response.getAccounts()) {
            if (account != null && account.getEmail() != null && !account.getEmail().isBlank()) {
                emails.add(account.getEmail().trim());
            }
        }
        log.debug("Account discovery completed - accounts: {}", emails.size());
        return emails;
    }
}
