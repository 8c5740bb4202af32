package com.dailyBrief.accountBrief.fetch.service;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.fetch.exception.AccountFetchException;
import com.dailyBrief.accountBrief.provider.exception.ProviderCommandException;
import com.dailyBrief.accountBrief.provider.service.ProviderCommandResult;
import com.dailyBrief.accountBrief.provider.service.ProviderCommandRunner;
import com.dailyBrief.accountBrief.record.kind.RecordKind;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.util.EmailMasker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fetches the raw records of one account from the provider command.
 *
 * Accepted envelopes:
 * - an object holding the kind's list field ({"events": [...]}); without that field the result is empty
 * - a bare array ([...])
 * Any other shape is a parse failure for that account.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderRecordFetcher implements SourceFetcher {

    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ProviderCommandRunner commandRunner;
    private final ObjectMapper objectMapper;
    private final BriefProperties properties;

    @Override
    public AccountSource source() {
        return AccountSource.PROVIDER;
    }

    @Override
    public boolean supports(RecordKind kind) {
        return true;
    }

    /**
     * @param kind       Record kind to fetch
     * @param account    Account to query
     * @param descriptor Query built for this run
     * @return Raw records in provider order
     * @throws AccountFetchException if the provider fails or its output cannot be parsed
     */
    @Override
    public List<RawRecord> fetch(RecordKind kind, Account account, QueryDescriptor descriptor) {
        List<String> args = kind.providerArgs(account, descriptor, properties.getProvider().getMaxResults());
        log.debug("Fetching records - kind: {}, account: {}", kind.name(), EmailMasker.mask(account.getEmail()));

        ProviderCommandResult result;
        try {
            result = commandRunner.run(args, properties.getProvider().getFetchTimeout());
        } catch (ProviderCommandException e) {
            throw new AccountFetchException(AccountFetchException.Kind.FETCH, e.getMessage(), e);
        }

        if (!result.isSuccess()) {
            String message = result.getStderr().trim();
            if (message.isEmpty()) {
                message = String.format("%s exited with code %d", commandRunner.getCommand(), result.getExitCode());
            }
            throw new AccountFetchException(AccountFetchException.Kind.FETCH, message);
        }

        List<RawRecord> records = parseEnvelope(kind.listField(), result.getStdout());
        log.debug("Fetched records - kind: {}, account: {}, count: {}",
                kind.name(), EmailMasker.mask(account.getEmail()), records.size());
        return records;
    }

    List<RawRecord> parseEnvelope(String listField, String output) {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new AccountFetchException(AccountFetchException.Kind.PARSE,
                    "Unexpected JSON format from provider: " + e.getOriginalMessage(), e);
        }

        if (root != null && root.isObject()) {
            JsonNode list = root.get(listField);
            // An object without the list field yields nothing rather than a single record.
            return list != null && list.isArray() ? toRecords(list) : List.of();
        }
        if (root != null && root.isArray()) {
            return toRecords(root);
        }
        throw new AccountFetchException(AccountFetchException.Kind.PARSE, "Unexpected JSON format from provider");
    }

    private List<RawRecord> toRecords(JsonNode array) {
        List<RawRecord> records = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            if (item.isObject()) {
                records.add(RawRecord.of(objectMapper.convertValue(item, RECORD_TYPE)));
            }
        }
        return records;
    }
}
