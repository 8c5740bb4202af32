package com.dailyBrief.accountBrief.cli;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.service.AccountResolver;
import com.dailyBrief.accountBrief.aggregation.model.AggregateResult;
import com.dailyBrief.accountBrief.aggregation.service.Aggregator;
import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.exception.NoAccountsException;
import com.dailyBrief.accountBrief.fetch.service.RecordFetcher;
import com.dailyBrief.accountBrief.output.OutputSerializer;
import com.dailyBrief.accountBrief.record.kind.RecordKind;
import com.dailyBrief.accountBrief.record.kind.RecordKindRegistry;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.timewindow.model.TimeWindowSelection;
import com.dailyBrief.accountBrief.timewindow.util.DateRangeBuilder;
import com.dailyBrief.accountBrief.util.EmailMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point.
 *
 * Flow:
 * 1. Parse kind, account and time-window flags
 * 2. Resolve accounts and keep those whose source serves the kind (exit 1 when none)
 * 3. Build the query once for the kind's date policy
 * 4. Aggregate all accounts and print the JSON result to stdout
 *
 * Invalid arguments and missing accounts print {@code {"error": "..."}} and exit 1.
 * Per-account failures are part of the normal result and exit 0.
 * Any other failure is logged at ERROR and printed the same way, with exit 1.
 * Stdout is always UTF-8, independent of the platform charset.
 */
@Slf4j
@Component
public class BriefCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final AccountResolver accountResolver;
    private final RecordKindRegistry recordKindRegistry;
    private final Aggregator aggregator;
    private final RecordFetcher recordFetcher;
    private final OutputSerializer outputSerializer;
    private final BriefProperties properties;
    private final Clock clock;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public BriefCommandRunner(AccountResolver accountResolver,
                              RecordKindRegistry recordKindRegistry,
                              Aggregator aggregator,
                              RecordFetcher recordFetcher,
                              OutputSerializer outputSerializer,
                              BriefProperties properties,
                              Clock clock) {
        this(accountResolver, recordKindRegistry, aggregator, recordFetcher, outputSerializer, properties, clock,
                new PrintStream(new FileOutputStream(FileDescriptor.out), true, StandardCharsets.UTF_8));
    }

    BriefCommandRunner(AccountResolver accountResolver,
                       RecordKindRegistry recordKindRegistry,
                       Aggregator aggregator,
                       RecordFetcher recordFetcher,
                       OutputSerializer outputSerializer,
                       BriefProperties properties,
                       Clock clock,
                       PrintStream out) {
        this.accountResolver = accountResolver;
        this.recordKindRegistry = recordKindRegistry;
        this.aggregator = aggregator;
        this.recordFetcher = recordFetcher;
        this.outputSerializer = outputSerializer;
        this.properties = properties;
        this.clock = clock;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            RecordKind kind = recordKindRegistry.get(optionValue(args, "kind", properties.getKind()));
            TimeWindowSelection selection = parseSelection(args);
            log.info("Step 1 - Parsed arguments - kind: {}, window: {}", kind.name(), selection.resolveWindow());

            List<Account> accounts = supportedAccounts(kind, accountResolver.resolve(
                    optionValue(args, "personal", null),
                    optionValue(args, "work", null)));
            if (accounts.isEmpty()) {
                throw new NoAccountsException(properties.getProvider().getCommand());
            }
            log.info("Step 2 - Resolved accounts - count: {}", accounts.size());

            LocalDate today = LocalDate.now(clock);
            QueryDescriptor descriptor = new DateRangeBuilder(kind.dateRangePolicy()).build(selection, today);
            log.info("Step 3 - Built query - window: {}, from: {}, to: {}, token: {}",
                    descriptor.getWindow(), descriptor.getFrom(), descriptor.getTo(), descriptor.getRelativeToken());

            AggregateResult result = aggregator.aggregate(kind, accounts, descriptor);
            outputSerializer.print(result, out);
            log.info("Step 4 - Completed - records: {}, errors: {}",
                    result.getRecords().size(), result.getErrors().size());
            exitCode = 0;

        } catch (NoAccountsException | IllegalArgumentException e) {
            log.warn("Configuration error: {}", e.getMessage());
            outputSerializer.printError(e.getMessage(), out);
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Run failed", e);
            outputSerializer.printError(e.getMessage() != null ? e.getMessage() : e.toString(), out);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private List<Account> supportedAccounts(RecordKind kind, List<Account> resolved) {
        List<Account> accounts = new ArrayList<>(resolved.size());
        for (Account account : resolved) {
            if (recordFetcher.supports(kind, account)) {
                accounts.add(account);
            } else {
                log.info("Skipping account - account: {}, source: {}, kind: {}",
                        EmailMasker.mask(account.getEmail()), account.getSource(), kind.name());
            }
        }
        return accounts;
    }

    static TimeWindowSelection parseSelection(ApplicationArguments args) {
        return TimeWindowSelection.builder()
                .today(args.containsOption("today"))
                .yesterday(args.containsOption("yesterday"))
                .tomorrow(args.containsOption("tomorrow"))
                .thisWeek(args.containsOption("this-week"))
                .nextWeek(args.containsOption("next-week"))
                .lastWeek(args.containsOption("last-week"))
                .date(optionValue(args, "date", null))
                .build();
    }

    /**
     * Last non-blank value of an option, or the fallback.
     */
    private static String optionValue(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return fallback;
        }
        for (int i = values.size() - 1; i >= 0; i--) {
            String value = values.get(i);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return fallback;
    }
}
