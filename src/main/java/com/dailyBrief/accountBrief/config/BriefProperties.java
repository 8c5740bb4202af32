package com.dailyBrief.accountBrief.config;

import com.dailyBrief.accountBrief.account.service.AccountClassifier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed configuration for the brief aggregator, bound from the {@code brief.*} keys.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "brief")
public class BriefProperties {

    /**
     * Record kind used when no --kind flag is given ("calendar" or "mail").
     */
    @NotBlank
    private String kind = "calendar";

    /**
     * Zone used for all calendar-day math. Empty means the system default zone.
     */
    private String zone;

    @Valid
    private Provider provider = new Provider();

    @Valid
    private Fetch fetch = new Fetch();

    @Valid
    private Accounts accounts = new Accounts();

    @Data
    public static class Provider {

        /**
         * Executable of the external data provider.
         */
        @NotBlank
        private String command = "gog";

        @Positive
        private int maxResults = 50;

        @NotNull
        private Duration discoveryTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration fetchTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Fetch {

        /**
         * Number of accounts fetched concurrently. 1 keeps the sequential loop.
         */
        @Positive
        private int parallelism = 1;
    }

    @Data
    public static class Accounts {

        /**
         * Optional JSON file listing accounts that discovery does not report.
         */
        private String configFile = "~/.account-brief/accounts.json";

        private List<String> personalDomains = new ArrayList<>(AccountClassifier.DEFAULT_PERSONAL_DOMAINS);
    }
}
