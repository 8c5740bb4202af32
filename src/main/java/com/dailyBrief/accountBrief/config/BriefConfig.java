package com.dailyBrief.accountBrief.config;

import com.dailyBrief.accountBrief.account.service.AccountClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

@Slf4j
@Configuration
@EnableConfigurationProperties(BriefProperties.class)
public class BriefConfig {

    @Bean
    public Clock briefClock(BriefProperties properties) {
        String zone = properties.getZone();
        if (zone != null && !zone.isBlank()) {
            try {
                return Clock.system(ZoneId.of(zone));
            } catch (DateTimeException e) {
                log.warn("Invalid zone '{}', using system default - error: {}", zone, e.getMessage());
            }
        }
        return Clock.systemDefaultZone();
    }

    @Bean
    public AccountClassifier accountClassifier(BriefProperties properties) {
        return new AccountClassifier(properties.getAccounts().getPersonalDomains());
    }
}
