package com.dailyBrief.accountBrief.account.service;

import com.dailyBrief.accountBrief.account.model.AccountClassification;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies an email address as personal or work by its domain.
 *
 * The personal-domain table is fixed at construction and cannot change afterwards.
 * Addresses without a domain part are treated as work accounts.
 */
public class AccountClassifier {

    /**
     * Consumer mail providers treated as personal when no other list is configured.
     */
    public static final List<String> DEFAULT_PERSONAL_DOMAINS = List.of(
            "gmail.com", "naver.com", "daum.net", "hanmail.net", "yahoo.com",
            "hotmail.com", "outlook.com", "icloud.com", "kakao.com", "nate.com");

    private final Set<String> personalDomains;

    public AccountClassifier(Collection<String> personalDomains) {
        this.personalDomains = personalDomains.stream()
                .filter(Objects::nonNull)
                .map(domain -> domain.trim().toLowerCase(Locale.ROOT))
                .filter(domain -> !domain.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public AccountClassification classify(String email) {
        if (email == null) {
            return AccountClassification.WORK;
        }
        int at = email.indexOf('@');
        if (at < 0) {
            return AccountClassification.WORK;
        }
        String domain = email.substring(at + 1).toLowerCase(Locale.ROOT);
        return personalDomains.contains(domain) ? AccountClassification.PERSONAL : AccountClassification.WORK;
    }

    public Set<String> getPersonalDomains() {
        return personalDomains;
    }
}
