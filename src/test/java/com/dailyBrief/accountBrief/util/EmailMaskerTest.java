package com.dailyBrief.accountBrief.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmailMaskerTest {

    @Test
    void keepsFirstTwoCharactersAndDomain() {
        assertThat(EmailMasker.mask("john@example.com")).isEqualTo("jo****@example.com");
    }

    @Test
    void hidesShortLocalPartCompletely() {
        assertThat(EmailMasker.mask("jo@example.com")).isEqualTo("****@example.com");
    }

    @Test
    void masksValuesWithoutDomain() {
        assertThat(EmailMasker.mask("abcdefgh")).isEqualTo("ab****gh");
        assertThat(EmailMasker.mask("abc")).isEqualTo("****");
        assertThat(EmailMasker.mask(null)).isEqualTo("****");
    }
}
