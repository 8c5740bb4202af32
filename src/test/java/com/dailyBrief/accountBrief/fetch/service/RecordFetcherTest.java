package com.dailyBrief.accountBrief.fetch.service;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.dailyBrief.accountBrief.account.model.ImapSettings;
import com.dailyBrief.accountBrief.fetch.exception.AccountFetchException;
import com.dailyBrief.accountBrief.record.kind.CalendarRecordKind;
import com.dailyBrief.accountBrief.record.kind.MailRecordKind;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.record.service.CalendarEventNormalizer;
import com.dailyBrief.accountBrief.record.service.MailMessageNormalizer;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.timewindow.model.TimeWindow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecordFetcherTest {

    @Mock
    private SourceFetcher providerFetcher;

    @Mock
    private SourceFetcher imapFetcher;

    private RecordFetcher recordFetcher;

    private final CalendarRecordKind calendar = new CalendarRecordKind(new CalendarEventNormalizer());
    private final MailRecordKind mail = new MailRecordKind(new MailMessageNormalizer());
    private final QueryDescriptor today = QueryDescriptor.relative(TimeWindow.TODAY, "newer_than:1d");
    private final Account providerAccount = Account.personal("me@gmail.com");
    private final Account imapAccount = Account.imap("me@naver.com", AccountClassification.PERSONAL,
            new ImapSettings("imap.naver.com", 993, true, "me", "secret"));

    @BeforeEach
    void setUp() {
        when(providerFetcher.source()).thenReturn(AccountSource.PROVIDER);
        when(imapFetcher.source()).thenReturn(AccountSource.IMAP);
        lenient().when(providerFetcher.supports(any())).thenReturn(true);
        lenient().when(imapFetcher.supports(mail)).thenReturn(true);
        lenient().when(imapFetcher.supports(calendar)).thenReturn(false);
        recordFetcher = new RecordFetcher(List.of(providerFetcher, imapFetcher));
    }

    @Test
    void configuredImapAccountIsFetchedThroughItsOwnSource() {
        List<RawRecord> expected = List.of(RawRecord.of(Map.of("subject", "hi")));
        when(imapFetcher.fetch(mail, imapAccount, today)).thenReturn(expected);

        assertThat(recordFetcher.fetch(mail, imapAccount, today)).isEqualTo(expected);
        verify(providerFetcher, never()).fetch(any(), any(), any());
    }

    @Test
    void providerAccountIsFetchedThroughProvider() {
        when(providerFetcher.fetch(mail, providerAccount, today)).thenReturn(List.of());

        assertThat(recordFetcher.fetch(mail, providerAccount, today)).isEmpty();
        verify(imapFetcher, never()).fetch(any(), any(), any());
    }

    @Test
    void reportsWhichKindsEachSourceServes() {
        assertThat(recordFetcher.supports(calendar, providerAccount)).isTrue();
        assertThat(recordFetcher.supports(mail, imapAccount)).isTrue();
        assertThat(recordFetcher.supports(calendar, imapAccount)).isFalse();
    }

    @Test
    void unsupportedKindIsFetchError() {
        assertThatThrownBy(() -> recordFetcher.fetch(calendar, imapAccount, today))
                .isInstanceOfSatisfying(AccountFetchException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(AccountFetchException.Kind.FETCH);
                    assertThat(e.getMessage()).isEqualTo("imap accounts do not provide calendar records");
                });
        verify(imapFetcher, never()).fetch(any(), any(), any());
    }

    @Test
    void rejectsTwoFetchersForOneSource() {
        assertThatThrownBy(() -> new RecordFetcher(List.of(providerFetcher, providerFetcher)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("PROVIDER");
    }
}
