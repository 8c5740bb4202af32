package com.dailyBrief.accountBrief.fetch.service;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountSource;
import com.dailyBrief.accountBrief.account.model.ImapSettings;
import com.dailyBrief.accountBrief.config.BriefProperties;
import com.dailyBrief.accountBrief.fetch.exception.AccountFetchException;
import com.dailyBrief.accountBrief.record.kind.MailRecordKind;
import com.dailyBrief.accountBrief.record.kind.RecordKind;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import com.dailyBrief.accountBrief.timewindow.model.QueryDescriptor;
import com.dailyBrief.accountBrief.util.EmailMasker;
import jakarta.mail.Address;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Reads mail of configured IMAP accounts straight from their INBOX.
 *
 * Messages are turned into the same raw shape the provider returns
 * ({@code date, subject, from, labels}); an unseen message carries the UNREAD label,
 * so normalization is shared with provider mail.
 * Only the most recent {@code max-results} matches are read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImapMailFetcher implements SourceFetcher {

    static final String INBOX = "INBOX";
    static final String UNREAD_LABEL = "UNREAD";

    private final BriefProperties properties;
    private final Clock clock;

    @Override
    public AccountSource source() {
        return AccountSource.IMAP;
    }

    @Override
    public boolean supports(RecordKind kind) {
        return MailRecordKind.NAME.equals(kind.name());
    }

    @Override
    public List<RawRecord> fetch(RecordKind kind, Account account, QueryDescriptor descriptor) {
        ImapSettings settings = account.getImapSettings();
        ZoneId zone = clock.getZone();
        SearchTerm term = searchTerm(descriptor, LocalDate.now(clock), zone);
        String maskedEmail = EmailMasker.mask(account.getEmail());

        Store store = null;
        Folder folder = null;
        try {
            Session session = Session.getInstance(sessionProperties(settings));
            store = session.getStore(settings.isSsl() ? "imaps" : "imap");
            log.debug("Connecting to IMAP - account: {}, host: {}, port: {}", maskedEmail, settings.getHost(), settings.getPort());
            store.connect(settings.getHost(), settings.getPort(), settings.getUsername(), settings.getPassword());

            folder = store.getFolder(INBOX);
            folder.open(Folder.READ_ONLY);

            Message[] matches = folder.search(term);
            int limit = properties.getProvider().getMaxResults();
            Message[] recent = Arrays.copyOfRange(matches, Math.max(0, matches.length - limit), matches.length);

            FetchProfile profile = new FetchProfile();
            profile.add(FetchProfile.Item.ENVELOPE);
            profile.add(FetchProfile.Item.FLAGS);
            folder.fetch(recent, profile);

            List<RawRecord> records = new ArrayList<>(recent.length);
            for (Message message : recent) {
                records.add(toRawRecord(message, zone));
            }
            log.debug("Fetched IMAP messages - account: {}, matches: {}, read: {}", maskedEmail, matches.length, records.size());
            return records;

        } catch (MessagingException e) {
            throw new AccountFetchException(AccountFetchException.Kind.FETCH,
                    "IMAP fetch failed for " + account.getEmail() + ": " + e.getMessage(), e);
        } finally {
            close(folder, store, maskedEmail);
        }
    }

    /**
     * IMAP dates are day-granular: the relative default window means "since today",
     * an interval {@code [from, to)} means SINCE from and BEFORE to.
     */
    static SearchTerm searchTerm(QueryDescriptor descriptor, LocalDate today, ZoneId zone) {
        if (descriptor.isRelative()) {
            return new ReceivedDateTerm(ComparisonTerm.GE, startOfDay(today, zone));
        }
        return new AndTerm(
                new ReceivedDateTerm(ComparisonTerm.GE, startOfDay(descriptor.getFrom(), zone)),
                new ReceivedDateTerm(ComparisonTerm.LT, startOfDay(descriptor.getTo(), zone)));
    }

    static RawRecord toRawRecord(Message message, ZoneId zone) throws MessagingException {
        Map<String, Object> fields = new LinkedHashMap<>();

        Date sent = message.getSentDate();
        fields.put("date", sent == null
                ? ""
                : OffsetDateTime.ofInstant(sent.toInstant(), zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));

        String subject = message.getSubject();
        if (subject != null) {
            fields.put("subject", subject);
        }

        Address[] from = message.getFrom();
        if (from != null && from.length > 0) {
            fields.put("from", from[0] instanceof InternetAddress address ? address.toUnicodeString() : from[0].toString());
        }

        fields.put("labels", message.isSet(Flags.Flag.SEEN) ? List.of() : List.of(UNREAD_LABEL));
        return RawRecord.of(fields);
    }

    private Properties sessionProperties(ImapSettings settings) {
        String timeout = String.valueOf(properties.getProvider().getFetchTimeout().toMillis());
        String protocol = settings.isSsl() ? "imaps" : "imap";

        Properties props = new Properties();
        props.put("mail." + protocol + ".connectiontimeout", timeout);
        props.put("mail." + protocol + ".timeout", timeout);
        if (settings.isSsl()) {
            props.put("mail.imaps.ssl.checkserveridentity", "true");
        }
        return props;
    }

    private static Date startOfDay(LocalDate day, ZoneId zone) {
        return Date.from(day.atStartOfDay(zone).toInstant());
    }

    private void close(Folder folder, Store store, String maskedEmail) {
        try {
            if (folder != null && folder.isOpen()) {
                folder.close(false);
            }
            if (store != null && store.isConnected()) {
                store.close();
            }
        } catch (MessagingException e) {
            log.warn("Failed to close IMAP connection - account: {}, error: {}", maskedEmail, e.getMessage());
        }
    }
}
