package com.dailyBrief.accountBrief.record.service;

import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.record.model.MailMessage;
import com.dailyBrief.accountBrief.record.model.RawRecord;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes provider mail messages to {@link MailMessage}.
 */
@Service
public class MailMessageNormalizer {

    static final String NO_SUBJECT = "(No subject)";
    static final String UNREAD_LABEL = "UNREAD";

    public MailMessage normalize(RawRecord message, AccountClassification accountType) {
        String subject = message.string("subject");
        Sender sender = parseFrom(message.string("from"));

        List<String> labels = new ArrayList<>();
        boolean unread = false;
        for (String label : message.stringList("labels")) {
            if (UNREAD_LABEL.equals(label)) {
                unread = true;
            } else {
                labels.add(label);
            }
        }

        return MailMessage.builder()
                .date(message.string("date"))
                .subject(subject.isEmpty() ? NO_SUBJECT : subject)
                .fromName(sender.getName())
                .fromEmail(sender.getEmail())
                .labels(List.copyOf(labels))
                .unread(unread)
                .accountType(accountType)
                .build();
    }

    /**
     * Splits {@code "Display Name <user@domain>"} on the first '<'. Without angle brackets the
     * whole value is used as both name and address; no address validation is done.
     */
    static Sender parseFrom(String raw) {
        String from = raw == null ? "" : raw.trim();
        if (from.isEmpty()) {
            return new Sender("", "");
        }

        int open = from.indexOf('<');
        int close = open < 0 ? -1 : from.indexOf('>', open + 1);
        if (open < 0 || close < 0) {
            return new Sender(from, from);
        }
        return new Sender(from.substring(0, open).trim(), from.substring(open + 1, close).trim());
    }

    @Value
    static class Sender {
        String name;
        String email;
    }
}
