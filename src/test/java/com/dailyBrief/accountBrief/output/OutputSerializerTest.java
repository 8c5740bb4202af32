package com.dailyBrief.accountBrief.output;

import com.dailyBrief.accountBrief.account.model.Account;
import com.dailyBrief.accountBrief.account.model.AccountClassification;
import com.dailyBrief.accountBrief.account.model.ImapSettings;
import com.dailyBrief.accountBrief.aggregation.model.AccountError;
import com.dailyBrief.accountBrief.aggregation.model.AggregateResult;
import com.dailyBrief.accountBrief.record.model.CalendarEvent;
import com.dailyBrief.accountBrief.record.model.MailMessage;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutputSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OutputSerializer serializer = new OutputSerializer(objectMapper);

    @Test
    void omitsErrorsWhenNoAccountFailed() throws Exception {
        AggregateResult result = new AggregateResult(List.of(Account.work("me@acme.io")), List.of(), null);

        String json = serializer.serialize(result);
        JsonNode root = objectMapper.readTree(json);

        assertThat(root.has("errors")).isFalse();
        assertThat(root.get("records").isArray()).isTrue();
        assertThat(root.get("records")).isEmpty();
        assertThat(root.get("accounts").get(0).get("type").asText()).isEqualTo("work");
    }

    @Test
    void writesFieldsInFixedOrder() throws Exception {
        CalendarEvent event = CalendarEvent.builder()
                .summary("Standup").start("2024-01-10T09:00:00+09:00").end("2024-01-10T09:15:00+09:00")
                .location("").status("confirmed").response("accepted")
                .accountType(AccountClassification.WORK)
                .build();
        AggregateResult result = new AggregateResult(
                List.of(Account.work("me@acme.io")),
                List.of(event),
                List.of(AccountError.of(Account.work("other@acme.io"), "token expired")));

        String json = serializer.serialize(result);

        assertThat(json).containsSubsequence("\"accounts\"", "\"records\"", "\"errors\"");
        assertThat(json).containsSubsequence(
                "\"summary\"", "\"start\"", "\"end\"", "\"location\"", "\"status\"", "\"response\"", "\"account_type\"");
        assertThat(json).contains("\"email\": \"other@acme.io\"");
        assertThat(json).contains("\"source\": \"provider\"");
        assertThat(json).contains("\n  \"accounts\"");
    }

    @Test
    void keepsNonAsciiAndHtmlCharactersVerbatim() {
        MailMessage message = MailMessage.builder()
                .date("2024-01-10").subject("회의 <초대> & 일정").fromName("김민지").fromEmail("minji@acme.io")
                .labels(List.of("INBOX")).unread(true).accountType(AccountClassification.PERSONAL)
                .build();

        String json = serializer.serialize(new AggregateResult(List.of(), List.of(message), List.of()));

        assertThat(json).contains("\"subject\": \"회의 <초대> & 일정\"");
        assertThat(json).contains("\"from_name\": \"김민지\"");
        assertThat(json).contains("\"is_unread\": true");
        assertThat(json).contains("\"account_type\": \"personal\"");
    }

    @Test
    void serializesConfigurationError() throws Exception {
        String json = serializer.serializeError("No accounts found. Use --personal/--work or configure gog auth.");

        JsonNode root = objectMapper.readTree(json);
        assertThat(root.size()).isEqualTo(1);
        assertThat(root.get("error").asText())
                .isEqualTo("No accounts found. Use --personal/--work or configure gog auth.");
    }

    @Test
    void writesEmptyListsWithoutPadding() {
        AggregateResult result = new AggregateResult(List.of(Account.work("me@acme.io")), List.of(), List.of());

        String json = serializer.serialize(result);

        assertThat(json).contains("\"records\": []");
        assertThat(json).doesNotContain("[ ]");
        assertThat(json).contains("\"email\": \"me@acme.io\"");
    }

    @Test
    void emptyListInsideRecordStaysCompactAndIndentationContinues() throws Exception {
        MailMessage message = MailMessage.builder()
                .date("2024-01-10").subject("hello").fromName("").fromEmail("a@acme.io")
                .labels(List.of()).unread(false).accountType(AccountClassification.WORK)
                .build();

        String json = serializer.serialize(new AggregateResult(List.of(), List.of(message), List.of()));

        assertThat(json).contains("\"labels\": []");
        assertThat(json).contains("\"accounts\": []");
        assertThat(json).contains("\n      \"is_unread\": false");
        assertThat(objectMapper.readTree(json).get("records").get(0).get("labels")).isEmpty();
    }

    @Test
    void imapSettingsNeverReachOutput() {
        Account imap = Account.imap("me@naver.com", AccountClassification.PERSONAL,
                new ImapSettings("imap.naver.com", 993, true, "me", "hunter2"));

        String json = serializer.serialize(new AggregateResult(List.of(imap), List.of(), List.of()));

        assertThat(json).contains("\"source\": \"imap\"");
        assertThat(json).doesNotContain("hunter2").doesNotContain("imap.naver.com");
    }

    @Test
    void printWritesUtf8EvenWhenStreamCharsetIsNot() {
        MailMessage message = MailMessage.builder()
                .date("2024-01-10").subject("회의 안내").fromName("김민지").fromEmail("minji@acme.io")
                .labels(List.of("UNREAD")).unread(true).accountType(AccountClassification.PERSONAL)
                .build();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream asciiStream = new PrintStream(bytes, true, StandardCharsets.US_ASCII);

        serializer.print(new AggregateResult(List.of(), List.of(message), List.of()), asciiStream);

        String printed = bytes.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("\"subject\": \"회의 안내\"");
        assertThat(printed).contains("\"from_name\": \"김민지\"");
        assertThat(printed).doesNotContain("??");
        assertThat(printed).endsWith(System.lineSeparator());
    }

    @Test
    void printErrorWritesUtf8EvenWhenStreamCharsetIsNot() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        serializer.printError("계정 없음", new PrintStream(bytes, true, StandardCharsets.US_ASCII));

        assertThat(bytes.toString(StandardCharsets.UTF_8)).contains("\"error\": \"계정 없음\"");
    }
}
