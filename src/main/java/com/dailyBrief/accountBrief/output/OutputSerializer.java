package com.dailyBrief.accountBrief.output;

import com.dailyBrief.accountBrief.aggregation.model.AggregateResult;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the run result as a single pretty-printed JSON document.
 *
 * Two-space indentation, {@code "key": value} spacing, {@code []} for empty lists, no HTML escaping;
 * non-ASCII text is kept as is and written as UTF-8.
 */
@Component
public class OutputSerializer {

    private final ObjectWriter writer;

    public OutputSerializer(ObjectMapper objectMapper) {
        DefaultPrettyPrinter base = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        base.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);

        this.writer = objectMapper.writer(new CompactEmptyPrettyPrinter(base));
    }

    public String serialize(AggregateResult result) {
        return write(result);
    }

    /**
     * @param message Configuration error text
     * @return {@code {"error": message}}
     */
    public String serializeError(String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        return write(body);
    }

    /**
     * Writes the document as UTF-8 bytes whatever the stream's own charset is.
     */
    public void print(AggregateResult result, PrintStream out) {
        printUtf8(serialize(result), out);
    }

    public void printError(String message, PrintStream out) {
        printUtf8(serializeError(message), out);
    }

    private static void printUtf8(String document, PrintStream out) {
        byte[] bytes = (document + System.lineSeparator()).getBytes(StandardCharsets.UTF_8);
        out.write(bytes, 0, bytes.length);
        out.flush();
    }

    private String write(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize output: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Pretty printer that closes empty arrays and objects without inner padding ({@code []}, {@code {}}).
     */
    static class CompactEmptyPrettyPrinter extends DefaultPrettyPrinter {

        CompactEmptyPrettyPrinter(DefaultPrettyPrinter base) {
            super(base);
        }

        @Override
        public CompactEmptyPrettyPrinter createInstance() {
            return new CompactEmptyPrettyPrinter(this);
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (nrOfValues > 0) {
                super.writeEndArray(g, nrOfValues);
                return;
            }
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw(']');
        }

        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (nrOfEntries > 0) {
                super.writeEndObject(g, nrOfEntries);
                return;
            }
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            g.writeRaw('}');
        }
    }
}
