package com.dcruver.smoothwrite.io;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Reads ISO-8601 timestamps with or without an offset, or epoch millis.
 * Offset-less values are taken in the system time zone. Anything else
 * becomes null so the caller can fall back to a default.
 */
@Slf4j
public class LenientInstantDeserializer extends StdDeserializer<Instant> {

    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (!p.currentToken().isScalarValue()) {
            // Consume the whole object or array so the fields after it still bind
            log.warn("Ignoring non-scalar timestamp value in {}", p.currentName());
            p.skipChildren();
            return null;
        }
        String text = p.getValueAsString();
        if (text == null || text.isBlank()) {
            return null;
        }
        return parse(text.strip());
    }

    static Instant parse(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            // Try next format
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            // Try next format
        }
        try {
            return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            // Try next format
        }
        try {
            return Instant.ofEpochMilli(Long.parseLong(text));
        } catch (NumberFormatException e) {
            log.warn("Failed to parse timestamp: {}", text);
            return null;
        }
    }
}
