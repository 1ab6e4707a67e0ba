package com.example.vitals.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Accepts only ISO-8601 date-time text carrying an offset ({@code Z} or
 * {@code +hh:mm}). Epoch numbers, digit-only strings and zone-less values are
 * rejected.
 */
public class IsoOffsetDateTimeDeserializer extends StdScalarDeserializer<OffsetDateTime> {

    public IsoOffsetDateTimeDeserializer() {
        super(OffsetDateTime.class);
    }

    @Override
    public OffsetDateTime deserialize(JsonParser p, DeserializationContext ctxt)
        throws IOException {
        if (!p.hasToken(JsonToken.VALUE_STRING)) {
            return (OffsetDateTime) ctxt.handleUnexpectedToken(OffsetDateTime.class, p);
        }
        String text = p.getText().trim();
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException e) {
            return (OffsetDateTime) ctxt.handleWeirdStringValue(
                OffsetDateTime.class,
                text,
                "expected an ISO-8601 date-time with offset"
            );
        }
    }
}
