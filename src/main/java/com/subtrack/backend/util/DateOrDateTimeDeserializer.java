package com.subtrack.backend.util;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.datatype.jsr310.deser.InstantDeserializer;

import java.io.IOException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Reads an {@link OffsetDateTime} from either a full ISO-8601 timestamp or a bare
 * {@code yyyy-MM-dd} date. A bare date means the start of that day in the application zone.
 */
public class DateOrDateTimeDeserializer extends StdDeserializer<OffsetDateTime> {

    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final ZoneId zone;

    public DateOrDateTimeDeserializer(ZoneId zone) {
        super(OffsetDateTime.class);
        this.zone = zone;
    }

    @Override
    public OffsetDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.hasToken(JsonToken.VALUE_STRING)) {
            String text = p.getText().trim();
            if (DATE_ONLY.matcher(text).matches()) {
                try {
                    return LocalDate.parse(text).atStartOfDay(zone).toOffsetDateTime();
                } catch (DateTimeParseException e) {
                    return (OffsetDateTime) ctxt.handleWeirdStringValue(OffsetDateTime.class, text,
                            "Invalid date: %s", e.getMessage());
                }
            }
        }
        return InstantDeserializer.OFFSET_DATE_TIME.deserialize(p, ctxt);
    }
}
