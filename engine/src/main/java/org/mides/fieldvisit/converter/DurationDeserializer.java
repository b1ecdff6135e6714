package org.mides.fieldvisit.converter;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Reads "HH:mm:ss" or "HH:mm" as an offset from midnight.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("H:mm[:ss]");

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext context) throws IOException {
        String durationStr = p.getText();
        try {
            LocalTime time = LocalTime.parse(durationStr.trim(), TIME_FORMATTER);
            return Duration.between(LocalTime.MIDNIGHT, time);
        } catch (DateTimeParseException e) {
            throw context.weirdStringException(durationStr, Duration.class, "expected H:mm or H:mm:ss");
        }
    }
}
