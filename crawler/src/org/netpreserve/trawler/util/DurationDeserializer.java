package org.netpreserve.trawler.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads durations written as milliseconds (500), with a unit suffix (500ms, 1s, 2m, 1h) or in ISO-8601
 * form (PT1S).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().strip().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith("P")) return Duration.parse(text);
            if (text.endsWith("MS")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).strip()));
            return Duration.parse("PT" + text);
        } catch (DateTimeParseException | NumberFormatException e) {
            return (Duration) deserializationContext.handleWeirdStringValue(Duration.class, text,
                    "expected a duration like 500ms, 1s or 2m");
        }
    }
}
