package dk.cloudcreate.essentials.statebased.serializer.json;

import com.fasterxml.jackson.core.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import dk.cloudcreate.essentials.statebased.aggregates.AggregateState;
import org.slf4j.*;

import java.io.IOException;
import java.time.*;
import java.time.format.*;
import java.time.temporal.*;
import java.util.Map;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Formatting and lenient parsing of persisted timestamps.<br>
 * Timestamps are always written as ISO-8601 in UTC with an explicit offset, e.g. <code>2024-01-01T10:00:00Z</code>.<br>
 * When reading, an explicit offset is honoured and normalized to UTC, while a timestamp without offset
 * (<code>2024-01-01T10:00:00</code>, <code>2024-01-01 10:00:00</code>) is interpreted as UTC.<br>
 * {@link ZonedDateTime}'s are normalized to UTC as well, so the original zone isn't persisted.<br>
 * A value that can't be parsed is not fatal: the value is left empty, a warning is logged and, when the
 * {@link #UNPARSED_VALUES_ATTRIBUTE} is present, the raw text is collected under its JSON pointer, no matter how deeply
 * the value is nested. {@link JacksonJSONSerializer} retains the collected values in {@link AggregateState#unparsedValues()}
 */
public final class UtcTimestamps {
    private static final Logger log = LoggerFactory.getLogger(UtcTimestamps.class);

    public static final DateTimeFormatter UTC_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd'T'HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendOffset("+HH:MM", "Z")
            .toFormatter();

    /**
     * {@link DeserializationContext} attribute holding a <code>Map&lt;String, String&gt;</code> that collects the raw text of
     * unparseable timestamps keyed by their JSON pointer
     */
    public static final String UNPARSED_VALUES_ATTRIBUTE = UtcTimestamps.class.getName() + ".unparsedValues";

    private UtcTimestamps() {
    }

    public static String format(OffsetDateTime timestamp) {
        requireNonNull(timestamp, "No timestamp provided");
        return UTC_FORMATTER.format(timestamp.withOffsetSameInstant(ZoneOffset.UTC));
    }

    /**
     * Parse an ISO-8601 timestamp, with or without offset, into a UTC {@link OffsetDateTime}
     *
     * @param text the timestamp text
     * @return the UTC timestamp
     * @throws DateTimeParseException if the text isn't a timestamp
     */
    public static OffsetDateTime parse(String text) {
        requireNonNull(text, "No text provided");
        var normalized = text.trim();
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
        }
        TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(normalized,
                                                                            OffsetDateTime::from,
                                                                            LocalDateTime::from);
        if (parsed instanceof OffsetDateTime) {
            return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC);
        }
        return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
    }

    @SuppressWarnings("unchecked")
    private static OffsetDateTime parseLeniently(JsonParser p, DeserializationContext ctxt, Class<?> targetType) throws IOException {
        String raw;
        if (p.currentToken() == JsonToken.START_OBJECT || p.currentToken() == JsonToken.START_ARRAY) {
            raw = p.readValueAsTree().toString();
        } else {
            raw = p.getValueAsString();
        }
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return parse(raw);
        } catch (DateTimeException e) {
            var jsonPointer = p.getParsingContext().pathAsPointer().toString();
            log.warn("Couldn't parse '{}' value '{}' at '{}'. The value is left empty",
                     targetType.getSimpleName(),
                     raw,
                     jsonPointer);
            var unparsedValues = ctxt.getAttribute(UNPARSED_VALUES_ATTRIBUTE);
            if (unparsedValues instanceof Map && !jsonPointer.isEmpty()) {
                ((Map<String, String>) unparsedValues).put(jsonPointer, raw);
            }
            return null;
        }
    }

    public static class OffsetDateTimeSerializer extends StdSerializer<OffsetDateTime> {
        public OffsetDateTimeSerializer() {
            super(OffsetDateTime.class);
        }

        @Override
        public void serialize(OffsetDateTime value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value));
        }
    }

    public static class OffsetDateTimeDeserializer extends StdScalarDeserializer<OffsetDateTime> {
        public OffsetDateTimeDeserializer() {
            super(OffsetDateTime.class);
        }

        @Override
        public OffsetDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return parseLeniently(p, ctxt, OffsetDateTime.class);
        }
    }

    public static class InstantSerializer extends StdSerializer<Instant> {
        public InstantSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value.atOffset(ZoneOffset.UTC)));
        }
    }

    public static class InstantDeserializer extends StdScalarDeserializer<Instant> {
        public InstantDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            var timestamp = parseLeniently(p, ctxt, Instant.class);
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }

    public static class ZonedDateTimeSerializer extends StdSerializer<ZonedDateTime> {
        public ZonedDateTimeSerializer() {
            super(ZonedDateTime.class);
        }

        @Override
        public void serialize(ZonedDateTime value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(format(value.toOffsetDateTime()));
        }
    }

    public static class ZonedDateTimeDeserializer extends StdScalarDeserializer<ZonedDateTime> {
        public ZonedDateTimeDeserializer() {
            super(ZonedDateTime.class);
        }

        @Override
        public ZonedDateTime deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            var timestamp = parseLeniently(p, ctxt, ZonedDateTime.class);
            return timestamp != null ? timestamp.toZonedDateTime() : null;
        }
    }
}
