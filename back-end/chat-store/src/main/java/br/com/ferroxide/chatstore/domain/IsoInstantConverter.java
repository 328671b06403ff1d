package br.com.ferroxide.chatstore.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Stores instants as fixed-width UTC ISO-8601 text, e.g. {@code 2024-05-01T12:00:00.000000Z}.
 * <p>
 * Every value has the same length, so ordering the column as text orders it chronologically.
 * That holds for four-digit years only; instants outside {@link #MIN} .. {@link #MAX} are refused.
 * Reading accepts any ISO-8601 offset date-time.
 */
@Converter
public class IsoInstantConverter implements AttributeConverter<Instant, String> {

    static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    public static final Instant MIN = Instant.parse("0000-01-01T00:00:00Z");
    public static final Instant MAX = Instant.parse("9999-12-31T23:59:59.999999Z");

    public static boolean isStorable(Instant instant) {
        return !instant.isBefore(MIN) && !instant.isAfter(MAX);
    }

    @Override
    public String convertToDatabaseColumn(Instant attribute) {
        if (attribute == null) {
            return null;
        }
        if (!isStorable(attribute)) {
            throw new IllegalArgumentException("Instant outside " + MIN + " .. " + MAX + ": " + attribute);
        }
        return FORMAT.format(attribute.truncatedTo(ChronoUnit.MICROS));
    }

    @Override
    public Instant convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return OffsetDateTime.parse(dbData, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }
}
