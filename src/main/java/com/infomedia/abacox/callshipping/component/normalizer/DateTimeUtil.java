package com.infomedia.abacox.callshipping.component.normalizer;

import lombok.extern.log4j.Log4j2;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;

@Log4j2
public class DateTimeUtil {

    // yyyy-MM-dd[T| ]HH:mm:ss[.fraction][offset]
    private static final DateTimeFormatter PBX_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd")
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendPattern("HH:mm:ss")
            .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
            .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
            .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
            .toFormatter();

    private DateTimeUtil() {
    }

    /**
     * Parses a PBX timestamp into an instant. Values without a zone offset are taken as UTC,
     * plain numbers as Unix epoch seconds. Returns null when the value cannot be parsed.
     */
    public static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("0000-00-00")) {
            return null;
        }
        if (trimmed.matches("^\\d+(\\.\\d+)?$")) {
            return epochToInstant(trimmed);
        }
        try {
            TemporalAccessor parsed = PBX_DATE_TIME.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Could not parse timestamp '{}'", trimmed);
            return null;
        }
    }

    /**
     * Extracts the epoch part of a PBX unique id ({@code [system-]epoch.sequence}).
     */
    public static Instant instantFromUniqueId(String uniqueId) {
        String[] parts = splitUniqueId(uniqueId);
        if (parts == null) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(parts[0]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Extracts the sequence part of a PBX unique id, or null when absent.
     */
    public static Long sequenceFromUniqueId(String uniqueId) {
        String[] parts = splitUniqueId(uniqueId);
        if (parts == null || parts.length < 2) {
            return null;
        }
        try {
            return Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String[] splitUniqueId(String uniqueId) {
        if (uniqueId == null || uniqueId.isBlank()) {
            return null;
        }
        String id = uniqueId.trim();
        int dash = id.lastIndexOf('-');
        if (dash >= 0) {
            id = id.substring(dash + 1);
        }
        String[] parts = id.split("\\.", 2);
        if (!PhoneNumberUtil.isAllDigits(parts[0])) {
            return null;
        }
        return parts;
    }

    private static Instant epochToInstant(String value) {
        try {
            BigDecimal seconds = new BigDecimal(value);
            long whole = seconds.longValue();
            long nanos = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(9).longValue();
            return Instant.ofEpochSecond(whole, nanos);
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }
}
