/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Helpers for reading and writing the per-key entries stored in document metadata.
 */
public final class KeyEntries {

    public static final String CREATED_AT = "created_at";
    public static final String ENC = "enc";

    private static final DateTimeFormatter OFFSET_SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssXXX");

    private KeyEntries() {
    }

    /**
     * @param entry metadata entry
     * @param field field name
     * @return the non-empty string value of the field.
     * @throws InvalidKeyEntryException if the field is absent, empty or not a string.
     */
    public static @NonNull String requireString(Map<String, ?> entry, String field) {
        String value = optionalString(entry, field);
        if (value == null || value.isEmpty()) {
            throw new InvalidKeyEntryException("key entry lacks required field '" + field + "'");
        }
        return value;
    }

    /**
     * @param entry metadata entry
     * @param field field name
     * @return the string value of the field or null if absent.
     * @throws InvalidKeyEntryException if the field is present but not a string.
     */
    public static @Nullable String optionalString(Map<String, ?> entry, String field) {
        Object value = entry.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof String s) {
            return s;
        }
        throw new InvalidKeyEntryException("key entry field '" + field + "' must be a string but was " + value.getClass().getSimpleName());
    }

    /**
     * @param entry metadata entry
     * @return the wrapped data key, or null if the key has not wrapped one.
     */
    public static @Nullable String encryptedDataKey(Map<String, ?> entry) {
        String enc = optionalString(entry, ENC);
        return enc == null || enc.isEmpty() ? null : enc;
    }

    /**
     * @param entry metadata entry
     * @return the parsed {@code created_at} field.
     * @throws InvalidKeyEntryException if the field is absent or is not an RFC 3339 timestamp.
     */
    public static @NonNull Instant creationDate(Map<String, ?> entry) {
        return parseTimestamp(requireString(entry, CREATED_AT));
    }

    public static @NonNull Instant parseTimestamp(String text) {
        return parseOffsetTimestamp(text).toInstant();
    }

    /**
     * @param text RFC 3339 timestamp
     * @return the timestamp, keeping the offset it was written with.
     * @throws InvalidKeyEntryException if the text is not an RFC 3339 timestamp.
     */
    public static @NonNull OffsetDateTime parseOffsetTimestamp(String text) {
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        catch (DateTimeParseException e) {
            throw new InvalidKeyEntryException("'" + text + "' is not an RFC 3339 timestamp", e);
        }
    }

    /**
     * Formats to RFC 3339 in UTC with second precision, e.g. {@code 2024-02-29T10:15:30Z}.
     * @param instant instant
     * @return formatted timestamp
     */
    public static @NonNull String formatTimestamp(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Formats to RFC 3339 with second precision in the timestamp's own offset, e.g. {@code 2024-02-29T12:15:30+02:00}.
     * A zero offset is written as {@code Z}.
     * @param timestamp timestamp
     * @return formatted timestamp
     */
    public static @NonNull String formatTimestamp(OffsetDateTime timestamp) {
        return OFFSET_SECONDS.format(timestamp.truncatedTo(ChronoUnit.SECONDS));
    }
}
