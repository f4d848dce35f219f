/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyEntriesTest {

    @Test
    void parsesUtcAndOffsetTimestamps() {
        assertThat(KeyEntries.parseTimestamp("2017-09-06T11:46:37Z")).isEqualTo(Instant.parse("2017-09-06T11:46:37Z"));
        assertThat(KeyEntries.parseTimestamp("2017-09-06T13:46:37+02:00")).isEqualTo(Instant.parse("2017-09-06T11:46:37Z"));
    }

    @Test
    void rejectsMalformedTimestamp() {
        assertThatThrownBy(() -> KeyEntries.parseTimestamp("yesterday"))
                .isInstanceOf(InvalidKeyEntryException.class)
                .hasMessageContaining("yesterday");
    }

    @Test
    void formatsWithSecondPrecisionInUtc() {
        assertThat(KeyEntries.formatTimestamp(Instant.parse("2024-02-29T10:15:30.987Z"))).isEqualTo("2024-02-29T10:15:30Z");
    }

    @Test
    void formatsOffsetTimestampInItsOwnOffset() {
        assertThat(KeyEntries.formatTimestamp(KeyEntries.parseOffsetTimestamp("2024-02-29T12:15:30.5+02:00"))).isEqualTo("2024-02-29T12:15:30+02:00");
        assertThat(KeyEntries.formatTimestamp(KeyEntries.parseOffsetTimestamp("2024-02-29T10:15:30+00:00"))).isEqualTo("2024-02-29T10:15:30Z");
        assertThat(KeyEntries.formatTimestamp(KeyEntries.parseOffsetTimestamp("2024-02-29T10:15:30Z"))).isEqualTo("2024-02-29T10:15:30Z");
    }

    @Test
    void requireStringRejectsMissingAndEmpty() {
        Map<String, Object> entry = new HashMap<>();
        entry.put("arn", "");
        assertThatThrownBy(() -> KeyEntries.requireString(entry, "arn")).isInstanceOf(InvalidKeyEntryException.class);
        assertThatThrownBy(() -> KeyEntries.requireString(entry, "fp")).isInstanceOf(InvalidKeyEntryException.class);
    }

    @Test
    void optionalStringRejectsWrongType() {
        Map<String, Object> entry = Map.of("role", 42);
        assertThatThrownBy(() -> KeyEntries.optionalString(entry, "role"))
                .isInstanceOf(InvalidKeyEntryException.class)
                .hasMessageContaining("Integer");
    }

    @Test
    void emptyEncryptedDataKeyIsAbsent() {
        assertThat(KeyEntries.encryptedDataKey(Map.of("enc", ""))).isNull();
        assertThat(KeyEntries.encryptedDataKey(Map.of())).isNull();
        assertThat(KeyEntries.encryptedDataKey(Map.of("enc", "abc"))).isEqualTo("abc");
    }

    @Test
    void creationDateRequired() {
        assertThat(KeyEntries.creationDate(Map.of("created_at", "2020-01-01T00:00:00Z"))).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        Map<String, Object> empty = Map.of();
        assertThatThrownBy(() -> KeyEntries.creationDate(empty)).isInstanceOf(InvalidKeyEntryException.class);
    }
}
