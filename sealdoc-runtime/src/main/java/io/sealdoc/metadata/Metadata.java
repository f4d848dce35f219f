/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.metadata;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

import io.sealdoc.walk.CryptRule;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The metadata stored alongside the values of an encrypted document, under the reserved top level key {@value #RESERVED_KEY}.
 *
 * @param version format version the document was written with
 * @param cryptRule rule selecting the encrypted values
 * @param mac the encrypted document MAC, or null if the document has none
 * @param lastModified when the document was last encrypted, in the offset it was written with; the MAC is bound to its text
 * @param keySources the master keys holding a copy of the data key
 */
public record Metadata(String version,
                       CryptRule cryptRule,
                       @Nullable String mac,
                       OffsetDateTime lastModified,
                       List<KeySource> keySources) {

    public static final String RESERVED_KEY = "sops";
    public static final String FORMAT_VERSION = "3.9.0";

    public Metadata {
        Objects.requireNonNull(version);
        Objects.requireNonNull(cryptRule);
        Objects.requireNonNull(lastModified);
        keySources = List.copyOf(keySources);
    }

    public Metadata withMac(@Nullable String newMac, OffsetDateTime newLastModified) {
        return new Metadata(version, cryptRule, newMac, newLastModified, keySources);
    }

    public Metadata withKeySources(List<KeySource> newKeySources) {
        return new Metadata(version, cryptRule, mac, lastModified, newKeySources);
    }

    public Metadata withVersion(String newVersion) {
        return new Metadata(newVersion, cryptRule, mac, lastModified, keySources);
    }
}
