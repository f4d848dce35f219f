/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.metadata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A key of a backend that is not available. Its metadata entry is carried unchanged so that
 * re-writing the document does not lose it, but it can neither wrap nor unwrap a data key.
 */
public final class OpaqueMasterKey implements MasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpaqueMasterKey.class);

    private final String typeIdentifier;
    private final Map<String, Object> entry;

    public OpaqueMasterKey(@NonNull String typeIdentifier, @NonNull Map<String, ?> entry) {
        this.typeIdentifier = Objects.requireNonNull(typeIdentifier);
        this.entry = Collections.unmodifiableMap(new LinkedHashMap<>(entry));
    }

    @Override
    public @NonNull String typeIdentifier() {
        return typeIdentifier;
    }

    /**
     * @return the first identifying field of the entry, or the whole entry when it has none.
     */
    @Override
    public @NonNull String keyId() {
        return entry.entrySet().stream()
                .filter(e -> !KeyEntries.CREATED_AT.equals(e.getKey()) && !KeyEntries.ENC.equals(e.getKey()))
                .filter(e -> e.getValue() instanceof String)
                .map(e -> (String) e.getValue())
                .findFirst()
                .orElseGet(entry::toString);
    }

    @Override
    public @NonNull Instant creationDate() {
        if (entry.get(KeyEntries.CREATED_AT) instanceof String createdAt) {
            try {
                return KeyEntries.parseTimestamp(createdAt);
            }
            catch (InvalidKeyEntryException e) {
                LOGGER.debug("{} key {} has an unreadable creation date", typeIdentifier, keyId(), e);
            }
        }
        return Instant.EPOCH;
    }

    @Override
    public @Nullable String encryptedDataKey() {
        return entry.get(KeyEntries.ENC) instanceof String enc && !enc.isEmpty() ? enc : null;
    }

    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        var updated = new LinkedHashMap<String, Object>(entry);
        updated.put(KeyEntries.CREATED_AT, KeyEntries.formatTimestamp(creationDate));
        updated.put(KeyEntries.ENC, encryptedDataKey == null ? "" : encryptedDataKey);
        return new OpaqueMasterKey(typeIdentifier, updated);
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        return CompletableFuture.failedFuture(unavailable());
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        return CompletableFuture.failedFuture(unavailable());
    }

    private KmsException unavailable() {
        return new KmsException("no backend is available for keys of type '" + typeIdentifier + "'");
    }

    @Override
    public boolean needsRotation(@NonNull Instant now) {
        return false;
    }

    @Override
    public @NonNull Map<String, Object> toMap() {
        return new LinkedHashMap<>(entry);
    }

    @Override
    public String toString() {
        return "OpaqueMasterKey[" + typeIdentifier + ":" + keyId() + "]";
    }
}
