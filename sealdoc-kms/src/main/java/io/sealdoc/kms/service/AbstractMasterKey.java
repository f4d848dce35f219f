/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Holds the state every master key shares: the wrapped data key and its creation date.
 * Subclasses contribute the fields that identify the external key.
 */
public abstract class AbstractMasterKey implements MasterKey {

    /**
     * Six months of thirty days.
     */
    public static final Duration DEFAULT_ROTATION_TTL = Duration.ofDays(6 * 30L);

    @Nullable
    private final String encryptedDataKey;
    private final Instant creationDate;

    protected AbstractMasterKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        this.encryptedDataKey = encryptedDataKey;
        this.creationDate = Objects.requireNonNull(creationDate);
    }

    @Override
    public @Nullable String encryptedDataKey() {
        return encryptedDataKey;
    }

    @Override
    public @NonNull Instant creationDate() {
        return creationDate;
    }

    /**
     * @return how long a wrapped data key may live before {@link #needsRotation(Instant)} reports true.
     */
    protected Duration rotationTtl() {
        return DEFAULT_ROTATION_TTL;
    }

    @Override
    public boolean needsRotation(@NonNull Instant now) {
        return Duration.between(creationDate, now).compareTo(rotationTtl()) > 0;
    }

    /**
     * Adds the fields identifying the external key, in the order they should be written.
     * @param entry the entry being built.
     */
    protected abstract void writeIdentity(Map<String, Object> entry);

    @Override
    public @NonNull Map<String, Object> toMap() {
        var entry = new LinkedHashMap<String, Object>();
        writeIdentity(entry);
        entry.put(KeyEntries.CREATED_AT, KeyEntries.formatTimestamp(creationDate));
        entry.put(KeyEntries.ENC, encryptedDataKey == null ? "" : encryptedDataKey);
        return entry;
    }

    /**
     * @return the wrapped data key.
     * @throws KmsException if this key has no wrapped data key.
     */
    protected String requireEncryptedDataKey() {
        if (!hasEncryptedDataKey()) {
            throw new KmsException("master key " + keyId() + " holds no encrypted data key");
        }
        return encryptedDataKey;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + typeIdentifier() + ":" + keyId() + "]";
    }
}
