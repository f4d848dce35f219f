/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import javax.crypto.SecretKey;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>An externally held key that wraps and unwraps a document's data key.</p>
 *
 * <p>Implementations are immutable values. {@link #encrypt(SecretKey)} never changes the receiver;
 * the caller attaches the result with {@link #withEncryptedDataKey(String, Instant)}. This lets a
 * whole set of keys be re-wrapped and only published once every wrap has succeeded.</p>
 */
public interface MasterKey {

    /**
     * @return the identifier of the backend this key belongs to, for example {@code kms} or {@code pgp}.
     * It names the list this key is stored in within document metadata.
     */
    @NonNull
    String typeIdentifier();

    /**
     * @return a stable textual identity of the key, for example an ARN or a fingerprint.
     * Two master keys with equal key ids refer to the same external key.
     */
    @NonNull
    String keyId();

    /**
     * @return when the wrapped data key held by this master key was created.
     */
    @NonNull
    Instant creationDate();

    /**
     * @return the wrapped data key, or null if the data key has not been wrapped by this key yet.
     */
    @Nullable
    String encryptedDataKey();

    /**
     * @return true if this key holds a non-empty wrapped data key.
     */
    default boolean hasEncryptedDataKey() {
        String enc = encryptedDataKey();
        return enc != null && !enc.isEmpty();
    }

    /**
     * Returns a copy of this key carrying the given wrapped data key.
     * @param encryptedDataKey the wrapped data key, or null to clear it.
     * @param creationDate the creation time to record.
     * @return the copy.
     */
    @NonNull
    MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate);

    /**
     * Asynchronously wraps the given data key.
     *
     * @param dataKey the data key. Implementations must not retain or destroy it.
     * @return a completion stage for the wrapped data key in the textual form stored in metadata.
     * @throws KmsException (through the stage) if the backend refused or could not be reached.
     */
    @NonNull
    CompletionStage<String> encrypt(@NonNull SecretKey dataKey);

    /**
     * Asynchronously unwraps the data key held by this master key.
     *
     * <p>It is strongly recommended that the returned {@code SecretKey} is a
     * {@link DestroyableRawSecretKey} so that callers can zero it once finished.</p>
     *
     * @return a completion stage for the data key.
     * @throws KmsException (through the stage) if there is nothing to unwrap or the backend failed.
     * @throws UnknownKeyException (through the stage) if the backend does not know this key.
     */
    @NonNull
    CompletionStage<SecretKey> decrypt();

    /**
     * Wraps the data key and returns a copy of this key holding the result with a fresh creation date.
     * @param dataKey the data key.
     * @return a completion stage for the updated master key.
     */
    @NonNull
    default CompletionStage<MasterKey> wrap(@NonNull SecretKey dataKey) {
        return encrypt(dataKey).thenApply(enc -> withEncryptedDataKey(enc, Instant.now().truncatedTo(ChronoUnit.SECONDS)));
    }

    /**
     * @param now the current time
     * @return true if the wrapped data key is older than the time-to-live of this backend.
     */
    boolean needsRotation(@NonNull Instant now);

    /**
     * @return true if the wrapped data key is older than the time-to-live of this backend.
     */
    default boolean needsRotation() {
        return needsRotation(Instant.now());
    }

    /**
     * @return the metadata entry for this key. Iteration order is the order fields are written.
     */
    @NonNull
    Map<String, Object> toMap();
}
