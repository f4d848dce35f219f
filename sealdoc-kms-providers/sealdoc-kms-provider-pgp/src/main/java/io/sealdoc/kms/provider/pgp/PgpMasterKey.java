/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.pgp;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.AbstractMasterKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A data key encrypted to an OpenPGP key, identified by its fingerprint.
 */
final class PgpMasterKey extends AbstractMasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgpMasterKey.class);

    private final PgpCipher cipher;
    private final String fingerprint;

    PgpMasterKey(@NonNull PgpCipher cipher, @NonNull String fingerprint, @Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        super(encryptedDataKey, creationDate);
        this.cipher = Objects.requireNonNull(cipher);
        this.fingerprint = Objects.requireNonNull(fingerprint);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return PgpMasterKeyService.TYPE;
    }

    @Override
    public @NonNull String keyId() {
        return fingerprint;
    }

    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        return new PgpMasterKey(cipher, fingerprint, encryptedDataKey, creationDate);
    }

    @Override
    protected void writeIdentity(Map<String, Object> entry) {
        entry.put(PgpMasterKeyService.FP, fingerprint);
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        try {
            String armored = cipher.encrypt(fingerprint, dataKey);
            LOGGER.info("Encryption successful with PGP key {}", fingerprint);
            return CompletableFuture.completedFuture(armored);
        }
        catch (KmsException e) {
            LOGGER.info("Encryption failed with PGP key {}: {}", fingerprint, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        try {
            SecretKey dataKey = cipher.decrypt(fingerprint, requireEncryptedDataKey());
            LOGGER.info("Decryption successful with PGP key {}", fingerprint);
            return CompletableFuture.completedFuture(dataKey);
        }
        catch (KmsException e) {
            LOGGER.info("Decryption failed with PGP key {}: {}", fingerprint, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }
}
