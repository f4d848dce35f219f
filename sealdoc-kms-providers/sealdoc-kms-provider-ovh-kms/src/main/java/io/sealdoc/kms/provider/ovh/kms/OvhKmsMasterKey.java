/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.ovh.kms;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
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
 * A data key wrapped by an OKMS service key.
 */
final class OvhKmsMasterKey extends AbstractMasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(OvhKmsMasterKey.class);

    private final OkmsClient client;
    private final String endpoint;
    private final String keyId;

    OvhKmsMasterKey(@NonNull OkmsClient client, @NonNull String endpoint, @NonNull String keyId, @Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        super(encryptedDataKey, creationDate);
        this.client = Objects.requireNonNull(client);
        this.endpoint = Objects.requireNonNull(endpoint);
        this.keyId = Objects.requireNonNull(keyId);
    }

    String endpoint() {
        return endpoint;
    }

    /**
     * @return the service key id, which must be a UUID.
     * @throws KmsException if the recorded id is not a UUID.
     */
    UUID serviceKeyId() {
        try {
            return UUID.fromString(keyId);
        }
        catch (IllegalArgumentException e) {
            throw new KmsException("failed to parse UUID '" + keyId + "'", e);
        }
    }

    @Override
    public @NonNull String typeIdentifier() {
        return OvhKmsMasterKeyService.TYPE;
    }

    @Override
    public @NonNull String keyId() {
        return endpoint + "/" + keyId;
    }

    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        return new OvhKmsMasterKey(client, endpoint, keyId, encryptedDataKey, creationDate);
    }

    @Override
    protected void writeIdentity(Map<String, Object> entry) {
        entry.put(OvhKmsMasterKeyService.ENDPOINT, endpoint);
        entry.put(OvhKmsMasterKeyService.KEY_ID, keyId);
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        CompletionStage<String> stage;
        try {
            stage = client.encrypt(this, dataKey);
        }
        catch (KmsException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage.whenComplete((enc, t) -> {
            if (t == null) {
                LOGGER.info("Encryption successful with OVH KMS key {}", keyId());
            }
            else {
                LOGGER.info("Encryption failed with OVH KMS key {}: {}", keyId(), t.getMessage());
            }
        });
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        CompletionStage<SecretKey> stage;
        try {
            stage = client.decrypt(this, requireEncryptedDataKey());
        }
        catch (KmsException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage.whenComplete((key, t) -> {
            if (t == null) {
                LOGGER.info("Decryption successful with OVH KMS key {}", keyId());
            }
            else {
                LOGGER.info("Decryption failed with OVH KMS key {}: {}", keyId(), t.getMessage());
            }
        });
    }
}
