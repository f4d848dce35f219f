/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.hashicorp.vault;

import java.net.URI;
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
 * A data key wrapped by a named key of a Vault transit engine.
 */
final class VaultMasterKey extends AbstractMasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(VaultMasterKey.class);

    private final VaultTransitClient client;
    private final String vaultAddress;
    private final String enginePath;
    private final String keyName;

    VaultMasterKey(@NonNull VaultTransitClient client,
                   @NonNull String vaultAddress,
                   @NonNull String enginePath,
                   @NonNull String keyName,
                   @Nullable String encryptedDataKey,
                   @NonNull Instant creationDate) {
        super(encryptedDataKey, creationDate);
        this.client = Objects.requireNonNull(client);
        this.vaultAddress = Objects.requireNonNull(vaultAddress);
        this.enginePath = Objects.requireNonNull(enginePath);
        this.keyName = Objects.requireNonNull(keyName);
    }

    String vaultAddress() {
        return vaultAddress;
    }

    String enginePath() {
        return enginePath;
    }

    String keyName() {
        return keyName;
    }

    URI encryptUri() {
        return URI.create(vaultAddress + "/v1/" + enginePath + "/encrypt/" + keyName);
    }

    URI decryptUri() {
        return URI.create(vaultAddress + "/v1/" + enginePath + "/decrypt/" + keyName);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return VaultMasterKeyService.TYPE;
    }

    @Override
    public @NonNull String keyId() {
        return vaultAddress + "/v1/" + enginePath + "/keys/" + keyName;
    }

    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        return new VaultMasterKey(client, vaultAddress, enginePath, keyName, encryptedDataKey, creationDate);
    }

    @Override
    protected void writeIdentity(Map<String, Object> entry) {
        entry.put(VaultMasterKeyService.VAULT_ADDRESS, vaultAddress);
        entry.put(VaultMasterKeyService.ENGINE_PATH, enginePath);
        entry.put(VaultMasterKeyService.KEY_NAME, keyName);
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        return client.encrypt(this, dataKey)
                .whenComplete((enc, t) -> {
                    if (t == null) {
                        LOGGER.info("Encryption successful with Vault key {}", keyId());
                    }
                    else {
                        LOGGER.info("Encryption failed with Vault key {}: {}", keyId(), t.getMessage());
                    }
                });
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        String enc;
        try {
            enc = requireEncryptedDataKey();
        }
        catch (KmsException e) {
            return CompletableFuture.failedFuture(e);
        }
        return client.decrypt(this, enc)
                .whenComplete((key, t) -> {
                    if (t == null) {
                        LOGGER.info("Decryption successful with Vault key {}", keyId());
                    }
                    else {
                        LOGGER.info("Decryption failed with Vault key {}: {}", keyId(), t.getMessage());
                    }
                });
    }
}
