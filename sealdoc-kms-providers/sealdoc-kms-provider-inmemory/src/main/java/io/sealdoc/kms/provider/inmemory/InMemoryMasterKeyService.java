/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.inmemory;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.Plugin;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A backend whose key encryption keys live in the memory of this service instance.
 * Wrapped data keys can only be unwrapped by the same instance, so documents encrypted with it
 * do not survive a restart. It exists for development and for testing the machinery around
 * the real backends.</p>
 *
 * <p>Keys can be {@linkplain #generateKey(String) created} and {@linkplain #deleteKey(String) deleted}
 * at will; deleting a key makes every data key it wrapped unrecoverable, which is how tests
 * simulate an unreachable backend.</p>
 */
@ThreadSafe
@Plugin(configType = Void.class)
public class InMemoryMasterKeyService implements MasterKeyService<Void> {

    public static final String TYPE = "inmemory";
    static final String KEY_ID = "key_id";
    private static final int KEK_SIZE_BYTES = 32;

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMasterKeyService.class);

    private final SecureRandom random = new SecureRandom();
    private final Map<String, DestroyableRawSecretKey> keks = new ConcurrentHashMap<>();

    @Override
    public void initialize(@Nullable Void config) {
        // nothing to configure
    }

    @Override
    public @NonNull String typeIdentifier() {
        return TYPE;
    }

    /**
     * Creates a key encryption key with a random id.
     * @return the id of the new key
     */
    public @NonNull String generateKey() {
        return generateKey(UUID.randomUUID().toString());
    }

    /**
     * Creates a key encryption key with the given id.
     * @param keyId key id
     * @return the key id
     * @throws IllegalArgumentException if a key with that id already exists
     */
    public @NonNull String generateKey(@NonNull String keyId) {
        Objects.requireNonNull(keyId);
        var kek = DestroyableRawSecretKey.generate(random, KEK_SIZE_BYTES, "AES");
        if (keks.putIfAbsent(keyId, kek) != null) {
            kek.destroy();
            throw new IllegalArgumentException("key '" + keyId + "' already exists");
        }
        LOGGER.debug("Generated in-memory key encryption key {}", keyId);
        return keyId;
    }

    /**
     * Removes the key encryption key with the given id, destroying its material.
     * @param keyId key id
     * @return true if a key was removed
     */
    public boolean deleteKey(@NonNull String keyId) {
        var removed = keks.remove(keyId);
        if (removed != null) {
            removed.destroy();
            LOGGER.debug("Deleted in-memory key encryption key {}", keyId);
            return true;
        }
        return false;
    }

    public int numKeys() {
        return keks.size();
    }

    Optional<SecretKey> lookup(String keyId) {
        return Optional.ofNullable(keks.get(keyId));
    }

    SecureRandom random() {
        return random;
    }

    @Override
    public @NonNull MasterKey fromMap(@NonNull Map<String, ?> entry) {
        return new InMemoryMasterKey(this,
                KeyEntries.requireString(entry, KEY_ID),
                KeyEntries.encryptedDataKey(entry),
                KeyEntries.creationDate(entry));
    }

    @Override
    public @NonNull MasterKey newKey(@NonNull String reference) {
        return new InMemoryMasterKey(this, reference.strip(), null, Instant.now());
    }

    @Override
    public void close() {
        keks.values().forEach(DestroyableRawSecretKey::destroy);
        keks.clear();
    }
}
