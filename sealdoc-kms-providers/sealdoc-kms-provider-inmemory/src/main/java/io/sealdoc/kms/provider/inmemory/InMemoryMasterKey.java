/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.inmemory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.AbstractMasterKey;
import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.UnknownKeyException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A data key wrapped with AES-256-GCM under an in-memory key encryption key.
 * The wrapped form is base64 of the 12 byte IV followed by the ciphertext and tag.
 * The key id is bound as additional authenticated data.
 */
final class InMemoryMasterKey extends AbstractMasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMasterKey.class);
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final InMemoryMasterKeyService service;
    private final String keyId;

    InMemoryMasterKey(@NonNull InMemoryMasterKeyService service, @NonNull String keyId, @Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        super(encryptedDataKey, creationDate);
        this.service = Objects.requireNonNull(service);
        this.keyId = Objects.requireNonNull(keyId);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return InMemoryMasterKeyService.TYPE;
    }

    @Override
    public @NonNull String keyId() {
        return keyId;
    }

    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        return new InMemoryMasterKey(service, keyId, encryptedDataKey, creationDate);
    }

    @Override
    protected void writeIdentity(Map<String, Object> entry) {
        entry.put(InMemoryMasterKeyService.KEY_ID, keyId);
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        try {
            SecretKey kek = kek();
            byte[] iv = new byte[IV_LENGTH];
            service.random().nextBytes(iv);
            Cipher cipher = cipher(Cipher.ENCRYPT_MODE, kek, iv);
            byte[] plaintext = dataKey.getEncoded();
            byte[] ciphertext;
            try {
                ciphertext = cipher.doFinal(plaintext);
            }
            finally {
                Arrays.fill(plaintext, (byte) 0);
            }
            byte[] wrapped = new byte[IV_LENGTH + ciphertext.length];
            System.arraycopy(iv, 0, wrapped, 0, IV_LENGTH);
            System.arraycopy(ciphertext, 0, wrapped, IV_LENGTH, ciphertext.length);
            LOGGER.debug("Wrapped data key with in-memory key {}", keyId);
            return CompletableFuture.completedFuture(Base64.getEncoder().encodeToString(wrapped));
        }
        catch (GeneralSecurityException e) {
            return CompletableFuture.failedFuture(new KmsException("failed to wrap data key with in-memory key " + keyId, e));
        }
        catch (KmsException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        try {
            byte[] wrapped = Base64.getDecoder().decode(requireEncryptedDataKey());
            if (wrapped.length <= IV_LENGTH) {
                throw new KmsException("wrapped data key for in-memory key " + keyId + " is truncated");
            }
            SecretKey kek = kek();
            Cipher cipher = cipher(Cipher.DECRYPT_MODE, kek, Arrays.copyOfRange(wrapped, 0, IV_LENGTH));
            byte[] plaintext = cipher.doFinal(wrapped, IV_LENGTH, wrapped.length - IV_LENGTH);
            LOGGER.debug("Unwrapped data key with in-memory key {}", keyId);
            return CompletableFuture.completedFuture(DestroyableRawSecretKey.takeOwnershipOf(plaintext, "AES"));
        }
        catch (AEADBadTagException e) {
            return CompletableFuture.failedFuture(new KmsException("wrapped data key was not produced by in-memory key " + keyId, e));
        }
        catch (GeneralSecurityException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new KmsException("failed to unwrap data key with in-memory key " + keyId, e));
        }
        catch (KmsException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private SecretKey kek() {
        return service.lookup(keyId).orElseThrow(() -> new UnknownKeyException("in-memory key '" + keyId + "' does not exist"));
    }

    private Cipher cipher(int mode, SecretKey kek, byte[] iv) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance(TRANSFORMATION);
        cipher.init(mode, kek, new GCMParameterSpec(TAG_BITS, iv));
        cipher.updateAAD(keyId.getBytes(StandardCharsets.UTF_8));
        return cipher;
    }
}
