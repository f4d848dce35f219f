/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.inmemory;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.ServiceLoader;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.kms.service.UnknownKeyException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMasterKeyServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryMasterKeyService service;
    private DestroyableRawSecretKey dataKey;

    @BeforeEach
    void beforeEach() {
        service = new InMemoryMasterKeyService();
        service.initialize(null);
        dataKey = DestroyableRawSecretKey.generate(new SecureRandom(), 32, "AES");
    }

    @AfterEach
    void afterEach() {
        service.close();
        dataKey.destroy();
    }

    @Test
    void discoverableByServiceLoader() {
        assertThat(ServiceLoader.load(MasterKeyService.class).stream().map(ServiceLoader.Provider::type))
                .contains(InMemoryMasterKeyService.class);
    }

    @Test
    void wrapThenUnwrapGivesBackDataKey() {
        String keyId = service.generateKey();
        MasterKey key = service.newKey(keyId);
        assertThat(key.hasEncryptedDataKey()).isFalse();

        MasterKey wrapped = key.wrap(dataKey).toCompletableFuture().join();
        assertThat(wrapped.hasEncryptedDataKey()).isTrue();
        assertThat(wrapped.keyId()).isEqualTo(keyId);

        assertThat(wrapped.decrypt())
                .succeedsWithin(TIMEOUT)
                .isInstanceOfSatisfying(DestroyableRawSecretKey.class, k -> assertThat(k.hasSameKeyMaterialAs(dataKey)).isTrue());
    }

    @Test
    void wrappingTwiceGivesDistinctCiphertexts() {
        MasterKey key = service.newKey(service.generateKey());
        String first = key.encrypt(dataKey).toCompletableFuture().join();
        String second = key.encrypt(dataKey).toCompletableFuture().join();
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void deletedKeyCannotUnwrap() {
        String keyId = service.generateKey("doomed");
        MasterKey wrapped = service.newKey(keyId).wrap(dataKey).toCompletableFuture().join();
        assertThat(service.deleteKey(keyId)).isTrue();

        assertThat(wrapped.decrypt())
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(UnknownKeyException.class)
                .withMessageContaining("doomed");
    }

    @Test
    void unknownKeyCannotWrap() {
        MasterKey key = service.newKey("nope");
        assertThat(key.encrypt(dataKey))
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(UnknownKeyException.class);
    }

    @Test
    void keyWithoutWrappedDataKeyCannotUnwrap() {
        MasterKey key = service.newKey(service.generateKey());
        assertThat(key.decrypt())
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(KmsException.class)
                .withMessageContaining("holds no encrypted data key");
    }

    @Test
    void dataKeyWrappedBySiblingKeyIsRejected() {
        MasterKey first = service.newKey(service.generateKey("a")).wrap(dataKey).toCompletableFuture().join();
        service.generateKey("b");
        MasterKey impostor = service.newKey("b").withEncryptedDataKey(first.encryptedDataKey(), first.creationDate());

        assertThat(impostor.decrypt())
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(KmsException.class)
                .withMessageContaining("not produced by in-memory key b");
    }

    @Test
    void duplicateKeyIdRejected() {
        service.generateKey("dup");
        assertThatThrownBy(() -> service.generateKey("dup"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.numKeys()).isEqualTo(1);
    }

    @Test
    void toMapAndFromMapPreserveKey() {
        MasterKey wrapped = service.newKey(service.generateKey("k1")).wrap(dataKey).toCompletableFuture().join();
        Map<String, Object> entry = wrapped.toMap();

        assertThat(entry).containsOnlyKeys("key_id", "created_at", "enc");
        assertThat(entry.keySet()).containsExactly("key_id", "created_at", "enc");

        MasterKey restored = service.fromMap(entry);
        assertThat(restored.keyId()).isEqualTo("k1");
        assertThat(restored.encryptedDataKey()).isEqualTo(wrapped.encryptedDataKey());
        assertThat(restored.creationDate()).isEqualTo(wrapped.creationDate());
        assertThat(restored.decrypt()).succeedsWithin(TIMEOUT)
                .satisfies(k -> assertThat(dataKey.hasSameKeyMaterialAs(k)).isTrue());
    }

    @Test
    void fromMapRequiresKeyId() {
        Map<String, Object> entry = new HashMap<>();
        entry.put("created_at", "2024-01-01T00:00:00Z");
        entry.put("enc", "");
        assertThatThrownBy(() -> service.fromMap(entry))
                .isInstanceOf(InvalidKeyEntryException.class)
                .hasMessageContaining("key_id");
    }

    @Test
    void newKeysSplitsReferences() {
        assertThat(service.newKeys("a, b,,c "))
                .extracting(MasterKey::keyId)
                .containsExactly("a", "b", "c");
    }

    @Test
    void oldKeyNeedsRotation() {
        MasterKey key = service.newKey("old").withEncryptedDataKey("x", Instant.now().minus(Duration.ofDays(181)));
        assertThat(key.needsRotation()).isTrue();
        assertThat(service.newKey("new").needsRotation()).isFalse();
    }

    @Test
    void closeDestroysKeys() {
        service.generateKey("a");
        service.close();
        assertThat(service.numKeys()).isZero();
    }
}
