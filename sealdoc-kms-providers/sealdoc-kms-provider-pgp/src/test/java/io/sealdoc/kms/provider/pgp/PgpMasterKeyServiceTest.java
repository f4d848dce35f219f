/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.pgp;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.sealdoc.config.secret.InlinePassword;
import io.sealdoc.kms.provider.pgp.config.Config;
import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.UnknownKeyException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PgpMasterKeyServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String PASSPHRASE = "correct horse";

    @TempDir
    static Path keyDir;
    private static PgpTestKeys.Generated alice;
    private static PgpTestKeys.Generated bob;

    private PgpMasterKeyService service;
    private DestroyableRawSecretKey dataKey;

    @BeforeAll
    static void generateKeys() throws Exception {
        alice = PgpTestKeys.generate(keyDir, "alice", PASSPHRASE.toCharArray());
        bob = PgpTestKeys.generate(keyDir, "bob", PASSPHRASE.toCharArray());
    }

    @BeforeEach
    void beforeEach() {
        service = new PgpMasterKeyService();
        service.initialize(new Config(alice.publicRing().toString(), alice.secretRing().toString(), new InlinePassword(PASSPHRASE)));
        dataKey = DestroyableRawSecretKey.generate(new SecureRandom(), 32, "AES");
    }

    @AfterEach
    void afterEach() {
        service.close();
    }

    @Test
    void wrapThenUnwrapByPrimaryFingerprint() {
        MasterKey wrapped = service.newKey(alice.primaryFingerprint()).wrap(dataKey).toCompletableFuture().join();

        assertThat(wrapped.encryptedDataKey()).startsWith("-----BEGIN PGP MESSAGE-----");
        assertThat(wrapped.decrypt())
                .succeedsWithin(TIMEOUT)
                .isInstanceOfSatisfying(DestroyableRawSecretKey.class, k -> assertThat(k.hasSameKeyMaterialAs(dataKey)).isTrue());
    }

    @Test
    void subkeyFingerprintAndShortKeyIdAccepted() {
        String keyId = alice.primaryFingerprint().substring(alice.primaryFingerprint().length() - 16);
        for (String reference : new String[]{ alice.subkeyFingerprint(), keyId.toLowerCase() }) {
            MasterKey wrapped = service.newKey(reference).wrap(dataKey).toCompletableFuture().join();
            assertThat(wrapped.decrypt()).succeedsWithin(TIMEOUT);
        }
    }

    @Test
    void fingerprintNormalised() {
        String spaced = alice.primaryFingerprint().toLowerCase().replaceAll("(.{4})", "$1 ");
        assertThat(service.newKey(spaced).keyId()).isEqualTo(alice.primaryFingerprint());
    }

    @Test
    void rejectsNonHexReference() {
        assertThatThrownBy(() -> service.newKey("not-a-fingerprint"))
                .isInstanceOf(InvalidKeyEntryException.class);
    }

    @Test
    void unknownRecipient() {
        assertThat(service.newKey(bob.primaryFingerprint()).encrypt(dataKey))
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(UnknownKeyException.class);
    }

    @Test
    void messageForSomeoneElseCannotBeDecrypted() {
        try (var encryptOnly = new PgpMasterKeyService()) {
            encryptOnly.initialize(new Config(bob.publicRing().toString(), null, null));
            MasterKey forBob = encryptOnly.newKey(bob.primaryFingerprint()).wrap(dataKey).toCompletableFuture().join();

            MasterKey asSeenByAlice = service.fromMap(forBob.toMap());
            assertThat(asSeenByAlice.decrypt())
                    .failsWithin(TIMEOUT)
                    .withThrowableThat()
                    .withCauseInstanceOf(KmsException.class)
                    .withMessageContaining("no PGP secret key available");
        }
    }

    @Test
    void wrongPassphrase() {
        MasterKey wrapped = service.newKey(alice.primaryFingerprint()).wrap(dataKey).toCompletableFuture().join();
        try (var wrong = new PgpMasterKeyService()) {
            wrong.initialize(new Config(null, alice.secretRing().toString(), new InlinePassword("wrong")));
            assertThat(wrong.fromMap(wrapped.toMap()).decrypt())
                    .failsWithin(TIMEOUT)
                    .withThrowableThat()
                    .withCauseInstanceOf(KmsException.class);
        }
    }

    @Test
    void secretRingAloneCanEncrypt() {
        try (var secretOnly = new PgpMasterKeyService()) {
            secretOnly.initialize(new Config(null, alice.secretRing().toString(), new InlinePassword(PASSPHRASE)));
            MasterKey wrapped = secretOnly.newKey(alice.primaryFingerprint()).wrap(dataKey).toCompletableFuture().join();
            assertThat(wrapped.decrypt()).succeedsWithin(TIMEOUT);
        }
    }

    @Test
    void toMapAndFromMap() {
        MasterKey wrapped = service.newKey(alice.primaryFingerprint()).wrap(dataKey).toCompletableFuture().join();
        Map<String, Object> entry = wrapped.toMap();
        assertThat(entry.keySet()).containsExactly("fp", "created_at", "enc");
        assertThat(entry).containsEntry("fp", alice.primaryFingerprint());

        MasterKey restored = service.fromMap(entry);
        assertThat(restored.decrypt()).succeedsWithin(TIMEOUT);
    }

    @Test
    void configRequiresAKeyRing() {
        assertThatThrownBy(() -> new Config(null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
