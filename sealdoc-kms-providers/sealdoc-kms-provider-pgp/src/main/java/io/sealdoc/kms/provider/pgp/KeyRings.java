/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.pgp;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPPublicKeyRingCollection;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPSecretKeyRingCollection;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.operator.jcajce.JcaKeyFingerprintCalculator;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The public and secret key rings available to the backend.
 */
final class KeyRings {

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final List<PGPPublicKeyRing> publicRings;
    @Nullable
    private final PGPSecretKeyRingCollection secretRings;

    KeyRings(@NonNull List<PGPPublicKeyRing> publicRings, @Nullable PGPSecretKeyRingCollection secretRings) {
        this.publicRings = List.copyOf(publicRings);
        this.secretRings = secretRings;
    }

    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "The paths provide the location for key material which may exist anywhere on the file-system.")
    static KeyRings load(@Nullable String publicKeyRing, @Nullable String secretKeyRing) throws IOException, PGPException {
        var calculator = new JcaKeyFingerprintCalculator();
        var publicRings = new ArrayList<PGPPublicKeyRing>();
        if (publicKeyRing != null) {
            try (InputStream raw = Files.newInputStream(Path.of(publicKeyRing)); InputStream in = PGPUtil.getDecoderStream(raw)) {
                new PGPPublicKeyRingCollection(in, calculator).forEach(publicRings::add);
            }
        }
        PGPSecretKeyRingCollection secretRings = null;
        if (secretKeyRing != null) {
            try (InputStream raw = Files.newInputStream(Path.of(secretKeyRing)); InputStream in = PGPUtil.getDecoderStream(raw)) {
                secretRings = new PGPSecretKeyRingCollection(in, calculator);
            }
            for (PGPSecretKeyRing ring : secretRings) {
                var keys = new ArrayList<PGPPublicKey>();
                ring.getPublicKeys().forEachRemaining(keys::add);
                publicRings.add(new PGPPublicKeyRing(keys));
            }
        }
        return new KeyRings(publicRings, secretRings);
    }

    static String fingerprint(PGPPublicKey key) {
        return HEX.formatHex(key.getFingerprint());
    }

    /**
     * Normalises a fingerprint or key id reference: spaces removed, upper case.
     */
    static String normalise(String fingerprint) {
        return fingerprint.replace(" ", "").toUpperCase(Locale.ROOT);
    }

    /**
     * Finds the key that data keys for the given fingerprint should be encrypted to. The fingerprint
     * may name the primary key or a subkey, and may be abbreviated to a trailing key id. When it names a
     * key that cannot encrypt, the first encryption capable key of the same ring is used.
     */
    Optional<PGPPublicKey> encryptionKeyFor(String fingerprint) {
        for (PGPPublicKeyRing ring : publicRings) {
            PGPPublicKey matched = null;
            PGPPublicKey firstEncryptionKey = null;
            for (Iterator<PGPPublicKey> it = ring.getPublicKeys(); it.hasNext();) {
                PGPPublicKey key = it.next();
                if (matched == null && fingerprint(key).endsWith(fingerprint)) {
                    matched = key;
                }
                if (firstEncryptionKey == null && key.isEncryptionKey() && !key.hasRevocation()) {
                    firstEncryptionKey = key;
                }
            }
            if (matched != null) {
                return Optional.ofNullable(matched.isEncryptionKey() ? matched : firstEncryptionKey);
            }
        }
        return Optional.empty();
    }

    Optional<PGPSecretKey> secretKey(long keyId) throws PGPException {
        return secretRings == null ? Optional.empty() : Optional.ofNullable(secretRings.getSecretKey(keyId));
    }
}
