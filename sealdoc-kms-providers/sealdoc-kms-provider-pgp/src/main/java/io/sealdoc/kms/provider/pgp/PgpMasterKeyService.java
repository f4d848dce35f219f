/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.pgp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import org.bouncycastle.openpgp.PGPException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.provider.pgp.config.Config;
import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.Plugin;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Encrypts data keys to OpenPGP keys referenced by fingerprint. Key rings are read once, on initialisation.
 */
@Plugin(configType = Config.class)
public class PgpMasterKeyService implements MasterKeyService<Config> {

    public static final String TYPE = "pgp";
    static final String FP = "fp";

    private static final Logger LOGGER = LoggerFactory.getLogger(PgpMasterKeyService.class);

    @Nullable
    private PgpCipher cipher;

    @Override
    public void initialize(@Nullable Config config) {
        if (cipher != null) {
            throw new IllegalStateException("PGP service is already initialized");
        }
        Objects.requireNonNull(config, "PGP service requires configuration");
        try {
            var keyRings = KeyRings.load(config.publicKeyRing(), config.secretKeyRing());
            char[] passphrase = config.passphrase() == null ? null : config.passphrase().getProvidedPassword().toCharArray();
            cipher = new PgpCipher(keyRings, passphrase);
            LOGGER.debug("Loaded PGP key rings public: {} secret: {}", config.publicKeyRing(), config.secretKeyRing());
        }
        catch (IOException e) {
            throw new UncheckedIOException("Exception reading PGP key rings", e);
        }
        catch (PGPException e) {
            throw new IllegalArgumentException("Invalid PGP key ring: " + e.getMessage(), e);
        }
    }

    @Override
    public @NonNull String typeIdentifier() {
        return TYPE;
    }

    private PgpCipher cipher() {
        if (cipher == null) {
            throw new IllegalStateException("PGP service has not been initialized");
        }
        return cipher;
    }

    @Override
    public @NonNull MasterKey fromMap(@NonNull Map<String, ?> entry) {
        return new PgpMasterKey(cipher(),
                KeyRings.normalise(KeyEntries.requireString(entry, FP)),
                KeyEntries.encryptedDataKey(entry),
                KeyEntries.creationDate(entry));
    }

    @Override
    public @NonNull MasterKey newKey(@NonNull String reference) {
        String fingerprint = KeyRings.normalise(reference);
        if (fingerprint.isEmpty() || !fingerprint.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new InvalidKeyEntryException("'" + reference + "' is not a hexadecimal PGP fingerprint");
        }
        return new PgpMasterKey(cipher(), fingerprint, null, Instant.now());
    }

    @Override
    public void close() {
        cipher = null;
    }
}
