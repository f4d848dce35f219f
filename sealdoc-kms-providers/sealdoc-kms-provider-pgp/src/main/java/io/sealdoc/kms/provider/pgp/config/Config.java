/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.pgp.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.config.secret.PasswordProvider;

import edu.umd.cs.findbugs.annotations.Nullable;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Configuration for the OpenPGP backend. Key rings may be binary or ASCII armoured.
 *
 * @param publicKeyRing path to the public key ring collection used to wrap data keys.
 * @param secretKeyRing path to the secret key ring collection used to unwrap data keys.
 * @param passphrase passphrase protecting the secret keys, if they are protected.
 */
@SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "The paths provide the location for key material which may exist anywhere on the file-system.")
public record Config(@JsonProperty(value = "publicKeyRing") @Nullable String publicKeyRing,
                     @JsonProperty(value = "secretKeyRing") @Nullable String secretKeyRing,
                     @JsonProperty(value = "passphrase") @Nullable PasswordProvider passphrase) {

    public Config {
        if (publicKeyRing == null && secretKeyRing == null) {
            throw new IllegalArgumentException("at least one of publicKeyRing and secretKeyRing must be given");
        }
    }
}
