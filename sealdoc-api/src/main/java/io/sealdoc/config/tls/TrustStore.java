/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config.tls;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.config.secret.PasswordProvider;

import edu.umd.cs.findbugs.annotations.Nullable;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A {@link TrustProvider} backed by a Java trust store.
 *
 * @param storeFile location of a trust store.
 * @param storePasswordProvider provider for the store password or null if store does not require a password.
 * @param storeType specifies the store type. Legal values are those types supported by the platform {@link java.security.KeyStore}.
 */
@SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "The paths provide the location for key material which may exist anywhere on the file-system.")
public record TrustStore(@JsonProperty(required = true) String storeFile,
                         @JsonProperty(value = "storePassword") @Nullable PasswordProvider storePasswordProvider,
                         @Nullable String storeType)
        implements TrustProvider {

    public TrustStore {
        Objects.requireNonNull(storeFile);
    }

    public String getType() {
        return Tls.getStoreTypeOrPlatformDefault(storeType);
    }

    @Override
    public <T> T accept(TrustProviderVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
