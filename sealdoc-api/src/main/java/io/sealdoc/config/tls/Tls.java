/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config.tls;

import java.security.KeyStore;
import java.util.Locale;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Provides TLS configuration for the client side of a backend connection.
 *
 * @param key specifies a key provider that provides the certificate/key used to identify this client (mutual TLS).
 * @param trust specifies a trust provider used to determine whether to trust the server. If omitted platform trust is used instead.
 * @param cipherSuites specifies a custom object which contains details of allowed and denied cipher suites
 * @param protocols specifies a custom object which contains details of allowed and denied tls protocols
 */
public record Tls(@Nullable KeyProvider key,
                  @Nullable TrustProvider trust,
                  @Nullable AllowDeny<String> cipherSuites,
                  @Nullable AllowDeny<String> protocols) {

    public static String getStoreTypeOrPlatformDefault(@Nullable String storeType) {
        return storeType == null ? KeyStore.getDefaultType().toUpperCase(Locale.ROOT) : storeType.toUpperCase(Locale.ROOT);
    }

}
