/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.ovh.kms.config;

import java.net.URI;
import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.config.tls.Tls;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the OVHcloud KMS backend. OKMS authenticates callers by client certificate,
 * so in practice {@code tls.key} names the key store holding the access certificate.
 *
 * @param tls tls configuration, including the client key store.
 * @param endpointOverride if set, requests are sent here rather than to the endpoint recorded in each key.
 * @param connectTimeout connection timeout, defaults to ten seconds.
 */
public record Config(@JsonProperty(value = "tls") @Nullable Tls tls,
                     @JsonProperty(value = "endpointOverride") @Nullable URI endpointOverride,
                     @JsonProperty(value = "connectTimeout") @Nullable Duration connectTimeout) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public @NonNull Duration connectTimeoutOrDefault() {
        return connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    }
}
