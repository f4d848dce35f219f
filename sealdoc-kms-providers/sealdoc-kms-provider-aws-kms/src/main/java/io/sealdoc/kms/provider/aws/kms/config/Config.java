/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.aws.kms.config;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.config.secret.PasswordProvider;
import io.sealdoc.config.tls.Tls;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the AWS KMS backend.
 *
 * @param endpointUrl if set, requests for every region are sent here rather than to the regional AWS endpoint.
 * @param accessKeyId access key id. Without it the SDK's default credential chain is used.
 * @param secretAccessKey secret access key, required with {@code accessKeyId}.
 * @param sessionToken session token for temporary credentials.
 * @param encryptionContext encryption context given to keys created from an ARN.
 * @param connectTimeout connection timeout, defaults to ten seconds.
 * @param tls tls configuration. Only trust and key material apply.
 */
public record Config(@JsonProperty(value = "endpointUrl") @Nullable URI endpointUrl,
                     @JsonProperty(value = "accessKeyId") @Nullable PasswordProvider accessKeyId,
                     @JsonProperty(value = "secretAccessKey") @Nullable PasswordProvider secretAccessKey,
                     @JsonProperty(value = "sessionToken") @Nullable PasswordProvider sessionToken,
                     @JsonProperty(value = "encryptionContext") @Nullable Map<String, String> encryptionContext,
                     @JsonProperty(value = "connectTimeout") @Nullable Duration connectTimeout,
                     @JsonProperty(value = "tls") @Nullable Tls tls) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public Config(@Nullable URI endpointUrl, @Nullable PasswordProvider accessKeyId, @Nullable PasswordProvider secretAccessKey) {
        this(endpointUrl, accessKeyId, secretAccessKey, null, null, null, null);
    }

    public @NonNull Duration connectTimeoutOrDefault() {
        return connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    }
}
