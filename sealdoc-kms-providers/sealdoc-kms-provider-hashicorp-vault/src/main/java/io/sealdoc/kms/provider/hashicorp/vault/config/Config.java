/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.hashicorp.vault.config;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.config.secret.PasswordProvider;
import io.sealdoc.config.tls.Tls;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the Vault transit backend.
 *
 * @param vaultToken the token used to authenticate to every Vault server. If absent, the token is taken
 * from the {@code VAULT_TOKEN} environment variable and then from {@code ~/.vault-token}.
 * @param connectTimeout connection timeout, defaults to ten seconds.
 * @param tls tls configuration for the connections to Vault.
 */
public record Config(@JsonProperty(value = "vaultToken") @Nullable PasswordProvider vaultToken,
                     @JsonProperty(value = "connectTimeout") @Nullable Duration connectTimeout,
                     @JsonProperty(value = "tls") @Nullable Tls tls) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    public Config(@Nullable PasswordProvider vaultToken, @Nullable Tls tls) {
        this(vaultToken, null, tls);
    }

    public @NonNull Duration connectTimeoutOrDefault() {
        return connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout;
    }
}
