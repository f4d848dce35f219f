/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.hashicorp.vault;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The envelope Vault wraps around every API response.
 *
 * @param data response payload
 * @param <D> payload type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record VaultResponse<D>(@JsonProperty("data") D data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EncryptData(@JsonProperty("ciphertext") String ciphertext) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DecryptData(@JsonProperty("plaintext") String plaintext) {}
}
