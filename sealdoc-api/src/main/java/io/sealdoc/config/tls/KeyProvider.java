/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config.tls;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A KeyProvider is a source of a TLS private-key/certificate pair used for TLS client authentication,
 * so that the client can identify itself to a backend that requires mutual TLS.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({ @JsonSubTypes.Type(KeyStore.class) })
public interface KeyProvider {

    /**
     * Visits the key provider {@link KeyProviderVisitor}. Implementor should call one {@code visit} method on visitor.
     * @param visitor visitor.
     */
    <T> T accept(KeyProviderVisitor<T> visitor);

}
