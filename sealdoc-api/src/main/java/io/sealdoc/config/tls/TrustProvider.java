/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config.tls;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A TrustProvider is a source of trust anchors used to validate that a backend server's certificate is trusted.
 * If the trust provider is omitted platform trust is used instead.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({ @JsonSubTypes.Type(TrustStore.class), @JsonSubTypes.Type(InsecureTls.class) })
public interface TrustProvider {

    /**
     * Visits the trust provider {@link TrustProviderVisitor}. Implementor should call one {@code visit} method on visitor.
     * @param visitor visitor.
     */
    <T> T accept(TrustProviderVisitor<T> visitor);

}
