/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.ThreadSafe;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Service interface for key management backends. Implementations are discovered with
 * {@link java.util.ServiceLoader} and annotated with {@link io.sealdoc.plugin.Plugin}
 * naming their configuration type.</p>
 *
 * <p>A service creates the {@link MasterKey}s of its backend, both from document metadata entries
 * and from textual references such as an ARN or a fingerprint. Keys it creates use the clients and
 * credentials established by {@link #initialize(Object)}.</p>
 *
 * @param <C> The config type
 */
@ThreadSafe
public interface MasterKeyService<C> extends AutoCloseable {

    /**
     * Initialises the service.  This method must be invoked exactly once
     * before any keys are created.
     *
     * @param config service configuration, may be null for services whose configuration is optional.
     */
    void initialize(@Nullable C config);

    /**
     * @return the identifier under which keys of this backend are stored in metadata, e.g. {@code hc_vault}.
     */
    @NonNull
    String typeIdentifier();

    /**
     * Builds a master key from its metadata entry.
     *
     * @param entry the entry, as produced by {@link MasterKey#toMap()}.
     * @return the master key.
     * @throws InvalidKeyEntryException if the entry is malformed.
     * @throws IllegalStateException if the service has not been initialised.
     */
    @NonNull
    MasterKey fromMap(@NonNull Map<String, ?> entry);

    /**
     * Builds a master key, holding no wrapped data key, from a textual reference.
     *
     * @param reference the reference, e.g. an ARN, a Vault key URI or a fingerprint.
     * @return the master key.
     * @throws InvalidKeyEntryException if the reference is malformed.
     * @throws IllegalStateException if the service has not been initialised.
     */
    @NonNull
    MasterKey newKey(@NonNull String reference);

    /**
     * Builds master keys from a comma separated list of references. Blank references are skipped.
     *
     * @param references comma separated references
     * @return the master keys, in order.
     */
    @NonNull
    default List<MasterKey> newKeys(@NonNull String references) {
        return Arrays.stream(references.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .map(this::newKey)
                .toList();
    }

    /**
     * Closes the service. Keys previously created by this service must not be used afterwards.
     * <br/>
     * Implementations of this method must be idempotent and must tolerate
     * the closing of a service that has not been initialized.
     */
    @Override
    default void close() {
    }
}
