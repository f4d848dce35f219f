/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

import java.util.Objects;

import io.sealdoc.metadata.Metadata;
import io.sealdoc.store.Store;
import io.sealdoc.tree.TreeBranch;

/**
 * @param tree the encrypted values
 * @param metadata the metadata to store with them
 */
public record EncryptedDocument(TreeBranch tree, Metadata metadata) {

    public EncryptedDocument {
        Objects.requireNonNull(tree);
        Objects.requireNonNull(metadata);
    }

    public byte[] marshal(Store store) {
        return store.marshalWithMetadata(tree, metadata);
    }
}
