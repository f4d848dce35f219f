/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

import java.util.List;
import java.util.Objects;

import io.sealdoc.metadata.Metadata;
import io.sealdoc.tree.TreeBranch;

/**
 * @param tree the plaintext values
 * @param metadata the metadata of the document
 * @param warnings integrity problems that were ignored as requested by {@link DecryptOptions#ignoreMac()}
 */
public record DecryptResult(TreeBranch tree, Metadata metadata, List<String> warnings) {

    public DecryptResult {
        Objects.requireNonNull(tree);
        Objects.requireNonNull(metadata);
        warnings = List.copyOf(warnings);
    }
}
