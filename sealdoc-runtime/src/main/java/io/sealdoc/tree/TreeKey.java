/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.Objects;

/**
 * The key of an item in a {@link TreeBranch}: either a name or a comment standing in the branch.
 */
public sealed interface TreeKey permits TreeKey.Name, Comment {

    static Name name(String name) {
        return new Name(name);
    }

    record Name(String value) implements TreeKey {
        public Name {
            Objects.requireNonNull(value);
        }
    }
}
