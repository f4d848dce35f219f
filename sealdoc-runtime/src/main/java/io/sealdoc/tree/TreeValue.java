/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

/**
 * A value in a document tree. Consumers dispatch on the kind of value with a {@link TreeValueVisitor},
 * so adding a kind of value breaks every consumer at compile time rather than at run time.
 */
public sealed interface TreeValue permits Scalar, TreeBranch, TreeList, Comment {

    <R> R accept(TreeValueVisitor<R> visitor);
}
