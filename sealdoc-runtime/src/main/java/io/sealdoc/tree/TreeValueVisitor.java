/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

/**
 * Visitor over the kinds of {@link TreeValue}.
 * @param <R> The result type
 */
public interface TreeValueVisitor<R> {

    R visitScalar(Scalar scalar);

    R visitBranch(TreeBranch branch);

    R visitList(TreeList list);

    R visitComment(Comment comment);
}
