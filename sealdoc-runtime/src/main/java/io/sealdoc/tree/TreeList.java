/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.List;

/**
 * An ordered list of values, which may include comments.
 * @param values the values
 */
public record TreeList(List<TreeValue> values) implements TreeValue {

    public TreeList {
        values = List.copyOf(values);
    }

    public static TreeList of(TreeValue... values) {
        return new TreeList(List.of(values));
    }

    @Override
    public <R> R accept(TreeValueVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
