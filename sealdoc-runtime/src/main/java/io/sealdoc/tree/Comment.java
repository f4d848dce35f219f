/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.Objects;

/**
 * A comment carried by formats that have them. Comments are never encrypted and do not contribute to the MAC.
 * @param text comment text, without the comment marker.
 */
public record Comment(String text) implements TreeValue, TreeKey {

    public Comment {
        Objects.requireNonNull(text);
    }

    @Override
    public <R> R accept(TreeValueVisitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
