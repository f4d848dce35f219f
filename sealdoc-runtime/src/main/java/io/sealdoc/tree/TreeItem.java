/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * An entry of a {@link TreeBranch}.
 * @param key the key
 * @param value the value. For comment items this is the comment itself.
 */
public record TreeItem(TreeKey key, TreeValue value) {

    public TreeItem {
        Objects.requireNonNull(key);
        Objects.requireNonNull(value);
    }

    public static TreeItem of(String name, TreeValue value) {
        return new TreeItem(TreeKey.name(name), value);
    }

    public static TreeItem comment(String text) {
        Comment comment = new Comment(text);
        return new TreeItem(comment, comment);
    }

    /**
     * @return the key name, or empty for comment items.
     */
    public Optional<String> name() {
        return key instanceof TreeKey.Name n ? Optional.of(n.value()) : Optional.empty();
    }

    public TreeItem withValue(TreeValue newValue) {
        return new TreeItem(key, newValue);
    }
}
