/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered mapping from names to values, which may also hold comments.
 * Branches are immutable: every modification returns a new branch and leaves the receiver unchanged.
 * Item order is significant; it is the order values are authenticated in and the order they are written back in.
 */
public final class TreeBranch implements TreeValue {

    private static final TreeBranch EMPTY = new TreeBranch(List.of());

    private final List<TreeItem> items;

    private TreeBranch(List<TreeItem> items) {
        this.items = items;
    }

    public static TreeBranch empty() {
        return EMPTY;
    }

    public static TreeBranch of(List<TreeItem> items) {
        return new TreeBranch(List.copyOf(items));
    }

    public static TreeBranch of(TreeItem... items) {
        return of(List.of(items));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TreeItem> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<TreeValue> get(String name) {
        return items.stream()
                .filter(item -> item.name().filter(name::equals).isPresent())
                .map(TreeItem::value)
                .findFirst();
    }

    public boolean containsKey(String name) {
        return get(name).isPresent();
    }

    /**
     * Inserts or replaces the value under a name. A replaced value keeps the position of the old one;
     * a new name is appended.
     * @param name name
     * @param value value
     * @return the new branch
     */
    public TreeBranch with(String name, TreeValue value) {
        Objects.requireNonNull(value);
        var result = new ArrayList<TreeItem>(items.size() + 1);
        boolean replaced = false;
        for (TreeItem item : items) {
            if (!replaced && item.name().filter(name::equals).isPresent()) {
                result.add(item.withValue(value));
                replaced = true;
            }
            else {
                result.add(item);
            }
        }
        if (!replaced) {
            result.add(TreeItem.of(name, value));
        }
        return new TreeBranch(List.copyOf(result));
    }

    /**
     * @param name name
     * @return a branch without the items under the given name
     */
    public TreeBranch without(String name) {
        List<TreeItem> kept = items.stream()
                .filter(item -> item.name().filter(name::equals).isEmpty())
                .toList();
        return kept.size() == items.size() ? this : new TreeBranch(kept);
    }

    @Override
    public <R> R accept(TreeValueVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return items.equals(((TreeBranch) o).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }

    @Override
    public String toString() {
        return "TreeBranch" + items;
    }

    public static final class Builder {
        private final List<TreeItem> items = new ArrayList<>();

        private Builder() {
        }

        public Builder put(String name, TreeValue value) {
            items.add(TreeItem.of(name, value));
            return this;
        }

        public Builder put(String name, String value) {
            return put(name, Scalar.of(value));
        }

        public Builder comment(String text) {
            items.add(TreeItem.comment(text));
            return this;
        }

        public Builder add(TreeItem item) {
            items.add(Objects.requireNonNull(item));
            return this;
        }

        public TreeBranch build() {
            return new TreeBranch(List.copyOf(items));
        }
    }
}
