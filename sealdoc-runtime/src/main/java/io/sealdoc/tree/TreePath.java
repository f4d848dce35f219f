/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * <p>The location of a value within a document, written as a sequence of bracketed steps, for example
 * {@code ["spec"]["containers"][0]['image']}. Quoted steps name keys of a branch; bare digits index
 * a list.</p>
 */
public final class TreePath {

    /**
     * A step of a path.
     */
    public sealed interface Step permits KeyStep, IndexStep {}

    public record KeyStep(String key) implements Step {
        public KeyStep {
            Objects.requireNonNull(key);
        }

        @Override
        public String toString() {
            return "[\"" + key + "\"]";
        }
    }

    public record IndexStep(int index) implements Step {
        public IndexStep {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative");
            }
        }

        @Override
        public String toString() {
            return "[" + index + "]";
        }
    }

    private final List<Step> steps;

    private TreePath(List<Step> steps) {
        this.steps = List.copyOf(steps);
    }

    public static TreePath of(Step... steps) {
        if (steps.length == 0) {
            throw new IllegalArgumentException("a path needs at least one step");
        }
        return new TreePath(List.of(steps));
    }

    /**
     * @param text path text
     * @return the path
     * @throws IllegalArgumentException if the text is not a valid path
     */
    public static TreePath parse(String text) {
        var steps = new ArrayList<Step>();
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }
            if (c != '[') {
                throw new IllegalArgumentException("expected '[' at position " + pos + " of path " + text);
            }
            int close;
            char first = pos + 1 < text.length() ? text.charAt(pos + 1) : ']';
            if (first == '"' || first == '\'') {
                int endQuote = text.indexOf(first, pos + 2);
                if (endQuote < 0 || endQuote + 1 >= text.length() || text.charAt(endQuote + 1) != ']') {
                    throw new IllegalArgumentException("unterminated key at position " + pos + " of path " + text);
                }
                steps.add(new KeyStep(text.substring(pos + 2, endQuote)));
                close = endQuote + 1;
            }
            else {
                close = text.indexOf(']', pos);
                if (close < 0) {
                    throw new IllegalArgumentException("unterminated step at position " + pos + " of path " + text);
                }
                String digits = text.substring(pos + 1, close).strip();
                if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                    throw new IllegalArgumentException("'" + digits + "' is neither a quoted key nor a list index in path " + text);
                }
                try {
                    steps.add(new IndexStep(Integer.parseInt(digits)));
                }
                catch (NumberFormatException e) {
                    throw new IllegalArgumentException("list index '" + digits + "' is too large in path " + text, e);
                }
            }
            pos = close + 1;
        }
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("path '" + text + "' has no steps");
        }
        return new TreePath(steps);
    }

    public List<Step> steps() {
        return steps;
    }

    /**
     * @param root the document
     * @return the addressed value
     * @throws NoSuchElementException if a key is missing or an index is out of range
     * @throws IllegalArgumentException if a step does not fit the value it is applied to
     */
    public TreeValue extract(TreeBranch root) {
        TreeValue current = root;
        for (int i = 0; i < steps.size(); i++) {
            current = step(current, steps.get(i), i);
        }
        return current;
    }

    private TreeValue step(TreeValue current, Step step, int depth) {
        if (step instanceof KeyStep keyStep) {
            if (!(current instanceof TreeBranch branch)) {
                throw new IllegalArgumentException("cannot look up key '" + keyStep.key() + "' in a non-branch value at " + prefix(depth));
            }
            return branch.get(keyStep.key())
                    .orElseThrow(() -> new NoSuchElementException("key '" + keyStep.key() + "' not found at " + prefix(depth)));
        }
        IndexStep indexStep = (IndexStep) step;
        if (!(current instanceof TreeList list)) {
            throw new IllegalArgumentException("cannot index a non-list value at " + prefix(depth));
        }
        if (indexStep.index() >= list.values().size()) {
            throw new NoSuchElementException("index " + indexStep.index() + " out of range at " + prefix(depth));
        }
        return list.values().get(indexStep.index());
    }

    /**
     * Sets the addressed value. Missing branches on the way are created, and an index one past
     * the end of a list appends.
     * @param root the document
     * @param value new value
     * @return the new document
     */
    public TreeBranch set(TreeBranch root, TreeValue value) {
        return (TreeBranch) set(root, 0, value);
    }

    private TreeValue set(TreeValue current, int depth, TreeValue value) {
        if (depth == steps.size()) {
            return value;
        }
        Step step = steps.get(depth);
        if (step instanceof KeyStep keyStep) {
            if (!(current instanceof TreeBranch branch)) {
                throw new IllegalArgumentException("cannot set key '" + keyStep.key() + "' in a non-branch value at " + prefix(depth));
            }
            TreeValue child = branch.get(keyStep.key()).orElseGet(() -> emptyContainerFor(depth + 1));
            return branch.with(keyStep.key(), set(child, depth + 1, value));
        }
        int index = ((IndexStep) step).index();
        if (!(current instanceof TreeList list)) {
            throw new IllegalArgumentException("cannot index a non-list value at " + prefix(depth));
        }
        var values = new ArrayList<>(list.values());
        if (index < values.size()) {
            values.set(index, set(values.get(index), depth + 1, value));
        }
        else if (index == values.size()) {
            values.add(set(emptyContainerFor(depth + 1), depth + 1, value));
        }
        else {
            throw new IllegalArgumentException("index " + index + " is beyond the end of the list at " + prefix(depth));
        }
        return new TreeList(values);
    }

    private TreeValue emptyContainerFor(int depth) {
        if (depth == steps.size()) {
            return Scalar.nullValue();
        }
        return steps.get(depth) instanceof IndexStep ? new TreeList(List.of()) : TreeBranch.empty();
    }

    private String prefix(int depth) {
        return depth == 0 ? "the root" : steps.subList(0, depth).stream().map(Step::toString).collect(Collectors.joining());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TreePath other && steps.equals(other.steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return steps.stream().map(Step::toString).collect(Collectors.joining());
    }
}
