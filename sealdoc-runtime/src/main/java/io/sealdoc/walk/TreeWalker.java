/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.walk;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import javax.crypto.SecretKey;

import io.sealdoc.cipher.AesGcmValueCipher;
import io.sealdoc.cipher.EncryptedValue;
import io.sealdoc.mac.MacAccumulator;
import io.sealdoc.tree.Comment;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.TreeBranch;
import io.sealdoc.tree.TreeItem;
import io.sealdoc.tree.TreeList;
import io.sealdoc.tree.TreeValue;
import io.sealdoc.tree.TreeValueVisitor;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * <p>Walks a document depth first, in key and index order, encrypting or decrypting the values the
 * {@link CryptRule} selects. Each value is bound to the keys on its path: list elements share the
 * path of their list. Every value visited, whether or not it is encrypted, is fed to the MAC as
 * plaintext, in traversal order.</p>
 *
 * <p>The walk returns a new tree; the input tree is not changed.</p>
 */
public class TreeWalker {

    private final AesGcmValueCipher cipher;

    public TreeWalker(@NonNull AesGcmValueCipher cipher) {
        this.cipher = Objects.requireNonNull(cipher);
    }

    /**
     * @param tree plaintext document
     * @param dataKey data key
     * @param rule crypt rule
     * @param mac accumulator receiving the plaintext of every value
     * @return the encrypted document
     */
    public TreeBranch encrypt(@NonNull TreeBranch tree, @NonNull SecretKey dataKey, @NonNull CryptRule rule, @NonNull MacAccumulator mac) {
        return (TreeBranch) tree.accept(new Walk(rule, mac) {
            @Override
            Scalar selected(Scalar plaintext, String additionalData) {
                mac.update(plaintext);
                if (plaintext instanceof Scalar.NullValue) {
                    return plaintext;
                }
                return Scalar.of(cipher.encrypt(plaintext, dataKey, additionalData));
            }
        });
    }

    /**
     * Decrypts a document. Selected string values that are not encrypted values are tolerated
     * and left as they are.
     * @param tree encrypted document
     * @param dataKey data key
     * @param rule crypt rule
     * @param mac accumulator receiving the plaintext of every value
     * @return the plaintext document
     */
    public TreeBranch decrypt(@NonNull TreeBranch tree, @NonNull SecretKey dataKey, @NonNull CryptRule rule, @NonNull MacAccumulator mac) {
        return (TreeBranch) tree.accept(new Walk(rule, mac) {
            @Override
            Scalar selected(Scalar value, String additionalData) {
                Scalar plaintext = value;
                if (value instanceof Scalar.StringValue s && EncryptedValue.isEncrypted(s.value())) {
                    plaintext = cipher.decrypt(s.value(), dataKey, additionalData);
                }
                mac.update(plaintext);
                return plaintext;
            }
        });
    }

    /**
     * Additional authenticated data for a value: its path keys joined and terminated by {@code :}.
     * @param path keys on the path
     * @return the additional data
     */
    public static String additionalData(List<String> path) {
        var sb = new StringBuilder();
        for (String key : path) {
            sb.append(key).append(':');
        }
        return sb.toString();
    }

    private abstract static class Walk implements TreeValueVisitor<TreeValue> {
        private final CryptRule rule;
        private final MacAccumulator mac;
        private final List<String> path = new ArrayList<>();

        Walk(CryptRule rule, MacAccumulator mac) {
            this.rule = rule;
            this.mac = mac;
        }

        abstract Scalar selected(Scalar value, String additionalData);

        @Override
        public TreeValue visitScalar(Scalar scalar) {
            if (rule.shouldEncrypt(path)) {
                return selected(scalar, additionalData(path));
            }
            mac.update(scalar);
            return scalar;
        }

        @Override
        public TreeValue visitBranch(TreeBranch branch) {
            var items = new ArrayList<TreeItem>(branch.size());
            for (TreeItem item : branch.items()) {
                var name = item.name();
                if (name.isEmpty()) {
                    items.add(item);
                    continue;
                }
                path.add(name.get());
                items.add(item.withValue(item.value().accept(this)));
                path.remove(path.size() - 1);
            }
            return TreeBranch.of(items);
        }

        @Override
        public TreeValue visitList(TreeList list) {
            var values = new ArrayList<TreeValue>(list.values().size());
            for (TreeValue value : list.values()) {
                values.add(value.accept(this));
            }
            return new TreeList(values);
        }

        @Override
        public TreeValue visitComment(Comment comment) {
            return comment;
        }
    }
}
