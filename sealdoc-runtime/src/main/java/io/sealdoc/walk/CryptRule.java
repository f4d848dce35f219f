/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.walk;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>Decides which values of a document are encrypted, based on the keys on the path to the value.
 * A document has exactly one rule, recorded in its metadata under the key of the rule's {@link Kind}.</p>
 */
public final class CryptRule {

    public static final String DEFAULT_UNENCRYPTED_SUFFIX = "unencrypted_";

    public static final CryptRule DEFAULT = unencryptedSuffix(DEFAULT_UNENCRYPTED_SUFFIX);

    public enum Kind {
        /** Values are encrypted unless a key on their path ends with the suffix. */
        UNENCRYPTED_SUFFIX("unencrypted_suffix"),
        /** Values are encrypted only if a key on their path ends with the suffix. */
        ENCRYPTED_SUFFIX("encrypted_suffix"),
        /** Values are encrypted unless a key on their path contains a match for the regex. */
        UNENCRYPTED_REGEX("unencrypted_regex"),
        /** Values are encrypted only if a key on their path contains a match for the regex. */
        ENCRYPTED_REGEX("encrypted_regex");

        private final String metadataKey;

        Kind(String metadataKey) {
            this.metadataKey = metadataKey;
        }

        public String metadataKey() {
            return metadataKey;
        }

        public static Optional<Kind> fromMetadataKey(String key) {
            return Arrays.stream(values()).filter(k -> k.metadataKey.equals(key)).findFirst();
        }
    }

    private final Kind kind;
    private final String value;
    @Nullable
    private final Pattern pattern;

    /**
     * @param kind kind
     * @param value suffix or regular expression
     * @throws java.util.regex.PatternSyntaxException if a regex rule has an invalid regex
     */
    public CryptRule(@NonNull Kind kind, @NonNull String value) {
        this.kind = Objects.requireNonNull(kind);
        this.value = Objects.requireNonNull(value);
        this.pattern = kind == Kind.UNENCRYPTED_REGEX || kind == Kind.ENCRYPTED_REGEX ? Pattern.compile(value) : null;
    }

    public static CryptRule unencryptedSuffix(String suffix) {
        return new CryptRule(Kind.UNENCRYPTED_SUFFIX, suffix);
    }

    public static CryptRule encryptedSuffix(String suffix) {
        return new CryptRule(Kind.ENCRYPTED_SUFFIX, suffix);
    }

    public static CryptRule unencryptedRegex(String regex) {
        return new CryptRule(Kind.UNENCRYPTED_REGEX, regex);
    }

    public static CryptRule encryptedRegex(String regex) {
        return new CryptRule(Kind.ENCRYPTED_REGEX, regex);
    }

    public Kind kind() {
        return kind;
    }

    public String value() {
        return value;
    }

    /**
     * @param path the keys leading to a value, outermost first
     * @return true if the value should be encrypted
     */
    public boolean shouldEncrypt(List<String> path) {
        switch (kind) {
            case UNENCRYPTED_SUFFIX:
                return path.stream().noneMatch(k -> k.endsWith(value));
            case ENCRYPTED_SUFFIX:
                return path.stream().anyMatch(k -> k.endsWith(value));
            case UNENCRYPTED_REGEX:
                return path.stream().noneMatch(k -> pattern.matcher(k).find());
            case ENCRYPTED_REGEX:
                return path.stream().anyMatch(k -> pattern.matcher(k).find());
            default:
                throw new IllegalStateException("unexpected rule " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CryptRule other && kind == other.kind && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind.metadataKey() + "=" + value;
    }
}
