/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.metadata.KeySource;
import io.sealdoc.walk.CryptRule;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Which keys and which crypt rule new documents get, chosen by the path of the document.
 *
 * @param pathRegex documents whose path contains a match are covered by this rule. If absent, every document is.
 * @param unencryptedSuffix crypt rule: keys with this suffix are left in plaintext
 * @param encryptedSuffix crypt rule: only keys with this suffix are encrypted
 * @param unencryptedRegex crypt rule: keys matching this are left in plaintext
 * @param encryptedRegex crypt rule: only keys matching this are encrypted
 * @param keys key references by backend type identifier, e.g. {@code pgp: [fingerprint]}
 */
public record CreationRule(@JsonProperty("pathRegex") @Nullable String pathRegex,
                           @JsonProperty("unencryptedSuffix") @Nullable String unencryptedSuffix,
                           @JsonProperty("encryptedSuffix") @Nullable String encryptedSuffix,
                           @JsonProperty("unencryptedRegex") @Nullable String unencryptedRegex,
                           @JsonProperty("encryptedRegex") @Nullable String encryptedRegex,
                           @JsonProperty("keys") @Nullable Map<String, List<String>> keys) {

    public CreationRule {
        long rules = Stream.of(unencryptedSuffix, encryptedSuffix, unencryptedRegex, encryptedRegex).filter(r -> r != null).count();
        if (rules > 1) {
            throw new IllegalArgumentException("a creation rule may only set one of unencryptedSuffix, encryptedSuffix, unencryptedRegex and encryptedRegex");
        }
        if (pathRegex != null) {
            Pattern.compile(pathRegex);
        }
        keys = keys == null ? Map.of() : new LinkedHashMap<>(keys);
    }

    /**
     * @param documentPath path of the document
     * @return true if this rule covers the document
     */
    public boolean appliesTo(String documentPath) {
        return pathRegex == null || Pattern.compile(pathRegex).matcher(documentPath).find();
    }

    /**
     * @return the crypt rule for documents this rule covers
     */
    public CryptRule cryptRule() {
        if (unencryptedSuffix != null) {
            return CryptRule.unencryptedSuffix(unencryptedSuffix);
        }
        if (encryptedSuffix != null) {
            return CryptRule.encryptedSuffix(encryptedSuffix);
        }
        if (unencryptedRegex != null) {
            return CryptRule.unencryptedRegex(unencryptedRegex);
        }
        if (encryptedRegex != null) {
            return CryptRule.encryptedRegex(encryptedRegex);
        }
        return CryptRule.DEFAULT;
    }

    /**
     * Builds the master keys this rule names.
     * @param registry the available backends
     * @return key sources, holding no wrapped data keys yet
     * @throws IllegalArgumentException if a backend is not available
     */
    public List<KeySource> keySources(MasterKeyServiceRegistry registry) {
        var sources = new ArrayList<KeySource>();
        keys.forEach((type, references) -> {
            MasterKeyService<?> service = registry.service(type)
                    .orElseThrow(() -> new IllegalArgumentException("creation rule names keys of backend '" + type + "' which is not available"));
            var masterKeys = new ArrayList<MasterKey>();
            for (String reference : references) {
                masterKeys.addAll(service.newKeys(reference));
            }
            if (!masterKeys.isEmpty()) {
                sources.add(new KeySource(type, masterKeys));
            }
        });
        return sources;
    }
}
