/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.walk;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CryptRuleTest {

    @Test
    void unencryptedSuffixExcludesWholeSubtree() {
        CryptRule rule = CryptRule.DEFAULT;

        assertThat(rule.shouldEncrypt(List.of("foo"))).isTrue();
        assertThat(rule.shouldEncrypt(List.of("baz_unencrypted_"))).isFalse();
        assertThat(rule.shouldEncrypt(List.of("meta_unencrypted_", "nested"))).isFalse();
        assertThat(rule.shouldEncrypt(List.of())).isTrue();
    }

    @Test
    void encryptedSuffixSelectsOnlyMatchingPaths() {
        CryptRule rule = CryptRule.encryptedSuffix("_secret");

        assertThat(rule.shouldEncrypt(List.of("password_secret"))).isTrue();
        assertThat(rule.shouldEncrypt(List.of("db_secret", "user"))).isTrue();
        assertThat(rule.shouldEncrypt(List.of("hostname"))).isFalse();
    }

    @Test
    void regexesMatchAnywhereInKey() {
        assertThat(CryptRule.encryptedRegex("^(data|stringData)$").shouldEncrypt(List.of("data", "password"))).isTrue();
        assertThat(CryptRule.encryptedRegex("^(data|stringData)$").shouldEncrypt(List.of("metadata", "name"))).isFalse();
        assertThat(CryptRule.unencryptedRegex("public").shouldEncrypt(List.of("my_public_key"))).isFalse();
        assertThat(CryptRule.unencryptedRegex("public").shouldEncrypt(List.of("private_key"))).isTrue();
    }

    @Test
    void metadataKeys() {
        assertThat(CryptRule.Kind.fromMetadataKey("encrypted_regex")).contains(CryptRule.Kind.ENCRYPTED_REGEX);
        assertThat(CryptRule.Kind.fromMetadataKey("mac")).isEmpty();
        assertThat(CryptRule.DEFAULT).hasToString("unencrypted_suffix=unencrypted_");
    }

    @Test
    void valueEquality() {
        assertThat(CryptRule.encryptedSuffix("_x")).isEqualTo(CryptRule.encryptedSuffix("_x"))
                .isNotEqualTo(CryptRule.unencryptedSuffix("_x"));
    }
}
