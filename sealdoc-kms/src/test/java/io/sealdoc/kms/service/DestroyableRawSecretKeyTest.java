/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

import java.security.SecureRandom;

import javax.crypto.spec.SecretKeySpec;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DestroyableRawSecretKeyTest {

    @Test
    void destroyZeroesKeyMaterial() {
        byte[] bytes = { 0, 1, 2 };
        var dk = DestroyableRawSecretKey.takeOwnershipOf(bytes, "AES");
        assertThat(dk.getFormat()).isEqualTo("RAW");
        assertThat(dk.getAlgorithm()).isEqualTo("aes");
        var encoded = dk.getEncoded();
        assertThat(dk.isDestroyed()).isFalse();
        dk.destroy();
        assertThat(dk.isDestroyed()).isTrue();
        assertThat(bytes).isEqualTo(new byte[]{ 0, 0, 0 });
        assertThatThrownBy(dk::getEncoded).isExactlyInstanceOf(IllegalStateException.class);
        dk.destroy(); // idempotent
        assertThat(encoded).isEqualTo(new byte[]{ 0, 1, 2 });
    }

    @Test
    void takeCopyLeavesSourceUntouched() {
        byte[] bytes = { 5, 6, 7 };
        var dk = DestroyableRawSecretKey.takeCopyOf(bytes, "AES");
        dk.destroy();
        assertThat(bytes).containsExactly(5, 6, 7);
    }

    @Test
    void generateProducesRequestedLength() {
        var dk = DestroyableRawSecretKey.generate(new SecureRandom(), 32, "AES");
        assertThat(dk.numKeyBits()).isEqualTo(256);
        assertThat(dk.getEncoded()).hasSize(32);
    }

    @Test
    void generateRejectsNonPositiveLength() {
        var random = new SecureRandom();
        assertThatThrownBy(() -> DestroyableRawSecretKey.generate(random, 0, "AES"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void comparesKeyMaterial() {
        var a = DestroyableRawSecretKey.takeCopyOf(new byte[]{ 1, 2, 3 }, "AES");
        var b = new SecretKeySpec(new byte[]{ 1, 2, 3 }, "AES");
        var c = DestroyableRawSecretKey.takeCopyOf(new byte[]{ 1, 2, 4 }, "AES");
        assertThat(a.hasSameKeyMaterialAs(b)).isTrue();
        assertThat(a.hasSameKeyMaterialAs(c)).isFalse();
    }

    @Test
    void toDestroyableKey() {
        byte[] bytes1 = { 0, 1, 2 };
        var sk1 = new SecretKeySpec(bytes1, "foo") {
            boolean destroyed = false;

            @Override
            public void destroy() {
                destroyed = true;
            }

            @Override
            public boolean isDestroyed() {
                return destroyed;
            }
        };
        var dk2 = DestroyableRawSecretKey.toDestroyableKey(sk1);
        assertThat(sk1.isDestroyed()).isTrue();
        assertThat(dk2.isDestroyed()).isFalse();
        assertThat(dk2.getEncoded()).isEqualTo(bytes1);
        assertThat(dk2.getAlgorithm()).isEqualTo("foo");

        var dk3 = DestroyableRawSecretKey.toDestroyableKey(dk2);
        assertThat(dk3).isSameAs(dk2);
    }

    @Test
    void toStringDoesNotRevealKeyMaterial() {
        var dk = DestroyableRawSecretKey.takeCopyOf(new byte[]{ 42, 42 }, "AES");
        assertThat(dk).asString().contains("bits=16").doesNotContain("42");
    }
}
