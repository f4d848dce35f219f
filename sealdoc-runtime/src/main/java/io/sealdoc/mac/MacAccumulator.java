/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.mac;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import javax.annotation.concurrent.NotThreadSafe;

import io.sealdoc.cipher.ScalarCodec;
import io.sealdoc.tree.Scalar;

/**
 * Computes the document MAC: a SHA-512 digest over the canonical text of every value, in traversal
 * order. Null values contribute nothing.
 */
@NotThreadSafe
public class MacAccumulator {

    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final MessageDigest digest;

    public MacAccumulator() {
        try {
            digest = MessageDigest.getInstance("SHA-512");
        }
        catch (NoSuchAlgorithmException e) {
            // every JRE is required to provide SHA-512
            throw new IllegalStateException(e);
        }
    }

    public void update(Scalar value) {
        if (!(value instanceof Scalar.NullValue)) {
            digest.update(ScalarCodec.toBytes(value));
        }
    }

    /**
     * Completes the digest. The accumulator is reset afterwards.
     * @return upper case hex digest
     */
    public String hexDigest() {
        return HEX.formatHex(digest.digest());
    }

    /**
     * Compares two MACs, ignoring case, in time independent of where they differ.
     * @param expected the stored MAC
     * @param actual the computed MAC
     * @return true if equal
     */
    public static boolean matches(String expected, String actual) {
        return MessageDigest.isEqual(expected.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII),
                actual.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
    }
}
