/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.cipher;

import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.sealdoc.DocumentParseException;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * The parts of an encrypted value as stored in a document:
 * {@code ENC[AES256_GCM,data:<base64>,iv:<base64>,tag:<base64>,type:<type>]}.
 *
 * @param data ciphertext without the authentication tag
 * @param iv nonce
 * @param tag GCM authentication tag
 * @param type type tag of the plaintext
 */
@SuppressFBWarnings(value = { "EI_EXPOSE_REP", "EI_EXPOSE_REP2" }, justification = "short lived value passed between the cipher and the document")
public record EncryptedValue(byte[] data, byte[] iv, byte[] tag, String type) {

    private static final Pattern ENVELOPE = Pattern.compile("^ENC\\[AES256_GCM,data:(.+),iv:(.+),tag:(.+),type:(.+)\\]");

    public EncryptedValue {
        Objects.requireNonNull(data);
        Objects.requireNonNull(iv);
        Objects.requireNonNull(tag);
        Objects.requireNonNull(type);
    }

    /**
     * @param text a string value from a document
     * @return true if the string has the form of an encrypted value
     */
    public static boolean isEncrypted(String text) {
        return ENVELOPE.matcher(text).lookingAt();
    }

    /**
     * @param text a string value from a document
     * @return the parts of the value, or empty if the text is not an encrypted value.
     * @throws DocumentParseException if the text looks like an encrypted value but its parts are not valid base64.
     */
    public static Optional<EncryptedValue> parse(String text) {
        Matcher matcher = ENVELOPE.matcher(text);
        if (!matcher.lookingAt()) {
            return Optional.empty();
        }
        try {
            Base64.Decoder decoder = Base64.getDecoder();
            return Optional.of(new EncryptedValue(decoder.decode(matcher.group(1)),
                    decoder.decode(matcher.group(2)),
                    decoder.decode(matcher.group(3)),
                    matcher.group(4)));
        }
        catch (IllegalArgumentException e) {
            throw new DocumentParseException("encrypted value has malformed base64 content", e);
        }
    }

    @Override
    public String toString() {
        Base64.Encoder encoder = Base64.getEncoder();
        return "ENC[AES256_GCM,data:" + encoder.encodeToString(data)
                + ",iv:" + encoder.encodeToString(iv)
                + ",tag:" + encoder.encodeToString(tag)
                + ",type:" + type + "]";
    }
}
