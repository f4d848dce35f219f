/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.cipher;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import io.sealdoc.AuthenticationFailureException;
import io.sealdoc.DocumentParseException;
import io.sealdoc.SealdocException;
import io.sealdoc.UnsupportedValueException;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.ValueType;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * <p>Encrypts single scalar values with AES-256-GCM. Every value gets a fresh random 96-bit nonce and
 * is authenticated together with additional data that binds it to its location, so a ciphertext
 * copied to another location no longer decrypts.</p>
 *
 * <p>The empty string encrypts to the empty string.</p>
 */
@ThreadSafe
public class AesGcmValueCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BYTES = 16;

    private final SecureRandom random;

    public AesGcmValueCipher() {
        this(new SecureRandom());
    }

    public AesGcmValueCipher(@NonNull SecureRandom random) {
        this.random = Objects.requireNonNull(random);
    }

    /**
     * @param value the plaintext value
     * @param dataKey the data key
     * @param additionalData the text the value is bound to
     * @return the encrypted value in its document form
     */
    public String encrypt(@NonNull Scalar value, @NonNull SecretKey dataKey, @NonNull String additionalData) {
        if (value instanceof Scalar.NullValue) {
            throw new UnsupportedValueException("null values are not encrypted");
        }
        if (value instanceof Scalar.StringValue s && s.value().isEmpty()) {
            return "";
        }
        byte[] plaintext = ScalarCodec.toBytes(value);
        byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, dataKey, new GCMParameterSpec(TAG_BYTES * Byte.SIZE, nonce));
            cipher.updateAAD(additionalData.getBytes(StandardCharsets.UTF_8));
            byte[] output = cipher.doFinal(plaintext);
            int dataLength = output.length - TAG_BYTES;
            return new EncryptedValue(Arrays.copyOf(output, dataLength),
                    nonce,
                    Arrays.copyOfRange(output, dataLength, output.length),
                    value.type().tag()).toString();
        }
        catch (GeneralSecurityException e) {
            throw new SealdocException("failed to encrypt value at '" + additionalData + "'", e);
        }
        finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    /**
     * @param encrypted the encrypted value in its document form
     * @param dataKey the data key
     * @param additionalData the text the value was bound to when it was encrypted
     * @return the plaintext value, with the type it was encrypted with
     * @throws DocumentParseException if the text is not an encrypted value, records an unknown type, or carries a tag that is not 16 bytes
     * @throws AuthenticationFailureException if the value was modified, moved, or encrypted with another key
     */
    public Scalar decrypt(@NonNull String encrypted, @NonNull SecretKey dataKey, @NonNull String additionalData) {
        if (encrypted.isEmpty()) {
            return Scalar.of("");
        }
        EncryptedValue parts = EncryptedValue.parse(encrypted)
                .orElseThrow(() -> new DocumentParseException("value at '" + additionalData + "' is not an encrypted value"));
        ValueType type = ValueType.fromTag(parts.type())
                .filter(t -> t != ValueType.NULL)
                .orElseThrow(() -> new DocumentParseException("unknown type '" + parts.type() + "' in encrypted value at '" + additionalData + "'"));
        if (parts.tag().length != TAG_BYTES) {
            throw new DocumentParseException("encrypted value at '" + additionalData + "' has a " + parts.tag().length + "-byte tag, expected " + TAG_BYTES);
        }
        byte[] input = new byte[parts.data().length + parts.tag().length];
        System.arraycopy(parts.data(), 0, input, 0, parts.data().length);
        System.arraycopy(parts.tag(), 0, input, parts.data().length, parts.tag().length);
        byte[] plaintext = null;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, dataKey, new GCMParameterSpec(TAG_BYTES * Byte.SIZE, parts.iv()));
            cipher.updateAAD(additionalData.getBytes(StandardCharsets.UTF_8));
            plaintext = cipher.doFinal(input);
            return ScalarCodec.fromBytes(plaintext, type);
        }
        catch (AEADBadTagException e) {
            throw new AuthenticationFailureException(additionalData, e);
        }
        catch (InvalidAlgorithmParameterException e) {
            throw new DocumentParseException("encrypted value at '" + additionalData + "' has an invalid nonce or tag", e);
        }
        catch (GeneralSecurityException e) {
            throw new SealdocException("failed to decrypt value at '" + additionalData + "'", e);
        }
        finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }
}
