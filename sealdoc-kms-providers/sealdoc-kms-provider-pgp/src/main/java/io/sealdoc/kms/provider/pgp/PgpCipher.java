/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.pgp;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.security.Provider;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Date;
import java.util.Objects;

import javax.crypto.SecretKey;

import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.bcpg.SymmetricKeyAlgorithmTags;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPEncryptedDataGenerator;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPLiteralDataGenerator;
import org.bouncycastle.openpgp.PGPPrivateKey;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyEncryptedData;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.jcajce.JcaPGPObjectFactory;
import org.bouncycastle.openpgp.operator.jcajce.JcePBESecretKeyDecryptorBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePGPDataEncryptorBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePublicKeyDataDecryptorFactoryBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePublicKeyKeyEncryptionMethodGenerator;

import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.UnknownKeyException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Encrypts data keys into ASCII armoured OpenPGP messages and back.
 */
final class PgpCipher {

    private static final Provider PROVIDER = new BouncyCastleProvider();
    private static final String LITERAL_NAME = "";

    private final KeyRings keyRings;
    @Nullable
    private final char[] passphrase;
    private final SecureRandom random = new SecureRandom();

    PgpCipher(@NonNull KeyRings keyRings, @Nullable char[] passphrase) {
        this.keyRings = Objects.requireNonNull(keyRings);
        this.passphrase = passphrase;
    }

    String encrypt(String fingerprint, SecretKey dataKey) {
        PGPPublicKey recipient = keyRings.encryptionKeyFor(fingerprint)
                .orElseThrow(() -> new UnknownKeyException("no PGP encryption key found for fingerprint " + fingerprint));
        byte[] plaintext = dataKey.getEncoded();
        try {
            var generator = new PGPEncryptedDataGenerator(new JcePGPDataEncryptorBuilder(SymmetricKeyAlgorithmTags.AES_256)
                    .setWithIntegrityPacket(true)
                    .setSecureRandom(random)
                    .setProvider(PROVIDER));
            generator.addMethod(new JcePublicKeyKeyEncryptionMethodGenerator(recipient).setProvider(PROVIDER).setSecureRandom(random));

            var armored = new ByteArrayOutputStream();
            try (var armor = new ArmoredOutputStream(armored);
                    OutputStream encrypted = generator.open(armor, new byte[1 << 12])) {
                var literal = new PGPLiteralDataGenerator();
                try (OutputStream literalOut = literal.open(encrypted, PGPLiteralData.BINARY, LITERAL_NAME, plaintext.length, new Date())) {
                    literalOut.write(plaintext);
                }
            }
            return armored.toString(StandardCharsets.US_ASCII);
        }
        catch (IOException | PGPException e) {
            throw new KmsException("failed to encrypt data key to PGP key " + fingerprint, e);
        }
        finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    SecretKey decrypt(String fingerprint, String armoredMessage) {
        try (InputStream in = PGPUtil.getDecoderStream(new ByteArrayInputStream(armoredMessage.getBytes(StandardCharsets.US_ASCII)))) {
            PGPEncryptedDataList encryptedDataList = firstEncryptedDataList(new JcaPGPObjectFactory(in));
            for (var encryptedData : encryptedDataList) {
                if (encryptedData instanceof PGPPublicKeyEncryptedData publicKeyEncrypted) {
                    PGPSecretKey secretKey = keyRings.secretKey(publicKeyEncrypted.getKeyID()).orElse(null);
                    if (secretKey != null) {
                        return decrypt(publicKeyEncrypted, secretKey);
                    }
                }
            }
            throw new KmsException("no PGP secret key available to decrypt data key encrypted to " + fingerprint);
        }
        catch (IOException | PGPException e) {
            throw new KmsException("failed to decrypt data key with PGP key " + fingerprint, e);
        }
    }

    private SecretKey decrypt(PGPPublicKeyEncryptedData encryptedData, PGPSecretKey secretKey) throws IOException, PGPException {
        PGPPrivateKey privateKey = secretKey.extractPrivateKey(new JcePBESecretKeyDecryptorBuilder()
                .setProvider(PROVIDER)
                .build(passphrase == null ? new char[0] : passphrase));
        try (InputStream clear = encryptedData.getDataStream(new JcePublicKeyDataDecryptorFactoryBuilder().setProvider(PROVIDER).build(privateKey))) {
            Object message = new JcaPGPObjectFactory(clear).nextObject();
            if (message instanceof PGPCompressedData compressed) {
                message = new JcaPGPObjectFactory(compressed.getDataStream()).nextObject();
            }
            if (!(message instanceof PGPLiteralData literal)) {
                throw new KmsException("PGP message does not contain literal data");
            }
            byte[] plaintext;
            try (InputStream literalIn = literal.getInputStream()) {
                plaintext = literalIn.readAllBytes();
            }
            if (encryptedData.isIntegrityProtected() && !encryptedData.verify()) {
                Arrays.fill(plaintext, (byte) 0);
                throw new KmsException("PGP message failed its integrity check");
            }
            return DestroyableRawSecretKey.takeOwnershipOf(plaintext, "AES");
        }
    }

    private static PGPEncryptedDataList firstEncryptedDataList(JcaPGPObjectFactory factory) throws IOException {
        Object next;
        while ((next = factory.nextObject()) != null) {
            if (next instanceof PGPEncryptedDataList list) {
                return list;
            }
        }
        throw new KmsException("armoured text does not contain a PGP encrypted message");
    }
}
