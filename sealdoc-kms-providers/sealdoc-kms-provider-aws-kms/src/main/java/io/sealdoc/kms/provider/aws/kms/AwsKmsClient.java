/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.aws.kms;

import java.net.URI;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.UnknownKeyException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kms.KmsAsyncClient;
import software.amazon.awssdk.services.kms.model.DecryptRequest;
import software.amazon.awssdk.services.kms.model.EncryptRequest;
import software.amazon.awssdk.services.kms.model.NotFoundException;

/**
 * Calls AWS KMS through the SDK, holding one {@link KmsAsyncClient} per region over a shared HTTP client.
 */
class AwsKmsClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AwsKmsClient.class);

    private final SdkAsyncHttpClient httpClient;
    private final AwsCredentialsProvider credentials;
    private final boolean credentialsConfigured;
    @Nullable
    private final URI endpointOverride;
    private final Map<String, KmsAsyncClient> regionalClients = new ConcurrentHashMap<>();
    private final Map<String, AwsCredentialsProvider> profiles = new ConcurrentHashMap<>();

    /**
     * @param httpClient transport shared by every regional client, closed with this client
     * @param credentials credentials used unless a key names a profile
     * @param credentialsConfigured whether {@code credentials} were configured explicitly, in which case key profiles are ignored
     * @param endpointOverride if set, requests for every region go here
     */
    AwsKmsClient(@NonNull SdkAsyncHttpClient httpClient, @NonNull AwsCredentialsProvider credentials, boolean credentialsConfigured,
                 @Nullable URI endpointOverride) {
        this.httpClient = Objects.requireNonNull(httpClient);
        this.credentials = Objects.requireNonNull(credentials);
        this.credentialsConfigured = credentialsConfigured;
        this.endpointOverride = endpointOverride;
    }

    KmsAsyncClient forRegion(String region) {
        return regionalClients.computeIfAbsent(region, r -> {
            var builder = KmsAsyncClient.builder()
                    .region(Region.of(r))
                    .credentialsProvider(credentials)
                    .httpClient(httpClient);
            if (endpointOverride != null) {
                builder.endpointOverride(endpointOverride);
            }
            return builder.build();
        });
    }

    AwsCredentialsProvider credentialsFor(AwsKmsMasterKey key) {
        String profile = key.awsProfile();
        if (profile == null) {
            return credentials;
        }
        if (credentialsConfigured) {
            LOGGER.debug("Ignoring AWS profile {} for key {}, the configured credentials are used instead", profile, key.keyId());
            return credentials;
        }
        return profiles.computeIfAbsent(profile, ProfileCredentialsProvider::create);
    }

    CompletionStage<String> encrypt(AwsKmsMasterKey key, SecretKey dataKey) {
        var client = forRegion(key.region());
        byte[] raw = dataKey.getEncoded();
        EncryptRequest request;
        try {
            request = EncryptRequest.builder()
                    .keyId(key.arn())
                    .plaintext(SdkBytes.fromByteArray(raw))
                    .encryptionContext(key.encryptionContext())
                    .overrideConfiguration(o -> o.credentialsProvider(credentialsFor(key)))
                    .build();
        }
        finally {
            Arrays.fill(raw, (byte) 0);
        }
        return client.encrypt(request)
                .handle((response, t) -> {
                    if (t != null) {
                        throw translate(key, t);
                    }
                    if (response.ciphertextBlob() == null) {
                        throw new KmsException("AWS KMS encrypt response for " + key.keyId() + " carried no ciphertext");
                    }
                    return Base64.getEncoder().encodeToString(response.ciphertextBlob().asByteArrayUnsafe());
                });
    }

    CompletionStage<SecretKey> decrypt(AwsKmsMasterKey key, String ciphertextBlob) {
        var client = forRegion(key.region());
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(ciphertextBlob);
        }
        catch (IllegalArgumentException e) {
            throw new KmsException("encrypted data key for AWS KMS key " + key.keyId() + " is not base64", e);
        }
        var request = DecryptRequest.builder()
                .keyId(key.arn())
                .ciphertextBlob(SdkBytes.fromByteArray(blob))
                .encryptionContext(key.encryptionContext())
                .overrideConfiguration(o -> o.credentialsProvider(credentialsFor(key)))
                .build();
        return client.decrypt(request)
                .handle((response, t) -> {
                    if (t != null) {
                        throw translate(key, t);
                    }
                    if (response.plaintext() == null) {
                        throw new KmsException("AWS KMS decrypt response for " + key.keyId() + " carried no plaintext");
                    }
                    return DestroyableRawSecretKey.takeOwnershipOf(response.plaintext().asByteArray(), "AES");
                });
    }

    private static RuntimeException translate(AwsKmsMasterKey key, Throwable t) {
        Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        if (cause instanceof NotFoundException notFound) {
            return new UnknownKeyException("AWS KMS key " + key.keyId() + " not found: " + notFound.awsErrorDetails().errorMessage());
        }
        if (cause instanceof AwsServiceException service) {
            var details = service.awsErrorDetails();
            return new KmsException("AWS KMS operation with key %s failed: %s (%s, HTTP status code %d)".formatted(key.keyId(),
                    details.errorMessage(), details.errorCode(), service.statusCode()), service);
        }
        return new KmsException("AWS KMS operation with key " + key.keyId() + " failed: " + cause.getMessage(), cause);
    }

    @Override
    public void close() {
        regionalClients.values().forEach(KmsAsyncClient::close);
        regionalClients.clear();
        httpClient.close();
    }
}
