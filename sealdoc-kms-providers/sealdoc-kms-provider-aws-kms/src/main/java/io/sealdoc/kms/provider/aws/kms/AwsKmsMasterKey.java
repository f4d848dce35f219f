/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.aws.kms;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.AbstractMasterKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A data key wrapped by an AWS KMS key, identified by its key or alias ARN.
 */
final class AwsKmsMasterKey extends AbstractMasterKey {

    private static final Logger LOGGER = LoggerFactory.getLogger(AwsKmsMasterKey.class);
    private static final Pattern ARN = Pattern.compile("^arn:aws[\\w-]*:kms:(.+):[0-9]+:(key|alias)/.+$");

    private final AwsKmsClient client;
    private final String arn;
    @Nullable
    private final String role;
    @Nullable
    private final Map<String, String> encryptionContext;
    @Nullable
    private final String awsProfile;

    AwsKmsMasterKey(@NonNull AwsKmsClient client,
                    @NonNull String arn,
                    @Nullable String role,
                    @Nullable Map<String, String> encryptionContext,
                    @Nullable String awsProfile,
                    @Nullable String encryptedDataKey,
                    @NonNull Instant creationDate) {
        super(encryptedDataKey, creationDate);
        this.client = Objects.requireNonNull(client);
        this.arn = Objects.requireNonNull(arn);
        this.role = role;
        this.encryptionContext = encryptionContext == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(encryptionContext));
        this.awsProfile = awsProfile;
    }

    String arn() {
        return arn;
    }

    @Nullable
    String role() {
        return role;
    }

    @Nullable
    Map<String, String> encryptionContext() {
        return encryptionContext;
    }

    @Nullable
    String awsProfile() {
        return awsProfile;
    }

    /**
     * @return the region named by the ARN.
     * @throws KmsException if the ARN is not a KMS key or alias ARN.
     */
    String region() {
        Matcher matcher = ARN.matcher(arn);
        if (!matcher.matches()) {
            throw new KmsException("no valid ARN found in '" + arn + "'");
        }
        return matcher.group(1);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return AwsKmsMasterKeyService.TYPE;
    }

    @Override
    public @NonNull String keyId() {
        return arn;
    }

    @Override
    public @NonNull MasterKey withEncryptedDataKey(@Nullable String encryptedDataKey, @NonNull Instant creationDate) {
        return new AwsKmsMasterKey(client, arn, role, encryptionContext, awsProfile, encryptedDataKey, creationDate);
    }

    @Override
    protected void writeIdentity(Map<String, Object> entry) {
        entry.put(AwsKmsMasterKeyService.ARN, arn);
        if (role != null) {
            entry.put(AwsKmsMasterKeyService.ROLE, role);
        }
    }

    @Override
    public @NonNull Map<String, Object> toMap() {
        Map<String, Object> entry = super.toMap();
        if (encryptionContext != null) {
            entry.put(AwsKmsMasterKeyService.CONTEXT, new LinkedHashMap<>(encryptionContext));
        }
        if (awsProfile != null) {
            entry.put(AwsKmsMasterKeyService.AWS_PROFILE, awsProfile);
        }
        return entry;
    }

    private void warnUnsupportedSettings() {
        if (role != null) {
            LOGGER.warn("Assuming role {} for key {} is not supported, the configured credentials are used instead", role, arn);
        }
    }

    @Override
    public @NonNull CompletionStage<String> encrypt(@NonNull SecretKey dataKey) {
        CompletionStage<String> stage;
        try {
            warnUnsupportedSettings();
            stage = client.encrypt(this, dataKey);
        }
        catch (KmsException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage.whenComplete((enc, t) -> {
            if (t == null) {
                LOGGER.info("Encryption successful with AWS KMS key {}", arn);
            }
            else {
                LOGGER.info("Encryption failed with AWS KMS key {}: {}", arn, t.getMessage());
            }
        });
    }

    @Override
    public @NonNull CompletionStage<SecretKey> decrypt() {
        CompletionStage<SecretKey> stage;
        try {
            warnUnsupportedSettings();
            stage = client.decrypt(this, requireEncryptedDataKey());
        }
        catch (KmsException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        return stage.whenComplete((key, t) -> {
            if (t == null) {
                LOGGER.info("Decryption successful with AWS KMS key {}", arn);
            }
            else {
                LOGGER.info("Decryption failed with AWS KMS key {}: {}", arn, t.getMessage());
            }
        });
    }
}
