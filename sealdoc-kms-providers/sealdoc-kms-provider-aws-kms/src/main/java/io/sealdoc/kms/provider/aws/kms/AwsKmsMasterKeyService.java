/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.aws.kms;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.config.secret.PasswordProvider;
import io.sealdoc.kms.provider.aws.kms.config.Config;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.Plugin;
import io.sealdoc.tls.TlsHttpClientConfigurator;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.async.SdkAsyncHttpClient;
import software.amazon.awssdk.http.nio.netty.NettyNioAsyncHttpClient;

/**
 * <p>Wraps data keys with AWS KMS keys. Keys are referenced by key or alias ARN, optionally followed by
 * {@code +arn:aws:iam::...} naming a role. Roles are recorded but not assumed.</p>
 *
 * <p>Requests go through the AWS SDK. They are signed with the configured credentials when given,
 * otherwise with the key's {@code aws_profile}, otherwise with the SDK's default credential chain.</p>
 */
@Plugin(configType = Config.class)
public class AwsKmsMasterKeyService implements MasterKeyService<Config> {

    public static final String TYPE = "kms";
    static final String ARN = "arn";
    static final String ROLE = "role";
    static final String CONTEXT = "context";
    static final String AWS_PROFILE = "aws_profile";
    private static final String ROLE_SEPARATOR = "+arn:aws:iam::";

    private static final Logger LOGGER = LoggerFactory.getLogger(AwsKmsMasterKeyService.class);

    @Nullable
    private AwsKmsClient client;
    @Nullable
    private Map<String, String> defaultContext;

    @Override
    public void initialize(@Nullable Config config) {
        if (client != null) {
            throw new IllegalStateException("AWS KMS service is already initialized");
        }
        var effective = config == null ? new Config(null, null, null) : config;
        var configured = configuredCredentials(effective);
        client = new AwsKmsClient(httpClient(effective),
                configured.isPresent() ? StaticCredentialsProvider.create(configured.get()) : DefaultCredentialsProvider.create(),
                configured.isPresent(),
                effective.endpointUrl());
        defaultContext = effective.encryptionContext();
    }

    private static SdkAsyncHttpClient httpClient(Config config) {
        var tls = new TlsHttpClientConfigurator(config.tls());
        var builder = NettyNioAsyncHttpClient.builder()
                .connectionTimeout(config.connectTimeoutOrDefault());
        var trustManagers = tls.trustManagers();
        if (trustManagers != null) {
            builder.tlsTrustManagersProvider(() -> trustManagers);
        }
        var keyManagers = tls.keyManagers();
        if (keyManagers != null) {
            builder.tlsKeyManagersProvider(() -> keyManagers);
        }
        if (config.tls() != null && (config.tls().protocols() != null || config.tls().cipherSuites() != null)) {
            LOGGER.warn("Protocol and cipher suite restrictions are not applied to AWS KMS connections");
        }
        return builder.build();
    }

    /**
     * Credentials given in the configuration. An empty result leaves signing to the SDK's default chain.
     *
     * @param config configuration
     * @return configured credentials, if any
     * @throws IllegalArgumentException if only one of the access key id and secret access key is given
     */
    static Optional<AwsCredentials> configuredCredentials(Config config) {
        String accessKeyId = password(config.accessKeyId()).map(String::strip).filter(s -> !s.isEmpty()).orElse(null);
        String secretAccessKey = password(config.secretAccessKey()).map(String::strip).filter(s -> !s.isEmpty()).orElse(null);
        String sessionToken = password(config.sessionToken()).map(String::strip).filter(s -> !s.isEmpty()).orElse(null);
        if (accessKeyId == null && secretAccessKey == null) {
            return Optional.empty();
        }
        if (accessKeyId == null || secretAccessKey == null) {
            throw new IllegalArgumentException("AWS credentials need both accessKeyId and secretAccessKey");
        }
        return Optional.of(sessionToken == null
                ? AwsBasicCredentials.create(accessKeyId, secretAccessKey)
                : AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken));
    }

    private static Optional<String> password(@Nullable PasswordProvider provider) {
        return Optional.ofNullable(provider).map(PasswordProvider::getProvidedPassword);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return TYPE;
    }

    private AwsKmsClient client() {
        if (client == null) {
            throw new IllegalStateException("AWS KMS service has not been initialized");
        }
        return client;
    }

    @Override
    public @NonNull MasterKey fromMap(@NonNull Map<String, ?> entry) {
        return new AwsKmsMasterKey(client(),
                KeyEntries.requireString(entry, ARN),
                emptyToNull(KeyEntries.optionalString(entry, ROLE)),
                parseContext(entry.get(CONTEXT)),
                emptyToNull(KeyEntries.optionalString(entry, AWS_PROFILE)),
                KeyEntries.encryptedDataKey(entry),
                KeyEntries.creationDate(entry));
    }

    @Override
    public @NonNull MasterKey newKey(@NonNull String reference) {
        return newKey(reference, defaultContext);
    }

    /**
     * Builds a master key from an ARN with the given encryption context.
     * @param reference ARN, optionally followed by {@code +} and a role ARN
     * @param encryptionContext encryption context, or null for none
     * @return the master key
     */
    public @NonNull MasterKey newKey(@NonNull String reference, @Nullable Map<String, String> encryptionContext) {
        String arn = reference.replace(" ", "");
        String role = null;
        int roleIndex = arn.indexOf(ROLE_SEPARATOR);
        if (roleIndex > 0) {
            role = arn.substring(roleIndex + 1);
            arn = arn.substring(0, roleIndex);
        }
        return new AwsKmsMasterKey(client(), arn, role, encryptionContext, null, null, Instant.now());
    }

    /**
     * Reads an encryption context given either as a map or as {@code k1:v1,k2:v2} text.
     * Empty input gives no context. A non-string value disables the context.
     *
     * @param in the context
     * @return the context, or null
     */
    static @Nullable Map<String, String> parseContext(@Nullable Object in) {
        var out = new LinkedHashMap<String, String>();
        if (in instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                return null;
            }
            for (var e : map.entrySet()) {
                if (!(e.getKey() instanceof String key) || !(e.getValue() instanceof String value)) {
                    warnNonString();
                    return null;
                }
                out.put(key, value);
            }
        }
        else if (in instanceof String text) {
            if (text.isEmpty()) {
                return null;
            }
            for (String pair : text.split(",")) {
                String[] kv = pair.split(":", -1);
                if (kv.length != 2) {
                    warnNonString();
                    return null;
                }
                out.put(kv[0], kv[1]);
            }
        }
        else if (in != null) {
            warnNonString();
            return null;
        }
        else {
            return null;
        }
        return out;
    }

    private static void warnNonString() {
        LOGGER.warn("Encryption context contains a non-string value, context will not be used");
    }

    private static @Nullable String emptyToNull(@Nullable String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
            client = null;
        }
    }
}
