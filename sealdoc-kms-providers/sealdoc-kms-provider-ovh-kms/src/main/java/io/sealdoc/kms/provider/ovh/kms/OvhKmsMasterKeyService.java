/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.ovh.kms;

import java.net.http.HttpClient;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.sealdoc.kms.provider.ovh.kms.config.Config;
import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.Plugin;
import io.sealdoc.tls.TlsHttpClientConfigurator;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Wraps data keys with OVHcloud KMS service keys. Keys are referenced as {@code <endpoint>/<key uuid>},
 * e.g. {@code eu-west-rbx.okms.ovh.net/3f1e...}.
 */
@Plugin(configType = Config.class)
public class OvhKmsMasterKeyService implements MasterKeyService<Config> {

    public static final String TYPE = "ovh_kms";
    static final String ENDPOINT = "endpoint";
    static final String KEY_ID = "key_id";

    private static final Pattern REFERENCE = Pattern.compile("^([^/]+)/([^/]+)$");

    @Nullable
    private OkmsClient client;

    @Override
    public void initialize(@Nullable Config config) {
        if (client != null) {
            throw new IllegalStateException("OVH KMS service is already initialized");
        }
        var effective = config == null ? new Config(null, null, null) : config;
        HttpClient httpClient = new TlsHttpClientConfigurator(effective.tls())
                .apply(HttpClient.newBuilder())
                .connectTimeout(effective.connectTimeoutOrDefault())
                .build();
        client = new OkmsClient(httpClient, effective.endpointOverride());
    }

    @Override
    public @NonNull String typeIdentifier() {
        return TYPE;
    }

    private OkmsClient client() {
        if (client == null) {
            throw new IllegalStateException("OVH KMS service has not been initialized");
        }
        return client;
    }

    @Override
    public @NonNull MasterKey fromMap(@NonNull Map<String, ?> entry) {
        return new OvhKmsMasterKey(client(),
                KeyEntries.requireString(entry, ENDPOINT),
                KeyEntries.requireString(entry, KEY_ID),
                KeyEntries.encryptedDataKey(entry),
                KeyEntries.creationDate(entry));
    }

    @Override
    public @NonNull MasterKey newKey(@NonNull String reference) {
        Objects.requireNonNull(reference);
        Matcher matcher = REFERENCE.matcher(reference.strip());
        if (!matcher.matches()) {
            throw new InvalidKeyEntryException("not a valid OVH KMS key (should be like example.okms.ovh.net/keyId), got: " + reference);
        }
        var key = new OvhKmsMasterKey(client(), matcher.group(1), matcher.group(2), null, Instant.now());
        try {
            key.serviceKeyId();
        }
        catch (KmsException e) {
            throw new InvalidKeyEntryException("OVH KMS key id in '" + reference + "' is not a UUID", e);
        }
        return key;
    }

    @Override
    public void close() {
        client = null;
    }
}
