/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.hashicorp.vault;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.provider.hashicorp.vault.config.Config;
import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KeyEntries;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.Plugin;
import io.sealdoc.tls.TlsHttpClientConfigurator;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Wraps data keys with keys of the HashiCorp Vault transit secrets engine.
 * Keys are referenced by URI, e.g. {@code https://vault.example.com:8200/v1/transit/keys/my-key}.
 */
@Plugin(configType = Config.class)
public class VaultMasterKeyService implements MasterKeyService<Config> {

    public static final String TYPE = "hc_vault";
    static final String VAULT_ADDRESS = "vault_address";
    static final String ENGINE_PATH = "engine_path";
    static final String KEY_NAME = "key_name";
    static final String VAULT_TOKEN_ENV = "VAULT_TOKEN";
    static final String VAULT_TOKEN_FILE = ".vault-token";

    private static final Logger LOGGER = LoggerFactory.getLogger(VaultMasterKeyService.class);

    private static final Pattern PREFIXED_PATH = Pattern.compile("/[^/]+/v\\d+/[^/]+/[^/]+/[^/]+");
    private static final Pattern KEY_PATH = Pattern.compile("/v\\d+/[^/]+/[^/]+/[^/]+");

    @Nullable
    private VaultTransitClient client;

    @Override
    public void initialize(@Nullable Config config) {
        if (client != null) {
            throw new IllegalStateException("vault service is already initialized");
        }
        var effective = config == null ? new Config(null, null) : config;
        String token = resolveToken(effective, System.getenv(), Path.of(System.getProperty("user.home")));
        HttpClient httpClient = new TlsHttpClientConfigurator(effective.tls())
                .apply(HttpClient.newBuilder())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(effective.connectTimeoutOrDefault())
                .build();
        client = new VaultTransitClient(httpClient, token);
    }

    @SuppressFBWarnings(value = "PATH_TRAVERSAL_IN", justification = "The token file lives in the user's home directory by convention.")
    static String resolveToken(Config config, Map<String, String> env, Path home) {
        if (config.vaultToken() != null) {
            return config.vaultToken().getProvidedPassword();
        }
        String fromEnv = env.get(VAULT_TOKEN_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            LOGGER.debug("Using Vault token from environment variable {}", VAULT_TOKEN_ENV);
            return fromEnv.strip();
        }
        Path tokenFile = home.resolve(VAULT_TOKEN_FILE);
        if (Files.isReadable(tokenFile)) {
            try {
                LOGGER.debug("Using Vault token from {}", tokenFile);
                return Files.readString(tokenFile, StandardCharsets.UTF_8).strip();
            }
            catch (IOException e) {
                throw new UncheckedIOException("Exception reading " + tokenFile, e);
            }
        }
        throw new IllegalArgumentException("No Vault token configured: set vaultToken, the " + VAULT_TOKEN_ENV + " environment variable or " + tokenFile);
    }

    @Override
    public @NonNull String typeIdentifier() {
        return TYPE;
    }

    private VaultTransitClient client() {
        if (client == null) {
            throw new IllegalStateException("vault service has not been initialized");
        }
        return client;
    }

    @Override
    public @NonNull MasterKey fromMap(@NonNull Map<String, ?> entry) {
        return new VaultMasterKey(client(),
                KeyEntries.requireString(entry, VAULT_ADDRESS),
                KeyEntries.requireString(entry, ENGINE_PATH),
                KeyEntries.requireString(entry, KEY_NAME),
                KeyEntries.encryptedDataKey(entry),
                KeyEntries.creationDate(entry));
    }

    /**
     * Parses a key URI of the form {@code https://host:8200/v1/<engine path>/keys/<key name>}.
     * Vault servers mounted below a path prefix are not supported.
     */
    @Override
    public @NonNull MasterKey newKey(@NonNull String reference) {
        Objects.requireNonNull(reference);
        URI uri;
        try {
            uri = new URI(reference.strip());
        }
        catch (URISyntaxException e) {
            throw new InvalidKeyEntryException("'" + reference + "' is not a valid Vault key URI", e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new InvalidKeyEntryException("missing scheme in Vault URI (should be like https://vault.example.com:8200/v1/transit/keys/keyName), got: " + reference);
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        if (PREFIXED_PATH.matcher(path).find()) {
            throw new InvalidKeyEntryException(
                    "running Vault with a prefixed URL is not supported (format has to be like https://vault.example.com:8200/v1/transit/keys/keyName), got: " + reference);
        }
        if (!KEY_PATH.matcher(path).find()) {
            throw new InvalidKeyEntryException(
                    "Vault path does not seem to be formatted correctly (e.g. https://vault.example.com:8200/v1/transit/keys/keyName), got: " + reference);
        }
        String[] dirs = stripSlashes(path).split("/");
        String keyName = dirs[dirs.length - 1];
        String enginePath = String.join("/", Arrays.copyOfRange(dirs, 1, dirs.length - 2));
        String address = uri.getScheme() + "://" + uri.getRawAuthority();
        return new VaultMasterKey(client(), address, enginePath, keyName, null, Instant.now());
    }

    private static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }

    @Override
    public void close() {
        client = null;
    }
}
