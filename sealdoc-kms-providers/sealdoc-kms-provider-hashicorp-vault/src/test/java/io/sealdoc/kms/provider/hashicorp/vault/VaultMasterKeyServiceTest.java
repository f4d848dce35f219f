/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.hashicorp.vault;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.sealdoc.config.secret.InlinePassword;
import io.sealdoc.kms.provider.hashicorp.vault.config.Config;
import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.InvalidKeyEntryException;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.MasterKey;
import io.sealdoc.kms.service.UnknownKeyException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultMasterKeyServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String TOKEN = "s.test-token";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private String address;
    private final Map<String, String> knownKeys = new ConcurrentHashMap<>();
    private VaultMasterKeyService service;
    private DestroyableRawSecretKey dataKey;

    @BeforeEach
    void beforeEach() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/v1/", this::handleTransit);
        server.start();
        address = "http://localhost:" + server.getAddress().getPort();
        knownKeys.put("transit/my-key", "v1");
        service = new VaultMasterKeyService();
        service.initialize(new Config(new InlinePassword(TOKEN), null));
        dataKey = DestroyableRawSecretKey.generate(new SecureRandom(), 32, "AES");
    }

    @AfterEach
    void afterEach() {
        service.close();
        server.stop(0);
    }

    /**
     * Mimics the transit engine: the ciphertext is the base64 plaintext tagged with the key version.
     */
    private void handleTransit(HttpExchange exchange) throws IOException {
        try (InputStream body = exchange.getRequestBody()) {
            if (!TOKEN.equals(exchange.getRequestHeaders().getFirst("X-Vault-Token"))) {
                respond(exchange, 403, "{\"errors\":[\"permission denied\"]}");
                return;
            }
            String path = exchange.getRequestURI().getPath().substring("/v1/".length());
            int op = path.lastIndexOf("/encrypt/") >= 0 ? path.lastIndexOf("/encrypt/") : path.lastIndexOf("/decrypt/");
            if (op < 0 || !"POST".equals(exchange.getRequestMethod())) {
                respond(exchange, 405, "{}");
                return;
            }
            String engine = path.substring(0, op);
            String operation = path.substring(op + 1, op + 8);
            String keyName = path.substring(op + 9);
            String version = knownKeys.get(engine + "/" + keyName);
            if (version == null) {
                respond(exchange, 404, "{\"errors\":[]}");
                return;
            }
            JsonNode request = MAPPER.readTree(body);
            if (operation.equals("encrypt")) {
                String ciphertext = "vault:" + version + ":" + request.get("plaintext").asText();
                respond(exchange, 200, MAPPER.writeValueAsString(Map.of("data", Map.of("ciphertext", ciphertext))));
            }
            else {
                String ciphertext = request.get("ciphertext").asText();
                String prefix = "vault:" + version + ":";
                if (!ciphertext.startsWith(prefix)) {
                    respond(exchange, 400, "{\"errors\":[\"invalid ciphertext\"]}");
                    return;
                }
                respond(exchange, 200, MAPPER.writeValueAsString(Map.of("data", Map.of("plaintext", ciphertext.substring(prefix.length())))));
            }
        }
        finally {
            exchange.close();
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Test
    void parsesKeyUri() {
        var key = (VaultMasterKey) service.newKey("https://vault.example.com:8200/v1/transit/keys/my-key");
        assertThat(key.vaultAddress()).isEqualTo("https://vault.example.com:8200");
        assertThat(key.enginePath()).isEqualTo("transit");
        assertThat(key.keyName()).isEqualTo("my-key");
        assertThat(key.keyId()).isEqualTo("https://vault.example.com:8200/v1/transit/keys/my-key");
        assertThat(key.hasEncryptedDataKey()).isFalse();
    }

    @Test
    void parsesNestedEnginePath() {
        var key = (VaultMasterKey) service.newKey("https://vault:8200/v1/team/transit/keys/k");
        assertThat(key.enginePath()).isEqualTo("team/transit");
        assertThat(key.keyName()).isEqualTo("k");
    }

    @ParameterizedTest
    @ValueSource(strings = { "https://vault:8200/prefix/v1/transit/keys/k", "https://vault:8200/transit/keys/k", "vault:8200/v1/transit/keys/k", "::not a uri" })
    void rejectsMalformedKeyUris(String reference) {
        assertThatThrownBy(() -> service.newKey(reference))
                .isInstanceOf(InvalidKeyEntryException.class);
    }

    @Test
    void wrapThenUnwrap() {
        MasterKey key = service.newKey(address + "/v1/transit/keys/my-key");
        MasterKey wrapped = key.wrap(dataKey).toCompletableFuture().join();
        assertThat(wrapped.encryptedDataKey()).startsWith("vault:v1:");

        assertThat(wrapped.decrypt())
                .succeedsWithin(TIMEOUT)
                .isInstanceOfSatisfying(DestroyableRawSecretKey.class, k -> assertThat(k.hasSameKeyMaterialAs(dataKey)).isTrue());
    }

    @Test
    void unknownKeyReported() {
        MasterKey key = service.newKey(address + "/v1/transit/keys/missing");
        assertThat(key.encrypt(dataKey))
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(UnknownKeyException.class);
    }

    @Test
    void serverErrorReportedAsKmsException() {
        MasterKey key = service.newKey(address + "/v1/transit/keys/my-key").withEncryptedDataKey("garbage", Instant.now());
        assertThat(key.decrypt())
                .failsWithin(TIMEOUT)
                .withThrowableThat()
                .withCauseInstanceOf(KmsException.class)
                .withMessageContaining("400");
    }

    @Test
    void wrongTokenRejected() {
        try (var other = new VaultMasterKeyService()) {
            other.initialize(new Config(new InlinePassword("wrong"), null));
            assertThat(other.newKey(address + "/v1/transit/keys/my-key").encrypt(dataKey))
                    .failsWithin(TIMEOUT)
                    .withThrowableThat()
                    .withCauseInstanceOf(KmsException.class)
                    .withMessageContaining("403");
        }
    }

    @Test
    void toMapAndFromMap() {
        MasterKey wrapped = service.newKey(address + "/v1/transit/keys/my-key").wrap(dataKey).toCompletableFuture().join();
        Map<String, Object> entry = wrapped.toMap();
        assertThat(entry.keySet()).containsExactly("vault_address", "engine_path", "key_name", "created_at", "enc");

        MasterKey restored = service.fromMap(entry);
        assertThat(restored.keyId()).isEqualTo(wrapped.keyId());
        assertThat(restored.decrypt()).succeedsWithin(TIMEOUT);
    }

    @Test
    void tokenFromConfigTakesPrecedence(@TempDir Path home) {
        assertThat(VaultMasterKeyService.resolveToken(new Config(new InlinePassword("cfg"), null), Map.of("VAULT_TOKEN", "env"), home))
                .isEqualTo("cfg");
    }

    @Test
    void tokenFromEnvironment(@TempDir Path home) {
        assertThat(VaultMasterKeyService.resolveToken(new Config(null, null), Map.of("VAULT_TOKEN", " env "), home))
                .isEqualTo("env");
    }

    @Test
    void tokenFromHomeFile(@TempDir Path home) throws IOException {
        Files.writeString(home.resolve(".vault-token"), "file-token\n");
        assertThat(VaultMasterKeyService.resolveToken(new Config(null, null), Map.of(), home))
                .isEqualTo("file-token");
    }

    @Test
    void missingTokenRejected(@TempDir Path home) {
        var config = new Config(null, null);
        Map<String, String> env = Map.of();
        assertThatThrownBy(() -> VaultMasterKeyService.resolveToken(config, env, home))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No Vault token");
    }

    @Test
    void uninitializedServiceRejectsKeys() {
        var uninitialized = new VaultMasterKeyService();
        assertThatThrownBy(() -> uninitialized.newKey("https://vault:8200/v1/transit/keys/k"))
                .isInstanceOf(IllegalStateException.class);
    }
}
