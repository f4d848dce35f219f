/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.hashicorp.vault;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

import javax.crypto.SecretKey;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.UnknownKeyException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Talks to the transit secrets engine of a Vault server.
 */
class VaultTransitClient {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<VaultResponse<VaultResponse.EncryptData>> ENCRYPT_RESPONSE_TYPE_REF = new TypeReference<>() {
    };
    private static final TypeReference<VaultResponse<VaultResponse.DecryptData>> DECRYPT_RESPONSE_TYPE_REF = new TypeReference<>() {
    };
    private static final String VAULT_TOKEN_HEADER = "X-Vault-Token";

    private final HttpClient client;
    private final String vaultToken;

    VaultTransitClient(@NonNull HttpClient client, @NonNull String vaultToken) {
        this.client = Objects.requireNonNull(client);
        this.vaultToken = Objects.requireNonNull(vaultToken);
    }

    /**
     * Wraps the data key, sending it base64 encoded as Vault requires.
     */
    CompletionStage<String> encrypt(VaultMasterKey key, SecretKey dataKey) {
        byte[] raw = dataKey.getEncoded();
        String plaintext;
        try {
            plaintext = Base64.getEncoder().encodeToString(raw);
        }
        finally {
            Arrays.fill(raw, (byte) 0);
        }
        var request = createVaultPost(key.encryptUri(), Map.of("plaintext", plaintext));
        return sendAsync(key, request, ENCRYPT_RESPONSE_TYPE_REF)
                .thenApply(response -> {
                    if (response.data() == null || response.data().ciphertext() == null) {
                        throw new KmsException("Vault encrypt response for " + key.keyId() + " carried no ciphertext");
                    }
                    return response.data().ciphertext();
                });
    }

    CompletionStage<SecretKey> decrypt(VaultMasterKey key, String ciphertext) {
        var request = createVaultPost(key.decryptUri(), Map.of("ciphertext", ciphertext));
        return sendAsync(key, request, DECRYPT_RESPONSE_TYPE_REF)
                .thenApply(response -> {
                    if (response.data() == null || response.data().plaintext() == null) {
                        throw new KmsException("Vault decrypt response for " + key.keyId() + " carried no plaintext");
                    }
                    return DestroyableRawSecretKey.takeOwnershipOf(Base64.getDecoder().decode(response.data().plaintext()), "AES");
                });
    }

    private HttpRequest createVaultPost(URI uri, Map<String, String> body) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .header(VAULT_TOKEN_HEADER, vaultToken)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(encodeJson(body)))
                .build();
    }

    private <T> CompletionStage<T> sendAsync(VaultMasterKey key, HttpRequest request, TypeReference<T> valueTypeRef) {
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> checkResponseStatus(key, response))
                .thenApply(HttpResponse::body)
                .thenApply(bytes -> decodeJson(valueTypeRef, bytes));
    }

    private static HttpResponse<byte[]> checkResponseStatus(VaultMasterKey key, HttpResponse<byte[]> response) {
        int statusCode = response.statusCode();
        if (statusCode == 404) {
            throw new UnknownKeyException("Vault transit key " + key.keyId() + " not found (HTTP " + statusCode + ")");
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw new KmsException("Operation failed, request uri: %s, HTTP status code %d".formatted(response.request().uri(), statusCode));
        }
        return response;
    }

    private static byte[] encodeJson(Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsBytes(obj);
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static <T> T decodeJson(TypeReference<T> valueTypeRef, byte[] bytes) {
        try {
            T result = OBJECT_MAPPER.readValue(bytes, valueTypeRef);
            Arrays.fill(bytes, (byte) 0);
            return result;
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
