/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.provider.ovh.kms;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

import javax.crypto.SecretKey;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.sealdoc.kms.service.DestroyableRawSecretKey;
import io.sealdoc.kms.service.KmsException;
import io.sealdoc.kms.service.UnknownKeyException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Calls the OKMS service key REST API. The API carries binary plaintext base64 encoded, and the
 * plaintext this backend protects is itself the base64 text of the data key.
 */
class OkmsClient {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EncryptResponse(@JsonProperty("ciphertext") String ciphertext) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DecryptResponse(@JsonProperty("plaintext") String plaintext) {}

    private final HttpClient client;
    @Nullable
    private final URI endpointOverride;

    OkmsClient(@NonNull HttpClient client, @Nullable URI endpointOverride) {
        this.client = Objects.requireNonNull(client);
        this.endpointOverride = endpointOverride;
    }

    URI baseUri(String endpoint) {
        if (endpointOverride != null) {
            return endpointOverride;
        }
        return URI.create("https://" + endpoint);
    }

    CompletionStage<String> encrypt(OvhKmsMasterKey key, SecretKey dataKey) {
        byte[] raw = dataKey.getEncoded();
        byte[] keyText = Base64.getEncoder().encode(raw);
        String plaintext;
        try {
            plaintext = Base64.getEncoder().encodeToString(keyText);
        }
        finally {
            Arrays.fill(raw, (byte) 0);
            Arrays.fill(keyText, (byte) 0);
        }
        var request = post(key, "encrypt", Map.of("plaintext", plaintext));
        return sendAsync(key, request, EncryptResponse.class)
                .thenApply(response -> {
                    if (response.ciphertext() == null) {
                        throw new KmsException("OKMS encrypt response for " + key.keyId() + " carried no ciphertext");
                    }
                    return response.ciphertext();
                });
    }

    CompletionStage<SecretKey> decrypt(OvhKmsMasterKey key, String ciphertext) {
        var request = post(key, "decrypt", Map.of("ciphertext", ciphertext));
        return sendAsync(key, request, DecryptResponse.class)
                .thenApply(response -> {
                    if (response.plaintext() == null) {
                        throw new KmsException("OKMS decrypt response for " + key.keyId() + " carried no plaintext");
                    }
                    byte[] keyText = Base64.getDecoder().decode(response.plaintext());
                    try {
                        return DestroyableRawSecretKey.takeOwnershipOf(Base64.getDecoder().decode(keyText), "AES");
                    }
                    finally {
                        Arrays.fill(keyText, (byte) 0);
                    }
                });
    }

    private HttpRequest post(OvhKmsMasterKey key, String operation, Map<String, String> body) {
        URI base = baseUri(key.endpoint());
        URI uri = base.resolve("/v1/servicekey/" + key.serviceKeyId() + "/" + operation);
        return HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(encodeJson(body)))
                .build();
    }

    private <T> CompletionStage<T> sendAsync(OvhKmsMasterKey key, HttpRequest request, Class<T> valueType) {
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> checkResponseStatus(key, response))
                .thenApply(HttpResponse::body)
                .thenApply(bytes -> decodeJson(valueType, bytes));
    }

    private static HttpResponse<byte[]> checkResponseStatus(OvhKmsMasterKey key, HttpResponse<byte[]> response) {
        int statusCode = response.statusCode();
        if (statusCode == 404) {
            throw new UnknownKeyException("OKMS service key " + key.keyId() + " not found");
        }
        if (statusCode < 200 || statusCode >= 300) {
            throw new KmsException("Operation failed, request uri: %s, HTTP status code %d, response: %s".formatted(response.request().uri(), statusCode,
                    new String(response.body(), StandardCharsets.UTF_8)));
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

    private static <T> T decodeJson(Class<T> valueType, byte[] bytes) {
        try {
            T result = OBJECT_MAPPER.readValue(bytes, valueType);
            Arrays.fill(bytes, (byte) 0);
            return result;
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
