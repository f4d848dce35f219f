/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.store.yaml;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.sealdoc.DecryptOptions;
import io.sealdoc.DocumentParseException;
import io.sealdoc.EncryptedDocument;
import io.sealdoc.Sealdoc;
import io.sealdoc.UnsupportedValueException;
import io.sealdoc.config.ConfigParser;
import io.sealdoc.config.MasterKeyServiceRegistry;
import io.sealdoc.keys.KeyServiceOptions;
import io.sealdoc.kms.provider.inmemory.InMemoryMasterKeyService;
import io.sealdoc.metadata.KeySource;
import io.sealdoc.metadata.Metadata;
import io.sealdoc.metadata.OpaqueMasterKey;
import io.sealdoc.tree.Scalar;
import io.sealdoc.tree.TreeBranch;
import io.sealdoc.tree.TreeList;
import io.sealdoc.walk.CryptRule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlStoreTest {

    private InMemoryMasterKeyService inMemory;
    private Sealdoc sealdoc;
    private YamlStore store;

    @BeforeEach
    void setUp() {
        inMemory = new InMemoryMasterKeyService();
        inMemory.initialize(null);
        inMemory.generateKey("k1");
        sealdoc = new Sealdoc(new MasterKeyServiceRegistry(new ConfigParser()).register(inMemory), new KeyServiceOptions(null, 0, null, null));
        store = new YamlStore(sealdoc.metadataMapper());
    }

    @AfterEach
    void tearDown() {
        sealdoc.close();
    }

    @Test
    void encryptedDocumentRoundTrip() {
        TreeBranch plaintext = store.unmarshal(bytes("""
                apiVersion: v1
                kind: Secret
                data:
                  password: hunter2
                  port: 5432
                  enabled: true
                  ratio: 0.25
                  hosts:
                    - a.example.com
                    - b.example.com
                """));

        EncryptedDocument encrypted = sealdoc.encrypt(plaintext, List.of(new KeySource(InMemoryMasterKeyService.TYPE, inMemory.newKeys("k1"))),
                CryptRule.encryptedRegex("^data$"));
        byte[] written = encrypted.marshal(store);
        String text = new String(written, StandardCharsets.UTF_8);

        assertThat(text).contains("apiVersion: v1").contains("kind: Secret").doesNotContain("hunter2").contains("encrypted_regex:");
        assertThat(sealdoc.decrypt(written, store, DecryptOptions.DEFAULT).tree()).isEqualTo(plaintext);
    }

    @Test
    void numberLikeStringsStayStrings() {
        TreeBranch tree = TreeBranch.builder()
                .put("port", "5432")
                .put("flag", "true")
                .put("empty", "")
                .build();

        assertThat(store.unmarshal(store.marshal(tree))).isEqualTo(tree);
    }

    @Test
    void readsScalarTypes() {
        TreeBranch tree = store.unmarshal(bytes("""
                s: text
                i: -17
                f: 2.5
                b: false
                n: null
                l: [1, two]
                """));

        assertThat(tree).isEqualTo(TreeBranch.builder()
                .put("s", "text")
                .put("i", Scalar.of(-17L))
                .put("f", Scalar.of(2.5))
                .put("b", Scalar.of(false))
                .put("n", Scalar.nullValue())
                .put("l", TreeList.of(Scalar.of(1L), Scalar.of("two")))
                .build());
    }

    @Test
    void emptyDocumentIsAnEmptyTree() {
        assertThat(store.unmarshal(new byte[0])).isEqualTo(TreeBranch.empty());
    }

    @Test
    void metadataOfUnavailableBackendsSurvives() {
        byte[] document = bytes("""
                foo: ENC[AES256_GCM,data:AAAA,iv:AAAAAAAAAAAAAAAA,tag:AAAAAAAAAAAAAAAAAAAAAA==,type:str]
                sops:
                  azure_kv:
                    - vault_url: https://example.vault.azure.net
                      name: key
                      version: abc
                      created_at: "2024-01-01T00:00:00Z"
                      enc: d3JhcHBlZA
                  lastmodified: "2024-01-01T00:00:00Z"
                  mac: ENC[AES256_GCM,data:AAAA,iv:AAAAAAAAAAAAAAAA,tag:AAAAAAAAAAAAAAAAAAAAAA==,type:str]
                  unencrypted_suffix: _unencrypted
                  version: 3.8.1
                """);

        Metadata metadata = store.unmarshalMetadata(document);

        assertThat(metadata.version()).isEqualTo("3.8.1");
        assertThat(metadata.lastModified().toInstant()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        assertThat(metadata.cryptRule()).isEqualTo(CryptRule.unencryptedSuffix("_unencrypted"));
        assertThat(metadata.keySources()).singleElement().satisfies(source -> {
            assertThat(source.name()).isEqualTo("azure_kv");
            assertThat(source.keys()).singleElement().isInstanceOf(OpaqueMasterKey.class);
        });
        String rewritten = new String(store.marshalWithMetadata(store.unmarshal(document), metadata), StandardCharsets.UTF_8);
        assertThat(rewritten).contains("vault_url: https://example.vault.azure.net").contains("enc: d3JhcHBlZA");
    }

    @Test
    void rejectsUnsupportedValues() {
        assertThatThrownBy(() -> store.unmarshal(bytes("blob: !!binary aGVsbG8=\n")))
                .isInstanceOf(UnsupportedValueException.class);
        assertThatThrownBy(() -> store.unmarshal(bytes("huge: 123456789012345678901234567890\n")))
                .isInstanceOf(UnsupportedValueException.class);
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> store.unmarshal(bytes("a: [1, 2\n")))
                .isInstanceOf(DocumentParseException.class);
        assertThatThrownBy(() -> store.unmarshal(bytes("- just\n- a list\n")))
                .isInstanceOf(DocumentParseException.class);
        assertThatThrownBy(() -> store.unmarshal(bytes("a: 1\na: 2\n")))
                .isInstanceOf(DocumentParseException.class);
    }

    @Test
    void singleValues() {
        assertThat(new String(store.marshalValue(Scalar.of("raw: text")), StandardCharsets.UTF_8)).isEqualTo("raw: text");
        assertThat(new String(store.marshalValue(TreeBranch.builder().put("a", Scalar.of(1L)).build()), StandardCharsets.UTF_8))
                .isEqualTo("a: 1\n");
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
