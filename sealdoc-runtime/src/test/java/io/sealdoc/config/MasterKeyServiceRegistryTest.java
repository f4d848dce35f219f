/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.sealdoc.kms.provider.inmemory.InMemoryMasterKeyService;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.UnknownPluginInstanceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MasterKeyServiceRegistryTest {

    private final ConfigParser configParser = new ConfigParser();

    @Test
    void configuresBackendsByTypeIdentifier() {
        Configuration configuration = configParser.parseConfiguration("""
                backends:
                - type: recording
                  config:
                    endpoint: https://kms.example.com
                """);

        try (var registry = MasterKeyServiceRegistry.fromConfiguration(configParser, configuration)) {
            MasterKeyService<?> service = registry.service(RecordingMasterKeyService.TYPE).orElseThrow();
            assertThat(service).isInstanceOf(RecordingMasterKeyService.class);
            assertThat(((RecordingMasterKeyService) service).config())
                    .isEqualTo(new RecordingMasterKeyService.Config("https://kms.example.com", null));
        }
    }

    @Test
    void configuresBackendsByClassName() {
        try (var registry = new MasterKeyServiceRegistry(configParser)) {
            registry.configure(new BackendDefinition("InMemoryMasterKeyService", null));

            assertThat(registry.services()).singleElement().isInstanceOf(InMemoryMasterKeyService.class);
        }
    }

    @Test
    void unconfiguredBackendWithoutConfigIsCreatedOnDemand() {
        try (var registry = new MasterKeyServiceRegistry(configParser)) {
            assertThat(registry.service(InMemoryMasterKeyService.TYPE)).get().isInstanceOf(InMemoryMasterKeyService.class);
            assertThat(registry.service(InMemoryMasterKeyService.TYPE).orElseThrow()).isSameAs(registry.service(InMemoryMasterKeyService.TYPE).orElseThrow());
        }
    }

    @Test
    void unconfiguredBackendThatNeedsConfigIsUnavailable() {
        try (var registry = new MasterKeyServiceRegistry(configParser)) {
            assertThat(registry.service(RecordingMasterKeyService.TYPE)).isEmpty();
            assertThat(registry.service("no_such_backend")).isEmpty();
        }
    }

    @Test
    void rejectsDuplicatesAndUnknownTypes() {
        try (var registry = new MasterKeyServiceRegistry(configParser)) {
            var first = new InMemoryMasterKeyService();
            first.initialize(null);
            registry.register(first);

            assertThatThrownBy(() -> registry.register(new InMemoryMasterKeyService()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("inmemory");
            assertThatThrownBy(() -> registry.configure(new BackendDefinition("no_such_backend", null)))
                    .isInstanceOf(UnknownPluginInstanceException.class);
        }
    }

    @Test
    void invalidBackendConfigIsRejected() {
        Configuration configuration = configParser.parseConfiguration("""
                backends:
                - type: recording
                  config:
                    region: eu-west-1
                """);

        assertThatThrownBy(() -> MasterKeyServiceRegistry.fromConfiguration(configParser, configuration))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closesServices() {
        var service = new RecordingMasterKeyService();
        var registry = new MasterKeyServiceRegistry(configParser).register(service);

        registry.close();

        assertThat(service.isClosed()).isTrue();
        assertThat(registry.services()).isEqualTo(List.of());
    }

    @Test
    void creationRuleKeysComeFromRegisteredBackends() {
        try (var registry = new MasterKeyServiceRegistry(configParser)) {
            var rule = new CreationRule(null, null, null, null, null, Map.of(InMemoryMasterKeyService.TYPE, List.of("k1", "k2, k3")));

            assertThat(rule.keySources(registry)).singleElement()
                    .satisfies(source -> assertThat(source.keys()).extracting(k -> k.keyId()).containsExactly("k1", "k2", "k3"));
            var unavailable = new CreationRule(null, null, null, null, null, Map.of(RecordingMasterKeyService.TYPE, List.of("x")));
            assertThatThrownBy(() -> unavailable.keySources(registry)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
