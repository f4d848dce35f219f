/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import org.junit.jupiter.api.Test;

import io.sealdoc.kms.provider.inmemory.InMemoryMasterKeyService;
import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.UnknownPluginInstanceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceBasedPluginFactoryRegistryTest {

    @SuppressWarnings("rawtypes")
    private final PluginFactory<MasterKeyService> factory = new ServiceBasedPluginFactoryRegistry().pluginFactory(MasterKeyService.class);

    @Test
    void knownBySimpleAndQualifiedName() {
        assertThat(factory.registeredInstanceNames()).contains(
                "RecordingMasterKeyService", RecordingMasterKeyService.class.getName(),
                "InMemoryMasterKeyService", InMemoryMasterKeyService.class.getName());
        assertThat(factory.pluginInstance("RecordingMasterKeyService")).isInstanceOf(RecordingMasterKeyService.class);
        assertThat(factory.pluginInstance(InMemoryMasterKeyService.class.getName())).isInstanceOf(InMemoryMasterKeyService.class);
    }

    @Test
    void eachLookupCreatesAnInstance() {
        assertThat(factory.pluginInstance("RecordingMasterKeyService")).isNotSameAs(factory.pluginInstance("RecordingMasterKeyService"));
    }

    @Test
    void configTypeFromAnnotation() {
        assertThat(factory.configType("RecordingMasterKeyService")).isEqualTo(RecordingMasterKeyService.Config.class);
        assertThat(factory.configType("InMemoryMasterKeyService")).isEqualTo(Void.class);
    }

    @Test
    void unknownName() {
        assertThatThrownBy(() -> factory.pluginInstance("NoSuchService"))
                .isInstanceOf(UnknownPluginInstanceException.class)
                .hasMessageContaining("NoSuchService")
                .hasMessageContaining("RecordingMasterKeyService");
        assertThatThrownBy(() -> factory.pluginInstance(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
