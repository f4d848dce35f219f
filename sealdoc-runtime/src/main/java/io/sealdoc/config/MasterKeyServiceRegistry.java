/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.kms.service.MasterKeyService;
import io.sealdoc.plugin.UnknownPluginInstanceException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>The initialised {@link MasterKeyService}s, looked up by the type identifier their keys are stored under.</p>
 *
 * <p>Services come from three places: backends named in the configuration, services registered directly,
 * and, on first use, any discoverable service whose configuration type is {@link Void} and so needs no configuration.</p>
 */
@ThreadSafe
public class MasterKeyServiceRegistry implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MasterKeyServiceRegistry.class);

    private final ConfigParser configParser;
    @SuppressWarnings("rawtypes")
    private final PluginFactory<MasterKeyService> pluginFactory;
    private final Map<String, MasterKeyService<?>> services = new LinkedHashMap<>();
    @Nullable
    private Map<String, String> pluginNamesByType;

    public MasterKeyServiceRegistry(@NonNull ConfigParser configParser) {
        this.configParser = Objects.requireNonNull(configParser);
        this.pluginFactory = configParser.pluginFactory(MasterKeyService.class);
    }

    /**
     * @param configParser the parser
     * @param configuration the configuration
     * @return a registry holding the configured backends, initialised
     */
    public static MasterKeyServiceRegistry fromConfiguration(@NonNull ConfigParser configParser, @NonNull Configuration configuration) {
        var registry = new MasterKeyServiceRegistry(configParser);
        try {
            configuration.backends().forEach(registry::configure);
        }
        catch (RuntimeException e) {
            registry.close();
            throw e;
        }
        return registry;
    }

    /**
     * Creates, configures and registers the service for a backend definition.
     * @param definition backend definition
     * @return the service
     * @throws UnknownPluginInstanceException if no service is known by the definition's type
     * @throws IllegalArgumentException if the configuration is invalid, or the backend is already registered
     */
    @SuppressWarnings("unchecked")
    public synchronized MasterKeyService<?> configure(@NonNull BackendDefinition definition) {
        String pluginName = pluginName(definition.type());
        Class<?> configType = pluginFactory.configType(pluginName);
        MasterKeyService<Object> service = pluginFactory.pluginInstance(pluginName);
        service.initialize(configParser.convertConfig(definition.config(), configType));
        register(service);
        LOGGER.debug("configured {} backend", service.typeIdentifier());
        return service;
    }

    /**
     * Registers an initialised service.
     * @param service service
     * @return this registry
     * @throws IllegalArgumentException if a service for the same type identifier is already registered
     */
    public synchronized MasterKeyServiceRegistry register(@NonNull MasterKeyService<?> service) {
        String type = service.typeIdentifier();
        if (services.containsKey(type)) {
            throw new IllegalArgumentException("a backend of type '" + type + "' is already registered");
        }
        services.put(type, service);
        return this;
    }

    /**
     * @param typeIdentifier backend type identifier
     * @return the service, or empty if the backend is neither registered nor usable without configuration
     */
    @SuppressWarnings("unchecked")
    public synchronized Optional<MasterKeyService<?>> service(@NonNull String typeIdentifier) {
        MasterKeyService<?> service = services.get(typeIdentifier);
        if (service != null) {
            return Optional.of(service);
        }
        String pluginName = pluginNamesByType().get(typeIdentifier);
        if (pluginName == null || pluginFactory.configType(pluginName) != Void.class) {
            return Optional.empty();
        }
        MasterKeyService<Object> created = pluginFactory.pluginInstance(pluginName);
        created.initialize(null);
        services.put(typeIdentifier, created);
        LOGGER.debug("initialised {} backend with its default configuration", typeIdentifier);
        return Optional.of(created);
    }

    public synchronized Collection<MasterKeyService<?>> services() {
        return List.copyOf(services.values());
    }

    private String pluginName(String type) {
        return Optional.ofNullable(pluginNamesByType().get(type)).orElse(type);
    }

    private Map<String, String> pluginNamesByType() {
        if (pluginNamesByType == null) {
            var byType = new LinkedHashMap<String, String>();
            for (String name : pluginFactory.registeredInstanceNames()) {
                if (name.contains(".")) {
                    try (MasterKeyService<?> instance = pluginFactory.pluginInstance(name)) {
                        byType.putIfAbsent(instance.typeIdentifier(), name);
                    }
                }
            }
            pluginNamesByType = byType;
        }
        return pluginNamesByType;
    }

    @Override
    public synchronized void close() {
        var failures = new ArrayList<RuntimeException>();
        for (MasterKeyService<?> service : services.values()) {
            try {
                service.close();
            }
            catch (RuntimeException e) {
                LOGGER.warn("failed to close {} backend", service.typeIdentifier(), e);
                failures.add(e);
            }
        }
        services.clear();
        if (!failures.isEmpty()) {
            var e = new IllegalStateException("failed to close " + failures.size() + " backend(s)");
            failures.forEach(e::addSuppressed);
            throw e;
        }
    }
}
