/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.sealdoc.plugin.Plugin;
import io.sealdoc.plugin.UnknownPluginInstanceException;

/**
 * Finds plugin implementations with {@link ServiceLoader}. An implementation can be referred to by its
 * fully qualified class name, or by its simple class name as long as that is unambiguous.
 * Implementations lacking a {@link Plugin} annotation are ignored.
 */
public class ServiceBasedPluginFactoryRegistry implements PluginFactoryRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ServiceBasedPluginFactoryRegistry.class);

    record ProviderAndConfigType(ServiceLoader.Provider<?> provider, Class<?> configType) {
        ProviderAndConfigType {
            Objects.requireNonNull(provider);
            Objects.requireNonNull(configType);
        }
    }

    private final Map<Class<?>, Map<String, ProviderAndConfigType>> providersByInterface = new ConcurrentHashMap<>();

    Map<String, ProviderAndConfigType> load(Class<?> pluginInterface) {
        Objects.requireNonNull(pluginInterface);
        return providersByInterface.computeIfAbsent(pluginInterface, ServiceBasedPluginFactoryRegistry::loadProviders);
    }

    private static Map<String, ProviderAndConfigType> loadProviders(Class<?> pluginInterface) {
        Map<String, Set<ProviderAndConfigType>> candidates = new HashMap<>();
        ServiceLoader.load(pluginInterface).stream().forEach(provider -> {
            Class<?> type = provider.type();
            Plugin annotation = type.getAnnotation(Plugin.class);
            if (annotation == null) {
                LOGGER.warn("Ignoring provider {} of {}: it has no @{} annotation", type, pluginInterface.getName(), Plugin.class.getSimpleName());
                return;
            }
            var entry = new ProviderAndConfigType(provider, annotation.configType());
            candidates.computeIfAbsent(type.getName(), k -> new LinkedHashSet<>()).add(entry);
            candidates.computeIfAbsent(type.getSimpleName(), k -> new LinkedHashSet<>()).add(entry);
        });
        var result = new HashMap<String, ProviderAndConfigType>();
        candidates.forEach((name, providers) -> {
            if (providers.size() == 1) {
                result.put(name, providers.iterator().next());
            }
            else {
                LOGGER.warn("'{}' is an ambiguous reference to a {} provider; it could be any of {}. Use the fully qualified name instead.",
                        name,
                        pluginInterface.getSimpleName(),
                        providers.stream().map(p -> p.provider().type().getName()).collect(Collectors.joining(", ")));
            }
        });
        return Collections.unmodifiableMap(result);
    }

    @Override
    public <P> PluginFactory<P> pluginFactory(Class<P> pluginClass) {
        var providersByName = load(pluginClass);
        return new PluginFactory<>() {
            @Override
            public P pluginInstance(String instanceName) {
                if (Objects.requireNonNull(instanceName).isEmpty()) {
                    throw new IllegalArgumentException("plugin instance name must not be empty");
                }
                return pluginClass.cast(lookup(instanceName).provider().get());
            }

            @Override
            public Class<?> configType(String instanceName) {
                return lookup(instanceName).configType();
            }

            @Override
            public Set<String> registeredInstanceNames() {
                return providersByName.keySet();
            }

            private ProviderAndConfigType lookup(String instanceName) {
                var provider = providersByName.get(instanceName);
                if (provider == null) {
                    throw new UnknownPluginInstanceException("Unknown " + pluginClass.getName() + " plugin instance for name '" + instanceName + "'. "
                            + "Known plugin instances are " + providersByName.keySet() + ". "
                            + "Plugins must be loadable by java.util.ServiceLoader and annotated with @" + Plugin.class.getSimpleName() + ".");
                }
                return provider;
            }
        };
    }
}
