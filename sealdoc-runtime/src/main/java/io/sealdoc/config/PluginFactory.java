/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.Set;

import io.sealdoc.plugin.UnknownPluginInstanceException;

/**
 * Creates instances of the implementations of one plugin interface.
 * @param <P> the plugin interface
 */
public interface PluginFactory<P> {

    /**
     * @param instanceName the fully qualified or simple class name of the implementation
     * @return a new instance of the implementation
     * @throws UnknownPluginInstanceException if no implementation has that name
     */
    P pluginInstance(String instanceName);

    /**
     * @param instanceName the fully qualified or simple class name of the implementation
     * @return the configuration type declared by the implementation's {@link io.sealdoc.plugin.Plugin} annotation
     * @throws UnknownPluginInstanceException if no implementation has that name
     */
    Class<?> configType(String instanceName);

    /**
     * @return the names instances can be created with
     */
    Set<String> registeredInstanceNames();
}
