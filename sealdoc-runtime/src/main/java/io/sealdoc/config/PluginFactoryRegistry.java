/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import edu.umd.cs.findbugs.annotations.NonNull;

public interface PluginFactoryRegistry {

    /**
     * @param pluginClass the plugin interface
     * @return the factory for implementations of the interface
     * @param <P> the plugin interface
     */
    <P> @NonNull PluginFactory<P> pluginFactory(@NonNull Class<P> pluginClass);
}
