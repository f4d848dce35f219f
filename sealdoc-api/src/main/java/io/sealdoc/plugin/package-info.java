/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * <p>Sealdoc backends are plugins. A plugin implementation is discovered with {@link java.util.ServiceLoader}
 * and must carry the {@link io.sealdoc.plugin.Plugin} annotation naming the type of its configuration record.</p>
 */
package io.sealdoc.plugin;
