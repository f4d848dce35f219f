/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A configured key management backend.
 *
 * @param type the backend's type identifier, e.g. {@code hc_vault}, or the class name of its service
 * @param config configuration of the backend, converted to the service's configuration type
 */
public record BackendDefinition(@JsonProperty(value = "type", required = true) String type,
                                @JsonProperty("config") @Nullable JsonNode config) {

    public BackendDefinition {
        Objects.requireNonNull(type);
    }
}
