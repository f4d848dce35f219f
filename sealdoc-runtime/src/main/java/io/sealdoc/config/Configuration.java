/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.sealdoc.keys.KeyServiceOptions;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The root of the configuration.
 *
 * @param backends backends that need configuration
 * @param keyService how master keys are used
 * @param creationRules rules for new documents, in priority order
 */
public record Configuration(@JsonProperty("backends") @Nullable List<BackendDefinition> backends,
                            @JsonProperty("keyService") @Nullable KeyServiceOptions keyService,
                            @JsonProperty("creationRules") @Nullable List<CreationRule> creationRules) {

    public Configuration {
        backends = backends == null ? List.of() : List.copyOf(backends);
        keyService = Objects.requireNonNullElseGet(keyService, KeyServiceOptions::defaults);
        creationRules = creationRules == null ? List.of() : List.copyOf(creationRules);
    }

    /**
     * @param documentPath path of a new document
     * @return the first creation rule that applies to the document
     */
    public Optional<CreationRule> creationRuleFor(String documentPath) {
        return creationRules.stream().filter(rule -> rule.appliesTo(documentPath)).findFirst();
    }
}
