/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.keys;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * How master keys are used to wrap and unwrap data keys.
 *
 * @param timeout how long a single key may take to wrap or unwrap, retries included
 * @param retries how many times a failed operation is retried; unknown keys are never retried
 * @param parallel whether unwrapping tries every key at once rather than one after the other
 * @param decryptionOrder backend type identifiers to try first when unwrapping, in order
 */
public record KeyServiceOptions(@JsonProperty("timeout") @Nullable Duration timeout,
                                @JsonProperty("retries") @Nullable Integer retries,
                                @JsonProperty("parallel") @Nullable Boolean parallel,
                                @JsonProperty("decryptionOrder") @Nullable List<String> decryptionOrder) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);
    public static final int DEFAULT_RETRIES = 2;

    public KeyServiceOptions {
        timeout = Objects.requireNonNullElse(timeout, DEFAULT_TIMEOUT);
        retries = Objects.requireNonNullElse(retries, DEFAULT_RETRIES);
        parallel = Objects.requireNonNullElse(parallel, false);
        decryptionOrder = decryptionOrder == null ? List.of() : List.copyOf(decryptionOrder);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative");
        }
    }

    public static KeyServiceOptions defaults() {
        return new KeyServiceOptions(null, null, null, null);
    }
}
