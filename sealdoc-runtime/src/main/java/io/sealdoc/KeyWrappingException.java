/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

import java.util.List;
import java.util.stream.Collectors;

import io.sealdoc.keys.KeyWrappingFailure;

/**
 * At least one master key failed to wrap a data key, so no keys were updated.
 */
public class KeyWrappingException extends SealdocException {

    private final List<KeyWrappingFailure> failures;

    public KeyWrappingException(List<KeyWrappingFailure> failures) {
        super(failures.stream()
                .map(f -> f.type() + " " + f.keyId() + ": " + f.message())
                .collect(Collectors.joining("; ", "Failed to wrap the data key with " + failures.size() + " master key(s): ", "")));
        this.failures = List.copyOf(failures);
    }

    public List<KeyWrappingFailure> failures() {
        return failures;
    }
}
