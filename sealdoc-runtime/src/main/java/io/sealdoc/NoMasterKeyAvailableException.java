/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

import java.util.List;
import java.util.stream.Collectors;

import io.sealdoc.keys.KeyDecryptionFailure;

/**
 * None of the master keys of a document could unwrap its data key.
 */
public class NoMasterKeyAvailableException extends SealdocException {

    private final List<KeyDecryptionFailure> failures;

    public NoMasterKeyAvailableException(List<KeyDecryptionFailure> failures) {
        super(message(failures));
        this.failures = List.copyOf(failures);
    }

    private static String message(List<KeyDecryptionFailure> failures) {
        if (failures.isEmpty()) {
            return "Failed to get the data key: the document has no master keys";
        }
        return failures.stream()
                .map(f -> "  " + f.type() + " " + f.keyId() + ": " + f.message())
                .collect(Collectors.joining("\n", "Failed to get the data key required to decrypt the document. Tried " + failures.size() + " key(s):\n", ""));
    }

    /**
     * @return one entry for every master key that was tried, in the order they were tried.
     */
    public List<KeyDecryptionFailure> failures() {
        return failures;
    }
}
