/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.metadata;

import java.util.List;
import java.util.Objects;

import io.sealdoc.kms.service.MasterKey;

/**
 * The master keys of one backend that hold a copy of a document's data key.
 *
 * @param name type identifier of the backend, e.g. {@code kms} or {@code pgp}
 * @param keys the keys, in the order they are tried and written
 */
public record KeySource(String name, List<MasterKey> keys) {

    public KeySource {
        Objects.requireNonNull(name);
        keys = List.copyOf(keys);
    }

    public KeySource withKeys(List<MasterKey> newKeys) {
        return new KeySource(name, newKeys);
    }
}
