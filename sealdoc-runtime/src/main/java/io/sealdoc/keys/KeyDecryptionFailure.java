/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.keys;

/**
 * Why a master key could not unwrap a data key.
 *
 * @param type backend type identifier
 * @param keyId key id
 * @param message description of the failure
 */
public record KeyDecryptionFailure(String type, String keyId, String message) {}
