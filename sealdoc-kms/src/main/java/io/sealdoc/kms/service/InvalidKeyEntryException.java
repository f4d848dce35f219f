/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

/**
 * Thrown when a master key cannot be built from its metadata entry or textual reference.
 */
public class InvalidKeyEntryException extends KmsException {

    public InvalidKeyEntryException(String message) {
        super(message);
    }

    public InvalidKeyEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
