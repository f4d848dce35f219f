/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.kms.service;

/**
 * Thrown when a backend is asked to use a key that it does not manage.
 * Retrying will not help, so callers treat it as final for that master key.
 */
public class UnknownKeyException extends KmsException {
    public UnknownKeyException() {
        super();
    }

    public UnknownKeyException(String message) {
        super(message);
    }
}
