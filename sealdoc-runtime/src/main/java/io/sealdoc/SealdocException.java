/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

/**
 * Base type of the errors raised while encrypting, decrypting or re-keying a document.
 */
public class SealdocException extends RuntimeException {

    public SealdocException(String message) {
        super(message);
    }

    public SealdocException(String message, Throwable cause) {
        super(message, cause);
    }
}
