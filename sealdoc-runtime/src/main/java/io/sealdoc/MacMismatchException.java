/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

/**
 * The MAC computed over a document's values differs from the one stored in its metadata.
 */
public class MacMismatchException extends SealdocException {

    public MacMismatchException(String message) {
        super(message);
    }

    public MacMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
