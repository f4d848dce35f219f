/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

public class DocumentAlreadyEncryptedException extends SealdocException {

    public DocumentAlreadyEncryptedException(String message) {
        super(message);
    }
}
