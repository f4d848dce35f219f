/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

/**
 * The document carries no metadata, so it is possibly plaintext.
 */
public class MetadataNotFoundException extends SealdocException {

    public MetadataNotFoundException(String message) {
        super(message);
    }
}
