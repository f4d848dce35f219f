/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

/**
 * A value of a type that cannot be encrypted and restored exactly, such as binary data or
 * an integer wider than 64 bits.
 */
public class UnsupportedValueException extends SealdocException {

    public UnsupportedValueException(String message) {
        super(message);
    }
}
