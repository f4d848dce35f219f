/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

/**
 * An encrypted value failed GCM authentication. Either it was tampered with, it was
 * moved from the location it was encrypted at, or the wrong data key was used.
 */
public class AuthenticationFailureException extends SealdocException {

    private final String path;

    public AuthenticationFailureException(String path, Throwable cause) {
        super("value at '" + path + "' failed authentication", cause);
        this.path = path;
    }

    /**
     * @return the additional authenticated data the value was checked against: the path of the value,
     * or the last modified timestamp for the document MAC.
     */
    public String path() {
        return path;
    }
}
