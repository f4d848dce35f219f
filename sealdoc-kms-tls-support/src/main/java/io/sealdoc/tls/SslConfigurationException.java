/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.tls;

/**
 * Thrown when TLS configuration for a backend client cannot be applied.
 */
public class SslConfigurationException extends RuntimeException {
    public SslConfigurationException(Exception cause) {
        super(cause);
    }

    public SslConfigurationException(String message) {
        super(message);
    }
}
