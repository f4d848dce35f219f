/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc;

/**
 * @param ignoreMac report a missing or mismatching MAC as a warning rather than failing
 */
public record DecryptOptions(boolean ignoreMac) {

    public static final DecryptOptions DEFAULT = new DecryptOptions(false);
}
