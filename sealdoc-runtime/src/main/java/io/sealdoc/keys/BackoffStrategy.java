/*
 * Copyright Sealdoc Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.sealdoc.keys;

import java.time.Duration;

/**
 * How long to wait before retrying a backend operation.
 */
public interface BackoffStrategy {

    /**
     * @param failures how many consecutive times the operation has failed, 0 or greater
     * @return the delay before the next attempt
     * @throws IllegalArgumentException if failures is negative
     */
    Duration getDelay(int failures);
}
